package me.toymail.draftsmith.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * System prompt plus operator-added instructions and example responses.
 * Stored as training_context.json; the lists only ever grow.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TrainingContext {

    @JsonProperty("system_prompt")
    public String systemPrompt = "";

    @JsonProperty("additional_instructions")
    public List<Instruction> additionalInstructions = new ArrayList<>();

    @JsonProperty("example_responses")
    public List<ExampleResponse> exampleResponses = new ArrayList<>();

    public TrainingContext() {}

    public TrainingContext(String systemPrompt) {
        this.systemPrompt = systemPrompt != null ? systemPrompt : "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Instruction {
        public String timestamp;        // ISO-8601 local date-time
        public String instruction;

        public Instruction() {}

        public Instruction(String timestamp, String instruction) {
            this.timestamp = timestamp;
            this.instruction = instruction;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ExampleResponse {
        public String timestamp;
        public String sender;
        public String subject;

        @JsonProperty("original_content")
        public String originalContent;

        public String response;

        public ExampleResponse() {}

        public ExampleResponse(String timestamp, String sender, String subject,
                               String originalContent, String response) {
            this.timestamp = timestamp;
            this.sender = sender;
            this.subject = subject;
            this.originalContent = originalContent;
            this.response = response;
        }
    }
}
