package me.toymail.draftsmith.service;

import me.toymail.draftsmith.store.ConversationHistory;
import me.toymail.draftsmith.store.TrainingContext;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Builds the prompt for one message. Output depends only on its inputs,
 * so identical stored state yields an identical prompt.
 */
public final class ContextAssembler {

    public static final int MAX_EXAMPLES = 5;
    public static final String NO_HISTORY = "No previous conversations found.";

    /**
     * @param history the sender's recent entries, or empty for an unknown sender
     */
    public PromptPayload assemble(IncomingMessage message, TrainingContext training,
                                  Optional<List<ConversationHistory.Entry>> history) {
        return new PromptPayload(systemText(training), userContent(message, training, history));
    }

    String systemText(TrainingContext training) {
        StringBuilder sb = new StringBuilder();
        sb.append(training.systemPrompt != null ? training.systemPrompt : "").append("\n\n");
        if (!training.additionalInstructions.isEmpty()) {
            sb.append("Additional Instructions:\n");
            for (TrainingContext.Instruction inst : training.additionalInstructions) {
                sb.append("- ").append(inst.instruction).append('\n');
            }
        }
        return sb.toString();
    }

    private String userContent(IncomingMessage message, TrainingContext training,
                               Optional<List<ConversationHistory.Entry>> history) {
        List<String> blocks = new ArrayList<>(3);

        List<TrainingContext.ExampleResponse> examples = recentExamples(training.exampleResponses);
        if (!examples.isEmpty()) {
            StringBuilder sb = new StringBuilder("Recent example responses:\n\n");
            for (TrainingContext.ExampleResponse ex : examples) {
                appendExchange(sb, ex.subject, ex.originalContent, ex.response);
            }
            blocks.add(sb.toString().stripTrailing());
        }

        StringBuilder hist = new StringBuilder("Previous conversations with this sender:\n");
        if (history.isPresent()) {
            for (ConversationHistory.Entry entry : history.get()) {
                appendExchange(hist, entry.subject, entry.content, entry.response);
            }
        } else {
            hist.append(NO_HISTORY);
        }
        blocks.add(hist.toString().stripTrailing());

        blocks.add("New email to respond to:\n"
                + "From: " + message.senderHeader() + "\n"
                + "Subject: " + message.subject() + "\n"
                + "Content: " + message.body());

        return String.join("\n\n", blocks);
    }

    /**
     * Newest first by timestamp; examples with equal timestamps keep their stored order.
     */
    static List<TrainingContext.ExampleResponse> recentExamples(List<TrainingContext.ExampleResponse> all) {
        Comparator<Integer> newestFirst = Comparator
                .comparing((Integer i) -> parseTimestamp(all.get(i).timestamp))
                .reversed()
                .thenComparing(i -> i);
        return IntStream.range(0, all.size())
                .boxed()
                .sorted(newestFirst)
                .limit(MAX_EXAMPLES)
                .map(all::get)
                .toList();
    }

    private static LocalDateTime parseTimestamp(String timestamp) {
        if (timestamp == null) return LocalDateTime.MIN;
        try {
            return LocalDateTime.parse(timestamp);
        } catch (DateTimeParseException e) {
            return LocalDateTime.MIN;
        }
    }

    private static void appendExchange(StringBuilder sb, String subject, String original, String response) {
        sb.append("Subject: ").append(subject).append('\n')
          .append("Original: ").append(original).append('\n')
          .append("Response: ").append(response).append("\n\n");
    }
}
