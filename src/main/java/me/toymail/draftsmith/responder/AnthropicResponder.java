package me.toymail.draftsmith.responder;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;

/**
 * Claude models through the Anthropic Messages API.
 */
public final class AnthropicResponder extends ChatModelResponder {

    private final String apiKey;

    public AnthropicResponder(String apiKey) {
        this.apiKey = apiKey;
    }

    @Override
    protected ChatModel createModel(ModelConfig modelConfig) {
        return AnthropicChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelConfig.modelName())
                .maxTokens(modelConfig.maxTokens())
                .temperature(modelConfig.temperature())
                .maxRetries(0)
                .timeout(TIMEOUT)
                .build();
    }

    @Override
    public String providerId() {
        return "anthropic";
    }
}
