package me.toymail.draftsmith.responder;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

/**
 * OpenAI chat models, or any OpenAI-compatible endpoint when a base URL is set.
 */
public final class OpenAiResponder extends ChatModelResponder {

    private final String apiKey;
    private final String baseUrl;

    public OpenAiResponder(String apiKey, String baseUrl) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
    }

    @Override
    protected ChatModel createModel(ModelConfig modelConfig) {
        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelConfig.modelName())
                .maxTokens(modelConfig.maxTokens())
                .temperature(modelConfig.temperature())
                .maxRetries(0)
                .timeout(TIMEOUT);
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    @Override
    public String providerId() {
        return baseUrl != null && !baseUrl.isBlank() ? "openai-compatible" : "openai";
    }
}
