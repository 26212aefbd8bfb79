package me.toymail.draftsmith.responder;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.toymail.draftsmith.ResponderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link Responder} over a LangChain4j {@link ChatModel}.
 * The model is built on first use and rebuilt only when the model config changes.
 */
public abstract class ChatModelResponder implements Responder {
    private static final Logger log = LoggerFactory.getLogger(ChatModelResponder.class);

    static final Duration TIMEOUT = Duration.ofSeconds(120);

    private ChatModel chatModel;
    private ModelConfig builtFor;

    /**
     * Build a model for the given config. Retries must be disabled; the
     * processing loop decides when a message is tried again.
     */
    protected abstract ChatModel createModel(ModelConfig modelConfig);

    @Override
    public synchronized String generate(String systemPrompt, String userContent, ModelConfig modelConfig)
            throws ResponderException {
        ChatModel model = modelFor(modelConfig);

        List<ChatMessage> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(userContent));

        ChatResponse response;
        try {
            response = model.chat(ChatRequest.builder().messages(messages).build());
        } catch (RuntimeException e) {
            throw new ResponderException(providerId() + " request failed: " + e.getMessage(), e);
        }
        if (response == null || response.aiMessage() == null) {
            throw new ResponderException(providerId() + " returned no message");
        }
        String text = response.aiMessage().text();
        log.debug("{} generated {} chars with {}", providerId(), text != null ? text.length() : 0,
                modelConfig.modelName());
        return text != null ? text : "";
    }

    private ChatModel modelFor(ModelConfig modelConfig) throws ResponderException {
        if (chatModel == null || !modelConfig.equals(builtFor)) {
            try {
                chatModel = createModel(modelConfig);
            } catch (RuntimeException e) {
                throw new ResponderException("Failed to initialize " + providerId() + " model: " + e.getMessage(), e);
            }
            builtFor = modelConfig;
            log.info("{} model initialized: {}", providerId(), modelConfig.modelName());
        }
        return chatModel;
    }
}
