package me.toymail.draftsmith.responder;

import me.toymail.draftsmith.ConfigException;
import me.toymail.draftsmith.config.AssistantConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the backend from the model-name keys in the configuration.
 * OpenAI is checked before Anthropic.
 */
public final class ResponderFactory {
    private static final Logger log = LoggerFactory.getLogger(ResponderFactory.class);

    private ResponderFactory() {}

    public static Responder create(AssistantConfig cfg) throws ConfigException {
        if (present(cfg.openaiModelName)) {
            if (!present(cfg.openaiApiKey)) {
                throw new ConfigException("OpenAI API key is required when using OpenAI models");
            }
            log.info("Initialized OpenAI responder with model {}", cfg.openaiModelName);
            return new OpenAiResponder(cfg.openaiApiKey, cfg.openaiBaseUrl);
        }
        if (present(cfg.claudeModelName)) {
            if (!present(cfg.anthropicApiKey)) {
                throw new ConfigException("Anthropic API key is required when using Claude models");
            }
            log.info("Initialized Claude responder with model {}", cfg.claudeModelName);
            return new AnthropicResponder(cfg.anthropicApiKey);
        }
        throw new ConfigException("No AI model specified in configuration");
    }

    /**
     * Generation parameters for whichever backend {@link #create} selects.
     */
    public static ModelConfig modelConfig(AssistantConfig cfg) throws ConfigException {
        String model = present(cfg.openaiModelName) ? cfg.openaiModelName : cfg.claudeModelName;
        if (!present(model)) {
            throw new ConfigException("No AI model specified in configuration");
        }
        return new ModelConfig(model, cfg.maxTokens, cfg.temperature);
    }

    private static boolean present(String s) {
        return s != null && !s.isBlank();
    }
}
