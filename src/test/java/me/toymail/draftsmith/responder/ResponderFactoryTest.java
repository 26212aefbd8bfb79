package me.toymail.draftsmith.responder;

import me.toymail.draftsmith.ConfigException;
import me.toymail.draftsmith.config.AssistantConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResponderFactoryTest {

    private static AssistantConfig config() {
        AssistantConfig cfg = new AssistantConfig();
        cfg.email = "me@example.com";
        cfg.imapServer = "imap.example.com";
        return cfg;
    }

    @Test
    public void testCreate_Anthropic() throws Exception {
        AssistantConfig cfg = config();
        cfg.claudeModelName = "claude-3-5-sonnet-latest";
        cfg.anthropicApiKey = "sk-ant";

        Responder responder = ResponderFactory.create(cfg);

        assertInstanceOf(AnthropicResponder.class, responder);
        assertEquals("anthropic", responder.providerId());
        assertEquals(new ModelConfig("claude-3-5-sonnet-latest", 1000, 0.7), ResponderFactory.modelConfig(cfg));
    }

    @Test
    public void testCreate_OpenAiWinsWhenBothConfigured() throws Exception {
        AssistantConfig cfg = config();
        cfg.claudeModelName = "claude-3-5-sonnet-latest";
        cfg.anthropicApiKey = "sk-ant";
        cfg.openaiModelName = "gpt-4o";
        cfg.openaiApiKey = "sk-openai";
        cfg.maxTokens = 250;
        cfg.temperature = 0.2;

        Responder responder = ResponderFactory.create(cfg);

        assertInstanceOf(OpenAiResponder.class, responder);
        assertEquals("openai", responder.providerId());
        assertEquals(new ModelConfig("gpt-4o", 250, 0.2), ResponderFactory.modelConfig(cfg));
    }

    @Test
    public void testCreate_OpenAiCompatibleBaseUrl() throws Exception {
        AssistantConfig cfg = config();
        cfg.openaiModelName = "llama3";
        cfg.openaiApiKey = "none";
        cfg.openaiBaseUrl = "http://localhost:11434/v1";

        assertEquals("openai-compatible", ResponderFactory.create(cfg).providerId());
    }

    @Test
    public void testCreate_NoModelConfigured() {
        ConfigException e = assertThrows(ConfigException.class, () -> ResponderFactory.create(config()));
        assertTrue(e.getMessage().contains("No AI model"));
    }

    @Test
    public void testCreate_MissingKey() {
        AssistantConfig cfg = config();
        cfg.openaiModelName = "gpt-4o";

        assertThrows(ConfigException.class, () -> ResponderFactory.create(cfg));
    }
}
