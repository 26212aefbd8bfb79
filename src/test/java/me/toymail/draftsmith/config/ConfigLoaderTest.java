package me.toymail.draftsmith.config;

import me.toymail.draftsmith.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws Exception {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    public void testLoad_FullConfigWithDefaults() throws Exception {
        Path file = write("""
                email: me@example.com
                password: secret
                imap_server: imap.example.com
                blacklist:
                  - noreply
                  - "  spam.com  "
                  - ""
                system_prompt: You are a helpful assistant.
                claude_model_name: claude-3-5-sonnet-latest
                anthropic_api_key: sk-ant
                """);

        AssistantConfig cfg = ConfigLoader.load(file);

        assertEquals("me@example.com", cfg.email);
        assertEquals("imap.example.com", cfg.imapServer);
        assertEquals(993, cfg.imapPort);
        assertTrue(cfg.imapSsl);
        assertTrue(cfg.markAsRead);
        assertEquals(1000, cfg.maxTokens);
        assertEquals(0.7, cfg.temperature, 1e-9);
        assertEquals(List.of("noreply", "spam.com"), cfg.blacklist);
        assertEquals(AssistantConfig.DEFAULT_DRAFT_FOLDERS, cfg.draftFolders);
        assertEquals(300, cfg.pollIntervalSeconds);
        assertEquals(60, cfg.retryCooldownSeconds);
        assertEquals(tempDir.toAbsolutePath().toString(), cfg.stateDir);
    }

    @Test
    public void testLoad_CamelCaseAliasesAccepted() throws Exception {
        Path file = write("""
                email: me@example.com
                imapServer: imap.example.com
                markAsRead: false
                openaiModelName: gpt-4o
                openaiApiKey: sk-openai
                draftFolders: [Brouillons]
                """);

        AssistantConfig cfg = ConfigLoader.load(file);

        assertEquals("imap.example.com", cfg.imapServer);
        assertFalse(cfg.markAsRead);
        assertEquals("gpt-4o", cfg.openaiModelName);
        assertEquals(List.of("Brouillons"), cfg.draftFolders);
    }

    @Test
    public void testLoad_MissingFile() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> ConfigLoader.load(tempDir.resolve("nope.yaml")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    public void testLoad_MissingEmail() throws Exception {
        Path file = write("imap_server: imap.example.com\n");

        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load(file));
        assertTrue(e.getMessage().contains("email"));
    }

    @Test
    public void testLoad_MissingImapServer() throws Exception {
        Path file = write("email: me@example.com\n");

        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load(file));
        assertTrue(e.getMessage().contains("imap_server"));
    }

    @Test
    public void testLoad_ClaudeModelWithoutKey() throws Exception {
        Path file = write("""
                email: me@example.com
                imap_server: imap.example.com
                claude_model_name: claude-3-5-sonnet-latest
                """);

        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load(file));
        assertTrue(e.getMessage().contains("Anthropic API key"));
    }

    @Test
    public void testLoad_MalformedYaml() throws Exception {
        Path file = write("email: [unterminated\n");

        assertThrows(ConfigException.class, () -> ConfigLoader.load(file));
    }

    @Test
    public void testLoad_ExplicitStateDirKept() throws Exception {
        Path state = tempDir.resolve("state");
        Path file = write("email: me@example.com\nimap_server: imap.example.com\nstate_dir: " + state + "\n");

        assertEquals(state.toString(), ConfigLoader.load(file).stateDir);
    }
}
