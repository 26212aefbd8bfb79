package me.toymail.draftsmith.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import me.toymail.draftsmith.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and validates the YAML configuration file.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {}

    public static AssistantConfig load(Path configPath) throws ConfigException {
        if (!Files.exists(configPath)) {
            throw new ConfigException("Configuration file not found: " + configPath.toAbsolutePath());
        }
        AssistantConfig cfg;
        try {
            cfg = YAML.readValue(Files.readAllBytes(configPath), AssistantConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Configuration error: " + e.getMessage(), e);
        }
        if (cfg == null) {
            throw new ConfigException("Configuration file is empty: " + configPath.toAbsolutePath());
        }
        if (cfg.stateDir == null || cfg.stateDir.isBlank()) {
            Path parent = configPath.toAbsolutePath().getParent();
            cfg.stateDir = parent != null ? parent.toString() : ".";
        }
        normalize(cfg);
        validate(cfg);
        log.debug("Loaded configuration from {}", configPath);
        return cfg;
    }

    /**
     * Checks the fields the service cannot start without.
     * The password may be absent here; it can still come from the keyring.
     */
    public static void validate(AssistantConfig cfg) throws ConfigException {
        if (isBlank(cfg.email)) {
            throw new ConfigException("Missing required configuration: email");
        }
        if (isBlank(cfg.imapServer)) {
            throw new ConfigException("Missing required configuration: imap_server");
        }
        if (!isBlank(cfg.openaiModelName) && isBlank(cfg.openaiApiKey)) {
            throw new ConfigException("OpenAI API key is required when using OpenAI models");
        }
        if (!isBlank(cfg.claudeModelName) && isBlank(cfg.anthropicApiKey)) {
            throw new ConfigException("Anthropic API key is required when using Claude models");
        }
        if (cfg.maxTokens <= 0) {
            throw new ConfigException("max_tokens must be positive");
        }
        if (cfg.pollIntervalSeconds < 0 || cfg.retryCooldownSeconds < 0) {
            throw new ConfigException("poll_interval_seconds and retry_cooldown_seconds must not be negative");
        }
    }

    private static void normalize(AssistantConfig cfg) {
        if (cfg.blacklist == null) cfg.blacklist = new ArrayList<>();
        if (cfg.systemPrompt == null) cfg.systemPrompt = "";
        if (cfg.draftFolders == null || cfg.draftFolders.isEmpty()) {
            cfg.draftFolders = new ArrayList<>(AssistantConfig.DEFAULT_DRAFT_FOLDERS);
        }
        List<String> blacklist = new ArrayList<>();
        for (String entry : cfg.blacklist) {
            if (entry != null && !entry.isBlank()) blacklist.add(entry.trim());
        }
        cfg.blacklist = blacklist;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
