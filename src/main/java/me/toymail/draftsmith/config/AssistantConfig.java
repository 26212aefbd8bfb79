package me.toymail.draftsmith.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Contents of config.yaml. Keys are snake_case; camelCase spellings are accepted too.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssistantConfig {

    public static final List<String> DEFAULT_DRAFT_FOLDERS =
            List.of("Drafts", "Draft", "[Gmail]/Drafts", "INBOX/Drafts");

    public String email;
    public String password;

    @JsonProperty("imap_server") @JsonAlias("imapServer")
    public String imapServer;

    @JsonProperty("imap_port") @JsonAlias("imapPort")
    public int imapPort = 993;

    @JsonProperty("imap_ssl") @JsonAlias("imapSsl")
    public boolean imapSsl = true;

    public List<String> blacklist = new ArrayList<>();

    @JsonProperty("mark_as_read") @JsonAlias("markAsRead")
    public boolean markAsRead = true;

    @JsonProperty("system_prompt") @JsonAlias("systemPrompt")
    public String systemPrompt = "";

    @JsonProperty("max_tokens") @JsonAlias("maxTokens")
    public int maxTokens = 1000;

    public double temperature = 0.7;

    @JsonProperty("claude_model_name") @JsonAlias("claudeModelName")
    public String claudeModelName;

    @JsonProperty("anthropic_api_key") @JsonAlias("anthropicApiKey")
    public String anthropicApiKey;

    @JsonProperty("openai_model_name") @JsonAlias("openaiModelName")
    public String openaiModelName;

    @JsonProperty("openai_api_key") @JsonAlias("openaiApiKey")
    public String openaiApiKey;

    @JsonProperty("openai_base_url") @JsonAlias("openaiBaseUrl")
    public String openaiBaseUrl;

    @JsonProperty("draft_folders") @JsonAlias("draftFolders")
    public List<String> draftFolders = new ArrayList<>(DEFAULT_DRAFT_FOLDERS);

    @JsonProperty("poll_interval_seconds") @JsonAlias("pollIntervalSeconds")
    public long pollIntervalSeconds = 300;

    @JsonProperty("retry_cooldown_seconds") @JsonAlias("retryCooldownSeconds")
    public long retryCooldownSeconds = 60;

    @JsonProperty("state_dir") @JsonAlias("stateDir")
    public String stateDir;

    public AssistantConfig() {}
}
