package me.toymail.draftsmith;

/**
 * Missing or invalid configuration. Fatal at startup.
 */
public final class ConfigException extends AssistantException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
