package me.toymail.draftsmith;

/**
 * The text-generation backend failed (quota, auth, network).
 */
public final class ResponderException extends AssistantException {
    public ResponderException(String message) {
        super(message);
    }

    public ResponderException(String message, Throwable cause) {
        super(message, cause);
    }
}
