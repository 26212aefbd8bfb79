package me.toymail.draftsmith;

/**
 * Base class for the failures the service reports by type.
 */
public class AssistantException extends Exception {
    public AssistantException(String message) {
        super(message);
    }

    public AssistantException(String message, Throwable cause) {
        super(message, cause);
    }
}
