package me.toymail.draftsmith;

/**
 * Could not connect or log in to the mailbox.
 */
public final class ConnectionException extends AssistantException {
    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
