package me.toymail.draftsmith;

/**
 * A generated reply could not be staged in any folder.
 */
public final class PublishException extends AssistantException {
    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
