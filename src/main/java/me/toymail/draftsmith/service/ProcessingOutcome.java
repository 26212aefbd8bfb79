package me.toymail.draftsmith.service;

/**
 * How one message's processing ended.
 */
public record ProcessingOutcome(Status status, String responseText, DraftLocation location,
                                Stage failedAt, String reason) {

    public enum Status {
        PUBLISHED,
        /** Reply was already in history; only the read flag was (re)applied. */
        ALREADY_RECORDED,
        FAILED
    }

    public enum Stage {
        RESPOND, PUBLISH, RECORD, FLAG,
        /** A collaborator threw something unchecked. */
        UNEXPECTED
    }

    public static ProcessingOutcome published(String responseText, DraftLocation location) {
        return new ProcessingOutcome(Status.PUBLISHED, responseText, location, null, null);
    }

    public static ProcessingOutcome alreadyRecorded() {
        return new ProcessingOutcome(Status.ALREADY_RECORDED, null, null, null, null);
    }

    public static ProcessingOutcome failed(Stage stage, String reason) {
        return new ProcessingOutcome(Status.FAILED, null, null, stage, reason);
    }

    public boolean isSuccess() {
        return status != Status.FAILED;
    }
}
