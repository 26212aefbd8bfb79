package me.toymail.draftsmith.store;

import java.io.IOException;

/**
 * Reading or writing a state document failed.
 * In-memory state may already hold the mutation that failed to persist.
 */
public final class StorageException extends IOException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
