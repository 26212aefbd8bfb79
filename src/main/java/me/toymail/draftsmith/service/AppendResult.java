package me.toymail.draftsmith.service;

import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.FolderClosedException;
import jakarta.mail.FolderNotFoundException;
import jakarta.mail.MessagingException;
import jakarta.mail.StoreClosedException;

/**
 * Outcome of trying to append a draft into one folder.
 */
public enum AppendResult {
    ACCEPTED,
    /** Folder does not exist on this server. */
    FOLDER_MISSING,
    /** Folder exists but the server refused the select or append. */
    REJECTED,
    /** Session or credentials are gone; no other folder can succeed either. */
    CONNECTION_LOST;

    public static AppendResult classify(MessagingException e) {
        if (e instanceof FolderNotFoundException) return FOLDER_MISSING;
        if (e instanceof StoreClosedException
                || e instanceof FolderClosedException
                || e instanceof AuthenticationFailedException) {
            return CONNECTION_LOST;
        }
        return REJECTED;
    }
}
