package me.toymail.draftsmith;

import jakarta.mail.Flags;
import jakarta.mail.MessagingException;

import java.util.Date;
import java.util.List;

/**
 * Mailbox operations the processing loop relies on.
 * Message ids are the UIDs of the inbox folder.
 */
public interface MailStore {

    String INBOX = "INBOX";

    List<Long> search(SearchCriteria criteria) throws MessagingException;

    /**
     * Raw RFC 822 bytes of the message. Does not mark it as seen.
     */
    byte[] fetch(long uid) throws MessagingException;

    void append(String folder, Flags flags, Date internalDate, byte[] rawMessage) throws MessagingException;

    void setFlag(long uid, Flags.Flag flag) throws MessagingException;

    void selectFolder(String name) throws MessagingException;

    /**
     * Re-open the session if the server dropped it, then select INBOX again.
     * A live session with INBOX open is left as is.
     */
    void reconnect() throws MessagingException;

    void logout() throws MessagingException;
}
