package me.toymail.draftsmith.service;

import jakarta.mail.MessagingException;

/**
 * The IMAP session dropped in the middle of a cycle. Nothing more can be done
 * until the cycle is retried, so this escapes to the outer loop.
 */
public final class MailConnectionLostException extends RuntimeException {
    public MailConnectionLostException(String message, MessagingException cause) {
        super(message, cause);
    }

    @Override
    public synchronized MessagingException getCause() {
        return (MessagingException) super.getCause();
    }
}
