package me.toymail.draftsmith.service;

/**
 * One unread message picked up by a poll. Lives for a single cycle.
 *
 * @param uid          inbox UID
 * @param sender       bare sender address, lower-cased; history is keyed by it
 * @param senderHeader From header as received, display name included
 * @param replyTo      Reply-To header, or null
 * @param subject      subject, empty when the message has none
 * @param body         first text/plain part, or the decoded single-part payload
 * @param messageId    Message-ID header, or null
 * @param references   References header, or null
 */
public record IncomingMessage(long uid,
                              String sender,
                              String senderHeader,
                              String replyTo,
                              String subject,
                              String body,
                              String messageId,
                              String references) {}
