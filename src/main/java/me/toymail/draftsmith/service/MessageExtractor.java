package me.toymail.draftsmith.service;

import jakarta.mail.*;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import me.toymail.draftsmith.MailStore;
import me.toymail.draftsmith.SearchCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Stream;

/**
 * Turns inbox messages into {@link IncomingMessage}s, dropping blacklisted
 * senders and anything that cannot be parsed.
 */
public final class MessageExtractor {
    private static final Logger log = LoggerFactory.getLogger(MessageExtractor.class);

    private final MailStore mailStore;
    private final MessageFilter filter;
    private final Session session = Session.getInstance(new Properties());

    public MessageExtractor(MailStore mailStore, MessageFilter filter) {
        this.mailStore = mailStore;
        this.filter = filter;
    }

    /**
     * Search the inbox and lazily fetch each match.
     * The stream is single-use; call again to re-query the mailbox.
     *
     * @throws MessagingException if the search itself fails
     * @throws MailConnectionLostException from the stream if the session drops mid-fetch
     */
    public Stream<IncomingMessage> fetchCandidates(SearchCriteria criteria) throws MessagingException {
        List<Long> uids = mailStore.search(criteria);
        log.info("Found {} {} messages", uids.size(), criteria);
        return uids.stream()
                .map(this::fetchAndExtract)
                .flatMap(Optional::stream);
    }

    private Optional<IncomingMessage> fetchAndExtract(long uid) {
        byte[] raw;
        try {
            raw = mailStore.fetch(uid);
        } catch (FolderClosedException | StoreClosedException e) {
            throw new MailConnectionLostException("Mailbox connection lost while fetching UID " + uid, e);
        } catch (MessagingException e) {
            log.warn("Error fetching email {}: {}", uid, e.getMessage());
            return Optional.empty();
        }
        return extract(uid, raw);
    }

    /**
     * Parse one raw message. Empty if blacklisted or undecodable.
     */
    public Optional<IncomingMessage> extract(long uid, byte[] raw) {
        try {
            MimeMessage msg = new MimeMessage(session, new ByteArrayInputStream(raw));

            Address[] froms = msg.getFrom();
            if (froms == null || froms.length == 0 || !(froms[0] instanceof InternetAddress from)) {
                log.warn("Skipping email {}: no sender", uid);
                return Optional.empty();
            }
            String sender = from.getAddress() != null ? from.getAddress().toLowerCase(Locale.ROOT) : "";
            String senderHeader = from.toUnicodeString();

            String replyTo = null;
            String rawReplyTo = msg.getHeader("Reply-To", ",");
            if (rawReplyTo != null && !rawReplyTo.isBlank()) {
                replyTo = InternetAddress.toUnicodeString(InternetAddress.parseHeader(rawReplyTo, false));
            }

            if (filter.isBlacklisted(sender, senderHeader, replyTo)) {
                log.debug("Skipping blacklisted email {} from {}", uid, senderHeader);
                return Optional.empty();
            }

            String subject = msg.getSubject() != null ? msg.getSubject() : "";
            String body = extractBody(msg);

            return Optional.of(new IncomingMessage(uid, sender, senderHeader, replyTo, subject, body,
                    msg.getMessageID(), msg.getHeader("References", " ")));
        } catch (MessagingException | IOException e) {
            log.warn("Error processing email {}: {}", uid, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * First text/plain part in depth-first order, or the whole payload when
     * the message is not multipart. Multipart without text/plain yields "".
     */
    static String extractBody(Part part) throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            String text = firstPlainText((Multipart) part.getContent());
            return text != null ? text : "";
        }
        return decode(part);
    }

    private static String firstPlainText(Multipart multipart) throws MessagingException, IOException {
        for (int i = 0; i < multipart.getCount(); i++) {
            BodyPart bodyPart = multipart.getBodyPart(i);
            if (bodyPart.isMimeType("text/plain")) {
                return decode(bodyPart);
            }
            if (bodyPart.isMimeType("multipart/*")) {
                String nested = firstPlainText((Multipart) bodyPart.getContent());
                if (nested != null) return nested;
            }
        }
        return null;
    }

    private static String decode(Part part) throws MessagingException, IOException {
        Object content = part.getContent();
        if (content instanceof String s) {
            return s;
        }
        if (content instanceof InputStream is) {
            try (is) {
                return new String(is.readAllBytes(), charsetOf(part));
            }
        }
        throw new MessagingException("Unsupported content " + content.getClass().getSimpleName()
                + " for " + part.getContentType());
    }

    private static Charset charsetOf(Part part) {
        try {
            String charset = new ContentType(part.getContentType()).getParameter("charset");
            if (charset != null) return Charset.forName(charset);
        } catch (Exception e) {
            log.debug("Unknown charset in '{}', using UTF-8", safeContentType(part));
        }
        return StandardCharsets.UTF_8;
    }

    private static String safeContentType(Part part) {
        try {
            return part.getContentType();
        } catch (MessagingException e) {
            return "?";
        }
    }
}
