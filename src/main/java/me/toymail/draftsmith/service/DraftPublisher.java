package me.toymail.draftsmith.service;

import jakarta.mail.Flags;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import me.toymail.draftsmith.MailStore;
import me.toymail.draftsmith.PublishException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * Stages a reply as a draft. Draft folder names differ between providers,
 * so candidates are tried in order and the inbox is the last resort.
 */
public final class DraftPublisher {
    private static final Logger log = LoggerFactory.getLogger(DraftPublisher.class);
    private static final Flags DRAFT = new Flags(Flags.Flag.DRAFT);

    private final MailStore mailStore;
    private final String account;
    private final List<String> draftFolders;
    private final Clock clock;
    private final Session session = Session.getInstance(new Properties());

    private record Attempt(AppendResult result, MessagingException error) {}

    public DraftPublisher(MailStore mailStore, String account, List<String> draftFolders) {
        this(mailStore, account, draftFolders, Clock.systemDefaultZone());
    }

    public DraftPublisher(MailStore mailStore, String account, List<String> draftFolders, Clock clock) {
        this.mailStore = mailStore;
        this.account = account;
        this.draftFolders = List.copyOf(draftFolders);
        this.clock = clock;
    }

    /**
     * Append the reply to the first folder that takes it. The inbox is
     * re-selected afterwards whatever the outcome.
     *
     * @throws PublishException if the session is lost or even the inbox refuses the draft
     */
    public DraftLocation publish(IncomingMessage message, String responseText) throws PublishException {
        byte[] raw = compose(message, responseText);
        try {
            for (String folder : draftFolders) {
                Attempt attempt = tryAppend(folder, raw);
                if (attempt.result() == AppendResult.ACCEPTED) {
                    log.info("Draft saved to {} folder for email from {}", folder, message.sender());
                    return new DraftLocation(folder, false);
                }
                if (attempt.result() == AppendResult.CONNECTION_LOST) {
                    throw new PublishException("Mailbox connection lost while saving draft to " + folder,
                            attempt.error());
                }
                log.debug("Draft folder {} unusable ({}): {}", folder, attempt.result(),
                        attempt.error().getMessage());
            }

            Attempt inbox = tryAppend(MailStore.INBOX, raw);
            if (inbox.result() == AppendResult.ACCEPTED) {
                log.warn("No draft folder accepted the reply; draft saved to {} for email from {}",
                        MailStore.INBOX, message.sender());
                return new DraftLocation(MailStore.INBOX, true);
            }
            throw new PublishException("Could not save draft to any of " + draftFolders + " or "
                    + MailStore.INBOX + " (" + inbox.result() + ")", inbox.error());
        } finally {
            resetSelection();
        }
    }

    private Attempt tryAppend(String folder, byte[] raw) {
        try {
            mailStore.selectFolder(folder);
            mailStore.append(folder, DRAFT, new Date(clock.millis()), raw);
            return new Attempt(AppendResult.ACCEPTED, null);
        } catch (MessagingException e) {
            return new Attempt(AppendResult.classify(e), e);
        }
    }

    private void resetSelection() {
        try {
            mailStore.selectFolder(MailStore.INBOX);
        } catch (MessagingException e) {
            log.error("Failed to re-select {} after saving draft: {}", MailStore.INBOX, e.getMessage());
        }
    }

    byte[] compose(IncomingMessage message, String responseText) throws PublishException {
        try {
            MimeMessage draft = new MimeMessage(session);
            draft.setFrom(new InternetAddress(account));
            draft.setRecipients(Message.RecipientType.TO, InternetAddress.parse(message.sender()));
            draft.setSubject("Re: " + message.subject(), "UTF-8");
            draft.setText(responseText, "UTF-8");
            draft.setSentDate(new Date(clock.millis()));
            if (message.messageId() != null) {
                draft.setHeader("In-Reply-To", message.messageId());
                String refs = message.references() != null
                        ? message.references() + " " + message.messageId()
                        : message.messageId();
                draft.setHeader("References", refs);
            }
            draft.saveChanges();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            draft.writeTo(out);
            return out.toByteArray();
        } catch (MessagingException | IOException e) {
            throw new PublishException("Failed to compose draft for " + message.sender(), e);
        }
    }
}
