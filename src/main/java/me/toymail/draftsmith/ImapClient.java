package me.toymail.draftsmith;

import jakarta.mail.*;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.FlagTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.*;

/**
 * {@link MailStore} over a single Jakarta Mail IMAP session.
 * The session is reused for the life of the process; {@link #reconnect()}
 * replaces the store after the server drops it.
 */
public final class ImapClient implements MailStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ImapClient.class);

    public record ImapConfig(String host, int port, boolean ssl, String username, String password) {}

    @FunctionalInterface
    interface StoreOpener {
        Store open(Session session, ImapConfig cfg) throws MessagingException;
    }

    private final Session session;
    private final ImapConfig cfg;
    private final StoreOpener opener;
    private Store store;
    private Folder selected;

    private ImapClient(Session session, ImapConfig cfg, StoreOpener opener, Store store, Folder selected) {
        this.session = session;
        this.cfg = cfg;
        this.opener = opener;
        this.store = store;
        this.selected = selected;
    }

    public static ImapClient connect(ImapConfig cfg) throws MessagingException {
        return connect(cfg, ImapClient::openStore);
    }

    static ImapClient connect(ImapConfig cfg, StoreOpener opener) throws MessagingException {
        Session session = Session.getInstance(sessionProperties(cfg));
        Store store = opener.open(session, cfg);
        log.info("Store connected: {}", store.getClass().getSimpleName());

        Folder inbox = openReadWrite(store, INBOX);
        return new ImapClient(session, cfg, opener, store, inbox);
    }

    private static Properties sessionProperties(ImapConfig cfg) {
        Properties props = new Properties();
        props.put("mail.store.protocol", cfg.ssl() ? "imaps" : "imap");

        props.put("mail.imaps.ssl.enable", String.valueOf(cfg.ssl()));
        props.put("mail.imaps.ssl.checkserveridentity", "true");
        props.put("mail.imaps.connectiontimeout", "15000");
        props.put("mail.imaps.timeout", "120000");
        props.put("mail.imaps.writetimeout", "60000");
        props.put("mail.imaps.usesocketchannels", "true");
        // BODY.PEEK: reading a message must not set \Seen
        props.put("mail.imaps.peek", "true");

        props.put("mail.imap.connectiontimeout", "15000");
        props.put("mail.imap.timeout", "120000");
        props.put("mail.imap.writetimeout", "60000");
        props.put("mail.imap.peek", "true");
        return props;
    }

    private static Store openStore(Session session, ImapConfig cfg) throws MessagingException {
        Store store = session.getStore(cfg.ssl() ? "imaps" : "imap");
        store.connect(cfg.host(), cfg.port(), cfg.username(), cfg.password());
        return store;
    }

    private static Folder openReadWrite(Store store, String name) throws MessagingException {
        requireConnected(store);
        Folder folder = store.getFolder(name);
        if (!folder.exists()) {
            throw new FolderNotFoundException(folder, "Folder does not exist: " + name);
        }
        folder.open(Folder.READ_WRITE);
        if (!(folder instanceof UIDFolder)) {
            folder.close(false);
            throw new MessagingException("Folder does not support UIDFolder; cannot use stable UIDs.");
        }
        log.debug("Opened {}", name);
        return folder;
    }

    @Override
    public synchronized void selectFolder(String name) throws MessagingException {
        if (selected != null && selected.isOpen() && name.equals(selected.getFullName())) {
            return;
        }
        if (selected != null && selected.isOpen()) {
            selected.close(false);
        }
        selected = null;
        selected = openReadWrite(store, name);
    }

    @Override
    public synchronized List<Long> search(SearchCriteria criteria) throws MessagingException {
        Folder folder = requireSelected();
        Message[] found = criteria == SearchCriteria.UNSEEN
                ? folder.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false))
                : folder.getMessages();
        if (found == null || found.length == 0) return List.of();

        FetchProfile fp = new FetchProfile();
        fp.add(UIDFolder.FetchProfileItem.UID);
        folder.fetch(found, fp);

        UIDFolder uidFolder = (UIDFolder) folder;
        List<Long> uids = new ArrayList<>(found.length);
        for (Message m : found) {
            uids.add(uidFolder.getUID(m));
        }
        Collections.sort(uids);
        log.debug("Search {} in {} matched {} messages", criteria, folder.getFullName(), uids.size());
        return uids;
    }

    @Override
    public synchronized byte[] fetch(long uid) throws MessagingException {
        Message m = messageByUid(uid);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            m.writeTo(out);
        } catch (IOException e) {
            throw new MessagingException("Failed to read message UID=" + uid, e);
        }
        return out.toByteArray();
    }

    @Override
    public synchronized void append(String folderName, Flags flags, Date internalDate, byte[] rawMessage)
            throws MessagingException {
        requireConnected(store);
        Folder folder = store.getFolder(folderName);
        if (!folder.exists()) {
            throw new FolderNotFoundException(folder, "Folder does not exist: " + folderName);
        }
        MimeMessage msg = new MimeMessage(session, new ByteArrayInputStream(rawMessage)) {
            @Override
            public Date getReceivedDate() {
                return internalDate;
            }
        };
        msg.setFlags(flags, true);
        folder.appendMessages(new Message[]{msg});
        log.debug("Appended message to {}", folderName);
    }

    @Override
    public synchronized void setFlag(long uid, Flags.Flag flag) throws MessagingException {
        messageByUid(uid).setFlag(flag, true);
    }

    @Override
    public synchronized void reconnect() throws MessagingException {
        if (!store.isConnected()) {
            log.info("IMAP session to {} was lost, reconnecting", cfg.host());
            selected = null;
            store = opener.open(session, cfg);
            log.info("Store reconnected: {}", store.getClass().getSimpleName());
        }
        selectFolder(INBOX);
    }

    @Override
    public void logout() throws MessagingException {
        close();
    }

    @Override
    public synchronized void close() throws MessagingException {
        try {
            if (selected != null && selected.isOpen()) selected.close(false);
        } finally {
            if (store != null && store.isConnected()) store.close();
        }
    }

    // getFolder on a dropped store throws IllegalStateException; surface it as a MessagingException
    private static void requireConnected(Store store) throws StoreClosedException {
        if (!store.isConnected()) {
            throw new StoreClosedException(store, "IMAP store is not connected");
        }
    }

    private Folder requireSelected() throws MessagingException {
        if (selected == null || !selected.isOpen()) {
            throw new FolderClosedException(selected, "No folder selected");
        }
        return selected;
    }

    private Message messageByUid(long uid) throws MessagingException {
        UIDFolder uidFolder = (UIDFolder) requireSelected();
        Message m = uidFolder.getMessageByUID(uid);
        if (m == null) throw new MessagingException("No message found for UID=" + uid);
        return m;
    }
}
