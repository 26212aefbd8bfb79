package me.toymail.draftsmith.store;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Mailbox passwords kept in the OS keychain under the {@code draftsmith} service,
 * so config.yaml can leave {@code password} empty.
 *
 * <p>Entries are keyed by mailbox address, trimmed and lower-cased:
 * {@code Me@Example.com} and {@code me@example.com} share one entry.
 */
public final class CredentialStore {
    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);
    static final String SERVICE_NAME = "draftsmith";

    // null when the platform has no keychain backend
    private final Keyring keyring;

    public CredentialStore() {
        this(openKeyring());
    }

    CredentialStore(Keyring keyring) {
        this.keyring = keyring;
    }

    private static Keyring openKeyring() {
        try {
            return Keyring.create();
        } catch (BackendNotSupportedException e) {
            log.debug("No keychain backend; passwords must come from config.yaml or the console: {}",
                    e.getMessage());
            return null;
        }
    }

    public boolean isAvailable() {
        return keyring != null;
    }

    /**
     * The stored password for the mailbox. Empty when nothing is stored,
     * the entry cannot be read, or there is no keychain.
     */
    public Optional<String> find(String mailbox) {
        if (keyring == null) {
            return Optional.empty();
        }
        String account = accountKey(mailbox);
        try {
            return Optional.ofNullable(keyring.getPassword(SERVICE_NAME, account));
        } catch (PasswordAccessException e) {
            log.debug("No keychain entry for {}: {}", account, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(String mailbox, String password) throws StorageException {
        Keyring kr = requireKeyring();
        String account = accountKey(mailbox);
        try {
            kr.setPassword(SERVICE_NAME, account, password);
            log.debug("Stored keychain entry for {}", account);
        } catch (PasswordAccessException e) {
            throw new StorageException("Failed to store password for " + account + " in the system keychain", e);
        }
    }

    /**
     * @return false when there was no entry to remove
     */
    public boolean remove(String mailbox) throws StorageException {
        Keyring kr = requireKeyring();
        String account = accountKey(mailbox);
        try {
            kr.deletePassword(SERVICE_NAME, account);
            log.debug("Removed keychain entry for {}", account);
            return true;
        } catch (PasswordAccessException e) {
            log.debug("Nothing removed for {}: {}", account, e.getMessage());
            return false;
        }
    }

    static String accountKey(String mailbox) {
        return mailbox.trim().toLowerCase(Locale.ROOT);
    }

    private Keyring requireKeyring() throws StorageException {
        if (keyring == null) {
            throw new StorageException("System keychain is not available", null);
        }
        return keyring;
    }
}
