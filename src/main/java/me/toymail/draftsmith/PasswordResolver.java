package me.toymail.draftsmith;

import me.toymail.draftsmith.store.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Console;
import java.util.Optional;

/**
 * Resolves the mailbox password: config value, then keyring, then interactive prompt.
 */
public final class PasswordResolver {
    private static final Logger log = LoggerFactory.getLogger(PasswordResolver.class);

    private final CredentialStore credentialStore;

    public PasswordResolver(CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    /**
     * @param configuredPassword password from config.yaml (may be null)
     * @param email              the mailbox account
     * @param console            console for a prompt; null when running unattended
     * @throws ConfigException if no password is available
     */
    public String resolve(String configuredPassword, String email, Console console) throws ConfigException {
        if (configuredPassword != null && !configuredPassword.isBlank()) {
            log.debug("Using configured password for {}", email);
            return configuredPassword;
        }

        Optional<String> stored = credentialStore.find(email);
        if (stored.isPresent()) {
            log.debug("Using password from keyring for {}", email);
            return stored.get();
        }

        if (console == null) {
            throw new ConfigException(
                "Missing required configuration: password for " + email + ". " +
                "Set it in config.yaml or save it with 'draftsmith credential set'."
            );
        }

        log.debug("Prompting for password for {}", email);
        char[] pw = console.readPassword("Password for %s: ", email);
        if (pw == null) {
            throw new ConfigException("Password input cancelled");
        }
        return new String(pw);
    }
}
