package me.toymail.draftsmith.commands;

import me.toymail.draftsmith.ConfigException;
import me.toymail.draftsmith.store.StorageException;
import me.toymail.draftsmith.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.Console;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "credential", description = "Manage the mailbox password in the system keychain",
        subcommands = {CredentialCmd.Set.class, CredentialCmd.Status.class, CredentialCmd.Delete.class},
        footer = {
                "",
                "Commands:",
                "  draftsmith credential set      Save the mailbox password",
                "  draftsmith credential status   Check if a password is stored",
                "  draftsmith credential delete   Remove the stored password",
                "",
                "The system keychain (macOS Keychain, Windows Credential Manager,",
                "or Linux Secret Service) lets config.yaml leave out the password."
        })
public class CredentialCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(CredentialCmd.class);
    private final StoreContext context;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE",
            description = "Config file naming the account when --email is omitted")
    Path configPath;

    public CredentialCmd(StoreContext context) {
        this.context = context;
    }

    StoreContext context() {
        return context;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * The explicit address, or the one in config.yaml.
     */
    String account(String email) throws ConfigException {
        if (email != null && !email.isBlank()) {
            return email.trim();
        }
        if (configPath != null) {
            context.useConfig(configPath);
        }
        return context.config().email;
    }

    @Command(name = "set", description = "Save the mailbox password to the keychain")
    public static class Set implements Callable<Integer> {
        @ParentCommand
        private CredentialCmd parent;

        @Option(names = "--email", description = "Account (default: email from config.yaml)")
        String email;

        @Option(names = "--password", description = "Password (will prompt if not provided)")
        String password;

        @Override
        public Integer call() {
            StoreContext context = parent.context();
            if (!context.credentials().isAvailable()) {
                log.info("System keychain is not available on this system.");
                return 1;
            }
            try {
                String account = parent.account(email);
                String secret = password;
                if (secret == null || secret.isBlank()) {
                    Console console = System.console();
                    if (console == null) {
                        log.error("No console available for password input. Use --password flag.");
                        return 1;
                    }
                    char[] pw = console.readPassword("Password for %s: ", account);
                    if (pw == null) {
                        log.error("Password input cancelled.");
                        return 1;
                    }
                    secret = new String(pw);
                }
                context.credentials().save(account, secret);
                log.info("Password saved to system keychain for: {}", account);
                return 0;
            } catch (ConfigException e) {
                log.error("Configuration error: {}", e.getMessage());
                return 1;
            } catch (StorageException e) {
                log.error("{}", e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "Check whether a password is stored")
    public static class Status implements Callable<Integer> {
        @ParentCommand
        private CredentialCmd parent;

        @Option(names = "--email", description = "Account (default: email from config.yaml)")
        String email;

        @Override
        public Integer call() {
            StoreContext context = parent.context();
            if (!context.credentials().isAvailable()) {
                log.info("System keychain is not available on this system.");
                return 0;
            }
            try {
                String account = parent.account(email);
                boolean stored = context.credentials().find(account).isPresent();
                log.info("Password stored in system keychain: {}", stored ? "Yes" : "No");
                log.info("Account: {}", account);
                return 0;
            } catch (ConfigException e) {
                log.error("Configuration error: {}", e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "delete", description = "Remove the stored password")
    public static class Delete implements Callable<Integer> {
        @ParentCommand
        private CredentialCmd parent;

        @Option(names = "--email", description = "Account (default: email from config.yaml)")
        String email;

        @Override
        public Integer call() {
            StoreContext context = parent.context();
            if (!context.credentials().isAvailable()) {
                log.info("System keychain is not available on this system.");
                return 0;
            }
            try {
                String account = parent.account(email);
                if (context.credentials().remove(account)) {
                    log.info("Password removed from system keychain for: {}", account);
                } else {
                    log.info("No password was stored for: {}", account);
                }
                return 0;
            } catch (ConfigException e) {
                log.error("Configuration error: {}", e.getMessage());
                return 1;
            } catch (StorageException e) {
                log.error("{}", e.getMessage());
                return 1;
            }
        }
    }
}
