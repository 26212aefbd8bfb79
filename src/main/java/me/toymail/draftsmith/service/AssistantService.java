package me.toymail.draftsmith.service;

import jakarta.mail.MessagingException;
import me.toymail.draftsmith.ConfigException;
import me.toymail.draftsmith.ConnectionException;
import me.toymail.draftsmith.ImapClient;
import me.toymail.draftsmith.MailStore;
import me.toymail.draftsmith.config.AssistantConfig;
import me.toymail.draftsmith.responder.ModelConfig;
import me.toymail.draftsmith.responder.Responder;
import me.toymail.draftsmith.responder.ResponderFactory;
import me.toymail.draftsmith.store.ContextStore;
import me.toymail.draftsmith.store.StorageException;
import me.toymail.draftsmith.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Console;
import java.time.Clock;

/**
 * Startup wiring. Any failure here is fatal: the caller exits non-zero.
 */
public final class AssistantService {
    private static final Logger log = LoggerFactory.getLogger(AssistantService.class);

    @FunctionalInterface
    public interface MailStoreConnector {
        MailStore connect(ImapClient.ImapConfig config) throws MessagingException;
    }

    @FunctionalInterface
    public interface ResponderProvider {
        Responder create(AssistantConfig config) throws ConfigException;
    }

    private final StoreContext context;
    private final MailStoreConnector connector;
    private final ResponderProvider responders;
    private final Sleeper sleeper;
    private final Clock clock;

    private MailStore mailStore;
    private ProcessingLoop loop;
    private ServiceHealth health;
    private ShutdownHandler shutdownHandler;

    public AssistantService(StoreContext context) {
        this(context, ImapClient::connect, ResponderFactory::create, Sleeper.THREAD, Clock.systemDefaultZone());
    }

    public AssistantService(StoreContext context, MailStoreConnector connector, ResponderProvider responders,
                            Sleeper sleeper, Clock clock) {
        this.context = context;
        this.connector = connector;
        this.responders = responders;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Config, password, connect, state, backend. Failures after the connect
     * log the session out before propagating.
     */
    public void start(Console console) throws ConfigException, ConnectionException, StorageException {
        AssistantConfig cfg = context.config();
        log.info("Loaded configuration for email: {}", cfg.email);
        log.info("Using IMAP server: {}:{}", cfg.imapServer, cfg.imapPort);
        String password = context.passwordResolver().resolve(cfg.password, cfg.email, console);

        try {
            mailStore = connector.connect(
                    new ImapClient.ImapConfig(cfg.imapServer, cfg.imapPort, cfg.imapSsl, cfg.email, password));
        } catch (MessagingException e) {
            throw new ConnectionException("Failed to connect to " + cfg.imapServer + " as " + cfg.email
                    + ": " + e.getMessage(), e);
        }

        ContextStore contextStore;
        Responder responder;
        ModelConfig modelConfig;
        try {
            contextStore = context.contextStore();
            responder = responders.create(cfg);
            modelConfig = ResponderFactory.modelConfig(cfg);
        } catch (ConfigException | StorageException e) {
            logoutQuietly();
            throw e;
        }

        health = new ServiceHealth(clock, context.documents());
        MessageExtractor extractor = new MessageExtractor(mailStore, new MessageFilter(cfg.blacklist));
        DraftPublisher publisher = new DraftPublisher(mailStore, cfg.email, cfg.draftFolders, clock);
        loop = new ProcessingLoop(extractor, contextStore, new ContextAssembler(), responder, modelConfig,
                publisher, mailStore, LoopSettings.from(cfg), health, sleeper);
        shutdownHandler = new ShutdownHandler(loop, mailStore);
        log.info("Initialized {} email assistant", responder.providerId());
    }

    public ProcessingLoop loop() {
        requireStarted();
        return loop;
    }

    public ServiceHealth health() {
        requireStarted();
        return health;
    }

    public ShutdownHandler shutdownHandler() {
        requireStarted();
        return shutdownHandler;
    }

    private void logoutQuietly() {
        try {
            mailStore.logout();
        } catch (MessagingException e) {
            log.warn("Logout after failed startup did not complete: {}", e.getMessage());
        }
    }

    private void requireStarted() {
        if (loop == null) {
            throw new IllegalStateException("AssistantService.start() has not completed");
        }
    }
}
