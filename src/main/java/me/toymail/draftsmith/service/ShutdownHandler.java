package me.toymail.draftsmith.service;

import jakarta.mail.MessagingException;
import me.toymail.draftsmith.MailStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops the loop and logs out of the mailbox. Runs at most once; later calls are ignored.
 */
public final class ShutdownHandler implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ShutdownHandler.class);

    private final AtomicBoolean called = new AtomicBoolean(false);
    private final ProcessingLoop loop;
    private final MailStore mailStore;

    public ShutdownHandler(ProcessingLoop loop, MailStore mailStore) {
        this.loop = loop;
        this.mailStore = mailStore;
    }

    @Override
    public void run() {
        shutdown();
    }

    /**
     * @return true if this call did the work, false if an earlier call already had
     */
    public boolean shutdown() {
        if (!called.compareAndSet(false, true)) {
            return false;
        }
        log.info("Stopping service...");
        if (loop != null) {
            loop.stop();
        }
        if (mailStore != null) {
            try {
                mailStore.logout();
            } catch (MessagingException e) {
                log.error("Error during IMAP logout: {}", e.getMessage());
            }
        }
        return true;
    }

    public boolean hasRun() {
        return called.get();
    }

    /**
     * Register with the JVM so SIGTERM/SIGINT trigger a clean logout. A signal-driven
     * shutdown exits with status 0; if the process was already shutting down on its
     * own, the exit status it chose is kept.
     */
    public Thread registerShutdownHook() {
        Thread hook = new Thread(() -> {
            if (shutdown()) {
                log.info("Shutdown complete");
                Runtime.getRuntime().halt(0);
            }
        }, "draftsmith-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }
}
