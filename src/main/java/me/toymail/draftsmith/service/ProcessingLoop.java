package me.toymail.draftsmith.service;

import jakarta.mail.Flags;
import jakarta.mail.MessagingException;
import me.toymail.draftsmith.MailStore;
import me.toymail.draftsmith.PublishException;
import me.toymail.draftsmith.ResponderException;
import me.toymail.draftsmith.responder.ModelConfig;
import me.toymail.draftsmith.responder.Responder;
import me.toymail.draftsmith.store.ContextStore;
import me.toymail.draftsmith.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Polls the inbox and turns each candidate into a draft reply.
 *
 * <p>Per message: assemble, generate, publish, record, flag read. A message is
 * flagged read only when every earlier step succeeded; otherwise it stays unseen
 * and the next cycle picks it up again. {@link #run()} repeats cycles until
 * {@link #stop()}, cooling down after any cycle that throws and re-establishing
 * the mail session before the next one.
 */
public final class ProcessingLoop {
    private static final Logger log = LoggerFactory.getLogger(ProcessingLoop.class);

    private final MessageExtractor extractor;
    private final ContextStore contextStore;
    private final ContextAssembler assembler;
    private final Responder responder;
    private final ModelConfig modelConfig;
    private final DraftPublisher publisher;
    private final MailStore mailStore;
    private final LoopSettings settings;
    private final HealthListener health;
    private final Sleeper sleeper;

    private volatile boolean stopRequested;
    private volatile Thread loopThread;

    public ProcessingLoop(MessageExtractor extractor, ContextStore contextStore, ContextAssembler assembler,
                          Responder responder, ModelConfig modelConfig, DraftPublisher publisher,
                          MailStore mailStore, LoopSettings settings, HealthListener health, Sleeper sleeper) {
        this.extractor = extractor;
        this.contextStore = contextStore;
        this.assembler = assembler;
        this.responder = responder;
        this.modelConfig = modelConfig;
        this.publisher = publisher;
        this.mailStore = mailStore;
        this.settings = settings;
        this.health = health;
        this.sleeper = sleeper;
    }

    /**
     * Run cycles until stopped. Only an interrupt or {@link #stop()} ends the loop.
     */
    public void run() {
        loopThread = Thread.currentThread();
        log.info("Running email assistant main loop (interval {}s)", settings.pollInterval().toSeconds());
        boolean sessionSuspect = false;
        try {
            while (!stopRequested) {
                try {
                    if (sessionSuspect) {
                        mailStore.reconnect();
                        sessionSuspect = false;
                    }
                    CycleReport report = runCycle();
                    health.cycleCompleted(report);
                    if (stopRequested) break;
                    sleeper.sleep(settings.pollInterval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    log.error("Error in main loop: {}", e.getMessage(), e);
                    health.cycleFailed(e);
                    sessionSuspect = true;
                    if (stopRequested) break;
                    log.info("Restarting in {} seconds...", settings.retryCooldown().toSeconds());
                    try {
                        sleeper.sleep(settings.retryCooldown());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        } finally {
            loopThread = null;
        }
        log.info("Processing loop stopped");
    }

    /**
     * Ask the loop to finish after the current message. A pending sleep is cut short.
     */
    public void stop() {
        stopRequested = true;
        Thread t = loopThread;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * One poll: fetch candidates and process each independently.
     *
     * @throws MessagingException if the inbox search fails
     * @throws MailConnectionLostException if the session drops while fetching
     */
    public CycleReport runCycle() throws MessagingException {
        log.info("Checking for new emails");
        int candidates = 0;
        int published = 0;
        int alreadyRecorded = 0;
        int failed = 0;

        try (Stream<IncomingMessage> stream = extractor.fetchCandidates(settings.criteria())) {
            Iterator<IncomingMessage> it = stream.iterator();
            while (!stopRequested && it.hasNext()) {
                IncomingMessage message = it.next();
                candidates++;
                ProcessingOutcome outcome;
                try {
                    outcome = process(message);
                } catch (RuntimeException e) {
                    log.error("Unexpected error processing email from {} ({}): {}",
                            message.sender(), message.subject(), e.getMessage(), e);
                    outcome = ProcessingOutcome.failed(ProcessingOutcome.Stage.UNEXPECTED, String.valueOf(e));
                }
                switch (outcome.status()) {
                    case PUBLISHED -> published++;
                    case ALREADY_RECORDED -> alreadyRecorded++;
                    case FAILED -> failed++;
                }
            }
        }

        CycleReport report = new CycleReport(candidates, published, alreadyRecorded, failed);
        log.info("Cycle done: {} candidates, {} drafted, {} already answered, {} failed",
                candidates, published, alreadyRecorded, failed);
        return report;
    }

    ProcessingOutcome process(IncomingMessage message) {
        if (contextStore.hasRecorded(message.sender(), message.messageId())) {
            log.info("Email from {} ({}) was already answered, not drafting again",
                    message.sender(), message.subject());
            // the entry may only be in memory if an earlier write failed
            try {
                contextStore.persistHistory();
            } catch (StorageException e) {
                log.error("History for {} ({}) is still not on disk; leaving unread: {}",
                        message.sender(), message.subject(), e.getMessage(), e);
                return ProcessingOutcome.failed(ProcessingOutcome.Stage.RECORD, e.getMessage());
            }
            ProcessingOutcome flagged = flagRead(message);
            return flagged != null ? flagged : ProcessingOutcome.alreadyRecorded();
        }

        log.info("Processing email from {} ({})", message.sender(), message.subject());
        PromptPayload payload = assembler.assemble(message, contextStore.training(),
                contextStore.relevantHistory(message.sender()));

        String response;
        try {
            response = responder.generate(payload.systemText(), payload.userContent(), modelConfig);
        } catch (ResponderException e) {
            log.warn("Skipping draft save due to error for {} ({}): {}",
                    message.sender(), message.subject(), e.getMessage());
            return ProcessingOutcome.failed(ProcessingOutcome.Stage.RESPOND, e.getMessage());
        }
        if (response == null || response.isBlank()) {
            log.warn("Skipping draft save for {} ({}): {} returned an empty response",
                    message.sender(), message.subject(), responder.providerId());
            return ProcessingOutcome.failed(ProcessingOutcome.Stage.RESPOND, "empty response");
        }

        DraftLocation location;
        try {
            location = publisher.publish(message, response);
        } catch (PublishException e) {
            log.error("Error saving draft for {} ({}): {}", message.sender(), message.subject(),
                    e.getMessage(), e);
            return ProcessingOutcome.failed(ProcessingOutcome.Stage.PUBLISH, e.getMessage());
        }

        try {
            contextStore.recordInteraction(message.sender(), message.subject(), message.body(), response,
                    message.messageId());
        } catch (StorageException e) {
            log.error("Draft saved to {} but history update failed for {} ({}); leaving unread: {}",
                    location.folder(), message.sender(), message.subject(), e.getMessage(), e);
            return ProcessingOutcome.failed(ProcessingOutcome.Stage.RECORD, e.getMessage());
        }

        ProcessingOutcome flagFailure = flagRead(message);
        if (flagFailure != null) {
            return flagFailure;
        }
        log.info("Draft saved for email from {}", message.sender());
        return ProcessingOutcome.published(response, location);
    }

    /**
     * @return null on success (or when flagging is disabled), otherwise the failure outcome
     */
    private ProcessingOutcome flagRead(IncomingMessage message) {
        if (!settings.markAsRead()) {
            return null;
        }
        try {
            mailStore.setFlag(message.uid(), Flags.Flag.SEEN);
            return null;
        } catch (MessagingException e) {
            log.error("Failed to mark email {} from {} ({}) as read: {}",
                    message.uid(), message.sender(), message.subject(), e.getMessage());
            return ProcessingOutcome.failed(ProcessingOutcome.Stage.FLAG, e.getMessage());
        }
    }
}
