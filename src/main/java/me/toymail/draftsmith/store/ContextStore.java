package me.toymail.draftsmith.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Owner of the training context and the conversation history.
 * Every mutation updates memory first, then rewrites the whole document.
 */
public final class ContextStore {
    private static final Logger log = LoggerFactory.getLogger(ContextStore.class);

    public static final String TRAINING_FILE = "training_context.json";
    public static final String HISTORY_FILE = "conversation_history.json";
    public static final int DEFAULT_HISTORY_LIMIT = 5;

    private final DocumentStore documents;
    private final String seedSystemPrompt;
    private final Clock clock;

    private TrainingContext training;
    private ConversationHistory history;

    public ContextStore(DocumentStore documents, String seedSystemPrompt) {
        this(documents, seedSystemPrompt, Clock.systemDefaultZone());
    }

    public ContextStore(DocumentStore documents, String seedSystemPrompt, Clock clock) {
        this.documents = documents;
        this.seedSystemPrompt = seedSystemPrompt != null ? seedSystemPrompt : "";
        this.clock = clock;
    }

    /**
     * Load both documents, creating and persisting whichever is missing.
     */
    public synchronized void load() throws StorageException {
        TrainingContext loadedTraining = read(TRAINING_FILE, TrainingContext.class);
        if (loadedTraining == null) {
            log.info("No {} found, initializing from configuration", TRAINING_FILE);
            training = new TrainingContext(seedSystemPrompt);
            persistTraining();
        } else {
            training = loadedTraining;
        }

        ConversationHistory loadedHistory = read(HISTORY_FILE, ConversationHistory.class);
        if (loadedHistory == null) {
            history = new ConversationHistory();
            persistHistory();
        } else {
            history = loadedHistory;
        }
        log.info("Loaded {} instructions, {} examples, history for {} senders",
                training.additionalInstructions.size(), training.exampleResponses.size(), history.senderCount());
    }

    public synchronized TrainingContext training() {
        requireLoaded();
        return training;
    }

    public synchronized ConversationHistory history() {
        requireLoaded();
        return history;
    }

    public synchronized void addInstruction(String text) throws StorageException {
        requireLoaded();
        training.additionalInstructions.add(new TrainingContext.Instruction(now(), text));
        persistTraining();
        log.info("Added new instruction to training context");
    }

    public synchronized void addExampleResponse(String sender, String subject, String originalContent,
                                                String response) throws StorageException {
        requireLoaded();
        training.exampleResponses.add(
                new TrainingContext.ExampleResponse(now(), sender, subject, originalContent, response));
        persistTraining();
        log.info("Added final response to training examples");
    }

    public void recordInteraction(String sender, String subject, String content,
                                  String response) throws StorageException {
        recordInteraction(sender, subject, content, response, null);
    }

    public synchronized void recordInteraction(String sender, String subject, String content,
                                               String response, String messageId) throws StorageException {
        requireLoaded();
        history.append(sender, new ConversationHistory.Entry(now(), subject, content, response, messageId));
        persistHistory();
    }

    /**
     * Whether a reply to this Message-ID is already in the sender's history.
     */
    public synchronized boolean hasRecorded(String sender, String messageId) {
        requireLoaded();
        return history.contains(sender, messageId);
    }

    /**
     * The last {@code limit} entries for the sender, oldest first,
     * or empty if nothing was ever recorded for them.
     */
    public synchronized Optional<List<ConversationHistory.Entry>> relevantHistory(String sender, int limit) {
        requireLoaded();
        if (!history.hasSender(sender)) {
            return Optional.empty();
        }
        List<ConversationHistory.Entry> all = history.entries(sender);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return Optional.of(List.copyOf(all.subList(from, all.size())));
    }

    public Optional<List<ConversationHistory.Entry>> relevantHistory(String sender) {
        return relevantHistory(sender, DEFAULT_HISTORY_LIMIT);
    }

    public synchronized void persistTraining() throws StorageException {
        write(TRAINING_FILE, training);
    }

    public synchronized void persistHistory() throws StorageException {
        write(HISTORY_FILE, history);
    }

    private <T> T read(String name, Class<T> type) throws StorageException {
        try {
            return documents.readJson(name, type);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + documents.path(name), e);
        }
    }

    private void write(String name, Object document) throws StorageException {
        try {
            documents.writeJson(name, document);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + documents.path(name), e);
        }
    }

    private String now() {
        return LocalDateTime.now(clock).toString();
    }

    private void requireLoaded() {
        if (training == null || history == null) {
            throw new IllegalStateException("ContextStore.load() has not been called");
        }
    }
}
