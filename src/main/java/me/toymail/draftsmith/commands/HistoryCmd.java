package me.toymail.draftsmith.commands;

import me.toymail.draftsmith.ConfigException;
import me.toymail.draftsmith.service.ContextAssembler;
import me.toymail.draftsmith.store.ContextStore;
import me.toymail.draftsmith.store.ConversationHistory;
import me.toymail.draftsmith.store.StorageException;
import me.toymail.draftsmith.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Command(name = "history", description = "Show the recorded conversation with a sender")
public final class HistoryCmd extends ConfiguredCommand {
    private static final Logger log = LoggerFactory.getLogger(HistoryCmd.class);

    @Option(names = "--sender", required = true, description = "Sender address")
    String sender;

    @Option(names = "--limit", defaultValue = "" + ContextStore.DEFAULT_HISTORY_LIMIT,
            description = "Most recent entries to show (default: ${DEFAULT-VALUE})")
    int limit;

    public HistoryCmd(StoreContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        applyConfig();
        try {
            // senders are stored lower-cased
            String key = sender.trim().toLowerCase(Locale.ROOT);
            Optional<List<ConversationHistory.Entry>> entries = context.contextStore().relevantHistory(key, limit);
            if (entries.isEmpty()) {
                log.info(ContextAssembler.NO_HISTORY);
                return 0;
            }
            for (ConversationHistory.Entry entry : entries.get()) {
                log.info("[{}] Subject: {}", entry.timestamp, entry.subject);
                log.info("Their message: {}", entry.content);
                log.info("Your response: {}", entry.response);
            }
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration error: {}", e.getMessage());
            return 1;
        } catch (StorageException e) {
            log.error("Failed to load history: {}", e.getMessage());
            return 1;
        }
    }
}
