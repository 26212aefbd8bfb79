package me.toymail.draftsmith.commands;

import me.toymail.draftsmith.ConfigException;
import me.toymail.draftsmith.service.ServiceHealth;
import me.toymail.draftsmith.store.DocumentStore;
import me.toymail.draftsmith.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.time.Instant;

@Command(name = "status", description = "Show the health record written by a running service")
public final class StatusCmd extends ConfiguredCommand {
    private static final Logger log = LoggerFactory.getLogger(StatusCmd.class);

    public StatusCmd(StoreContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        applyConfig();
        try {
            DocumentStore documents = context.documents();
            ServiceHealth.Snapshot s = documents.readJson(ServiceHealth.HEALTH_FILE, ServiceHealth.Snapshot.class);
            if (s == null) {
                log.info("No health record in {}. The service has not completed a cycle yet.", documents.baseDir());
                return 0;
            }
            log.info("Status: {}", s.status);
            log.info("Started: {}", Instant.ofEpochSecond(s.startedEpochSec));
            log.info("Uptime: {}s", s.uptimeSeconds);
            log.info("Cycles completed: {}", s.cyclesCompleted);
            if (s.lastCycleEpochSec > 0) {
                log.info("Last cycle: {} ({} drafts, {} failures)", Instant.ofEpochSecond(s.lastCycleEpochSec),
                        s.lastCycleDrafts, s.lastCycleFailures);
            }
            if (s.lastErrorEpochSec != null) {
                log.info("Last error: {} at {}", s.lastErrorMessage, Instant.ofEpochSecond(s.lastErrorEpochSec));
            }
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration error: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to read {}: {}", ServiceHealth.HEALTH_FILE, e.getMessage());
            return 1;
        }
    }
}
