package me.toymail.draftsmith.service;

import me.toymail.draftsmith.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Uptime and last-error record owned by the supervisor. The loop updates it
 * through {@link HealthListener}; each update is mirrored to health.json.
 */
public final class ServiceHealth implements HealthListener {
    private static final Logger log = LoggerFactory.getLogger(ServiceHealth.class);

    public static final String HEALTH_FILE = "health.json";

    /**
     * JSON shape of health.json.
     */
    public static final class Snapshot {
        public String status;
        public long startedEpochSec;
        public long uptimeSeconds;
        public long cyclesCompleted;
        public long lastCycleEpochSec;
        public int lastCycleDrafts;
        public int lastCycleFailures;
        public Long lastErrorEpochSec;
        public String lastErrorMessage;

        public Snapshot() {}
    }

    private final Clock clock;
    private final DocumentStore documents;
    private final Instant startedAt;

    private long cyclesCompleted;
    private Instant lastCycleAt;
    private CycleReport lastReport;
    private Instant lastErrorAt;
    private String lastErrorMessage;

    /**
     * @param documents where to mirror health.json; null keeps it in memory only
     */
    public ServiceHealth(Clock clock, DocumentStore documents) {
        this.clock = clock;
        this.documents = documents;
        this.startedAt = clock.instant();
    }

    @Override
    public synchronized void cycleCompleted(CycleReport report) {
        cyclesCompleted++;
        lastCycleAt = clock.instant();
        lastReport = report;
        write();
    }

    @Override
    public synchronized void cycleFailed(Exception error) {
        lastErrorAt = clock.instant();
        lastErrorMessage = error.getClass().getSimpleName() + ": " + error.getMessage();
        write();
    }

    public synchronized Snapshot snapshot() {
        Instant now = clock.instant();
        Snapshot s = new Snapshot();
        s.status = "healthy";
        s.startedEpochSec = startedAt.getEpochSecond();
        s.uptimeSeconds = Duration.between(startedAt, now).toSeconds();
        s.cyclesCompleted = cyclesCompleted;
        s.lastCycleEpochSec = lastCycleAt != null ? lastCycleAt.getEpochSecond() : 0;
        s.lastCycleDrafts = lastReport != null ? lastReport.published() : 0;
        s.lastCycleFailures = lastReport != null ? lastReport.failed() : 0;
        s.lastErrorEpochSec = lastErrorAt != null ? lastErrorAt.getEpochSecond() : null;
        s.lastErrorMessage = lastErrorMessage;
        return s;
    }

    private void write() {
        if (documents == null) return;
        try {
            documents.writeJson(HEALTH_FILE, snapshot());
        } catch (IOException e) {
            log.warn("Failed to write {}: {}", HEALTH_FILE, e.getMessage());
        }
    }
}
