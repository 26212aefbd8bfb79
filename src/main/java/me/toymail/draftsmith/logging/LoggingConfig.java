package me.toymail.draftsmith.logging;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Points logback's file appender at the log directory.
 * Must run before the first SLF4J logger is created.
 */
public final class LoggingConfig {

    static final String LOG_DIR_PROPERTY = "draftsmith.log.dir";
    private static boolean initialized = false;

    private LoggingConfig() {}

    /**
     * Create the log directory and publish it as a system property. An explicit
     * {@code -Ddraftsmith.log.dir} wins over the default under the home directory.
     */
    public static synchronized void init() {
        if (initialized) return;

        String configured = System.getProperty(LOG_DIR_PROPERTY);
        Path logDir = configured != null && !configured.isBlank()
                ? Path.of(configured)
                : Path.of(System.getProperty("user.home"), ".draftsmith", "logs");
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            System.err.println("Warning: Could not create log directory: " + logDir);
        }

        System.setProperty(LOG_DIR_PROPERTY, logDir.toString());
        initialized = true;
    }
}
