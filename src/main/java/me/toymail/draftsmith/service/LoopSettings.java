package me.toymail.draftsmith.service;

import me.toymail.draftsmith.SearchCriteria;
import me.toymail.draftsmith.config.AssistantConfig;

import java.time.Duration;

/**
 * Loop knobs taken from the configuration.
 */
public record LoopSettings(SearchCriteria criteria, boolean markAsRead,
                           Duration pollInterval, Duration retryCooldown) {

    public static LoopSettings from(AssistantConfig cfg) {
        return new LoopSettings(SearchCriteria.UNSEEN, cfg.markAsRead,
                Duration.ofSeconds(cfg.pollIntervalSeconds), Duration.ofSeconds(cfg.retryCooldownSeconds));
    }
}
