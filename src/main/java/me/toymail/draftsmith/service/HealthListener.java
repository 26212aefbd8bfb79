package me.toymail.draftsmith.service;

/**
 * Receives the loop's cycle results.
 */
public interface HealthListener {

    void cycleCompleted(CycleReport report);

    void cycleFailed(Exception error);

    HealthListener NONE = new HealthListener() {
        @Override public void cycleCompleted(CycleReport report) { }
        @Override public void cycleFailed(Exception error) { }
    };
}
