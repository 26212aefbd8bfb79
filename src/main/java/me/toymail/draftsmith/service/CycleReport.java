package me.toymail.draftsmith.service;

/**
 * Counts for one polling cycle.
 */
public record CycleReport(int candidates, int published, int alreadyRecorded, int failed) {}
