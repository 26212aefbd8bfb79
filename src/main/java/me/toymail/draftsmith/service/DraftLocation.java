package me.toymail.draftsmith.service;

/**
 * Where a draft ended up.
 *
 * @param folder   folder that accepted the append
 * @param fallback true if every draft folder failed and the inbox was used
 */
public record DraftLocation(String folder, boolean fallback) {}
