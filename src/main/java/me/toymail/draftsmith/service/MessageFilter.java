package me.toymail.draftsmith.service;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring blacklist over sender and reply-to addresses.
 */
public final class MessageFilter {

    private final List<String> blacklist;

    public MessageFilter(List<String> blacklist) {
        this.blacklist = blacklist.stream()
                .filter(entry -> entry != null && !entry.isBlank())
                .map(entry -> entry.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public boolean isBlacklisted(String address) {
        if (address == null || address.isBlank()) return false;
        String lower = address.toLowerCase(Locale.ROOT);
        for (String entry : blacklist) {
            if (lower.contains(entry)) return true;
        }
        return false;
    }

    /**
     * True if any of the given address strings matches. Null entries are ignored.
     */
    public boolean isBlacklisted(String... addresses) {
        for (String address : addresses) {
            if (isBlacklisted(address)) return true;
        }
        return false;
    }
}
