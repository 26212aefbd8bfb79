package me.toymail.draftsmith.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MessageFilterTest {

    @Test
    public void testSubstringMatchIsCaseInsensitive() {
        MessageFilter filter = new MessageFilter(List.of("Spam.com", "noreply"));

        assertTrue(filter.isBlacklisted("offers@SPAM.com"));
        assertTrue(filter.isBlacklisted("NoReply@github.com"));
        assertFalse(filter.isBlacklisted("alice@example.com"));
    }

    @Test
    public void testAnyAddressMatches() {
        MessageFilter filter = new MessageFilter(List.of("spam.com"));

        assertTrue(filter.isBlacklisted("alice@example.com", null, "bounce@spam.com"));
        assertFalse(filter.isBlacklisted("alice@example.com", null, null));
    }

    @Test
    public void testBlankEntriesIgnored() {
        MessageFilter filter = new MessageFilter(Arrays.asList("", "  ", null));

        assertFalse(filter.isBlacklisted("anyone@example.com"));
        assertFalse(filter.isBlacklisted(""));
    }
}
