package me.toymail.draftsmith.store;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-sender transcripts, stored as conversation_history.json:
 * a JSON object keyed by sender address. Entries are appended in arrival order.
 */
public final class ConversationHistory {

    private final Map<String, List<Entry>> bySender = new LinkedHashMap<>();

    public ConversationHistory() {}

    @JsonAnyGetter
    public Map<String, List<Entry>> bySender() {
        return bySender;
    }

    @JsonAnySetter
    public void put(String sender, List<Entry> entries) {
        bySender.put(sender, entries != null ? new ArrayList<>(entries) : new ArrayList<>());
    }

    public void append(String sender, Entry entry) {
        bySender.computeIfAbsent(sender, k -> new ArrayList<>()).add(entry);
    }

    public boolean hasSender(String sender) {
        return bySender.containsKey(sender);
    }

    public List<Entry> entries(String sender) {
        List<Entry> entries = bySender.get(sender);
        return entries != null ? Collections.unmodifiableList(entries) : List.of();
    }

    /**
     * True if an entry for this sender already carries the given Message-ID.
     */
    public boolean contains(String sender, String messageId) {
        if (messageId == null) return false;
        List<Entry> entries = bySender.get(sender);
        if (entries == null) return false;
        for (Entry entry : entries) {
            if (messageId.equals(entry.messageId)) return true;
        }
        return false;
    }

    public int senderCount() {
        return bySender.size();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Entry {
        public String timestamp;
        public String subject;
        public String content;
        public String response;

        // Message-ID of the answered mail; absent in files written before it was tracked
        @JsonProperty("message_id")
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public String messageId;

        public Entry() {}

        public Entry(String timestamp, String subject, String content, String response) {
            this(timestamp, subject, content, response, null);
        }

        public Entry(String timestamp, String subject, String content, String response, String messageId) {
            this.timestamp = timestamp;
            this.subject = subject;
            this.content = content;
            this.response = response;
            this.messageId = messageId;
        }
    }
}
