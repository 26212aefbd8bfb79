package me.toymail.draftsmith.service;

import me.toymail.draftsmith.store.ConversationHistory;
import me.toymail.draftsmith.store.TrainingContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ContextAssemblerTest {

    private final ContextAssembler assembler = new ContextAssembler();

    private static IncomingMessage message() {
        return new IncomingMessage(1L, "alice@x.com", "Alice <alice@x.com>", null,
                "Meeting", "Can we meet Tuesday?", "<m1@x.com>", null);
    }

    @Test
    public void testAssemble_EmptyStateUsesSentinelAndNoExamples() {
        TrainingContext training = new TrainingContext("You are helpful.");

        PromptPayload payload = assembler.assemble(message(), training, Optional.empty());

        assertEquals("You are helpful.\n\n", payload.systemText());
        assertEquals("Previous conversations with this sender:\n"
                + "No previous conversations found.\n\n"
                + "New email to respond to:\n"
                + "From: Alice <alice@x.com>\n"
                + "Subject: Meeting\n"
                + "Content: Can we meet Tuesday?", payload.userContent());
    }

    @Test
    public void testAssemble_InstructionsAppendedInOrder() {
        TrainingContext training = new TrainingContext("Base.");
        training.additionalInstructions.add(new TrainingContext.Instruction("2024-01-01T00:00", "Be concise"));
        training.additionalInstructions.add(new TrainingContext.Instruction("2024-01-02T00:00", "Sign as Sam"));

        PromptPayload payload = assembler.assemble(message(), training, Optional.empty());

        assertEquals("Base.\n\nAdditional Instructions:\n- Be concise\n- Sign as Sam\n", payload.systemText());
    }

    @Test
    public void testAssemble_HistoryRenderedOldestFirst() {
        List<ConversationHistory.Entry> history = List.of(
                new ConversationHistory.Entry("2024-01-01T00:00", "First", "q1", "a1"),
                new ConversationHistory.Entry("2024-01-02T00:00", "Second", "q2", "a2"));

        String user = assembler.assemble(message(), new TrainingContext(""), Optional.of(history)).userContent();

        assertTrue(user.startsWith("Previous conversations with this sender:\n"
                + "Subject: First\nOriginal: q1\nResponse: a1\n\n"
                + "Subject: Second\nOriginal: q2\nResponse: a2\n\n"
                + "New email to respond to:"), user);
        assertFalse(user.contains(ContextAssembler.NO_HISTORY));
    }

    @Test
    public void testAssemble_ExamplesPrecedeHistory() {
        TrainingContext training = new TrainingContext("");
        training.exampleResponses.add(new TrainingContext.ExampleResponse(
                "2024-01-01T00:00", "bob@x.com", "Invoice", "Pay please", "Paid"));

        String user = assembler.assemble(message(), training, Optional.empty()).userContent();

        assertTrue(user.startsWith("Recent example responses:\n\n"
                + "Subject: Invoice\nOriginal: Pay please\nResponse: Paid\n\n"
                + "Previous conversations with this sender:\n"), user);
    }

    @Test
    public void testRecentExamples_NewestFiveByTimestamp() {
        List<TrainingContext.ExampleResponse> all = List.of(
                example("2024-01-03T00:00", "c"),
                example("2024-01-01T00:00", "a"),
                example("2024-01-07T00:00", "g"),
                example("2024-01-05T00:00", "e"),
                example("2024-01-02T00:00", "b"),
                example("2024-01-06T00:00", "f"),
                example("2024-01-04T00:00", "d"));

        List<String> subjects = ContextAssembler.recentExamples(all).stream().map(e -> e.subject).toList();

        assertEquals(List.of("g", "f", "e", "d", "c"), subjects);
    }

    @Test
    public void testRecentExamples_EqualTimestampsKeepStoredOrder() {
        List<TrainingContext.ExampleResponse> all = List.of(
                example("2024-01-01T00:00", "first"),
                example("2024-01-01T00:00", "second"),
                example("garbage", "unparseable"));

        List<String> subjects = ContextAssembler.recentExamples(all).stream().map(e -> e.subject).toList();

        assertEquals(List.of("first", "second", "unparseable"), subjects);
    }

    @Test
    public void testRecentExamples_EqualTimestampsKeepEarliestFive() {
        List<TrainingContext.ExampleResponse> all = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            all.add(example("2024-01-01T00:00", "E" + i));
        }

        List<String> subjects = ContextAssembler.recentExamples(all).stream().map(e -> e.subject).toList();

        assertEquals(List.of("E0", "E1", "E2", "E3", "E4"), subjects);
    }

    @Test
    public void testAssemble_SameInputsSamePrompt() {
        TrainingContext training = new TrainingContext("p");
        training.exampleResponses.add(example("2024-01-01T00:00", "x"));

        PromptPayload a = assembler.assemble(message(), training, Optional.empty());
        PromptPayload b = assembler.assemble(message(), training, Optional.empty());

        assertEquals(a, b);
    }

    private static TrainingContext.ExampleResponse example(String timestamp, String subject) {
        return new TrainingContext.ExampleResponse(timestamp, "s@x.com", subject, "o", "r");
    }
}
