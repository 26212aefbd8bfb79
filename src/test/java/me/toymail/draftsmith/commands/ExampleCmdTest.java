package me.toymail.draftsmith.commands;

import me.toymail.draftsmith.store.ContextStore;
import me.toymail.draftsmith.store.DocumentStore;
import me.toymail.draftsmith.store.TrainingContext;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ExampleCmdTest extends CommandTestBase {

    private TrainingContext stored() throws Exception {
        return new DocumentStore(tempDir).readJson(ContextStore.TRAINING_FILE, TrainingContext.class);
    }

    @Test
    public void testExample_InlineText() throws Exception {
        int code = executeCommand(new ExampleCmd(context),
                "--sender", "bob@x.com", "--subject", "Invoice",
                "--original", "Please pay", "--response", "Paid today");

        assertEquals(0, code);
        TrainingContext.ExampleResponse ex = stored().exampleResponses.get(0);
        assertEquals("bob@x.com", ex.sender);
        assertEquals("Invoice", ex.subject);
        assertEquals("Please pay", ex.originalContent);
        assertEquals("Paid today", ex.response);
    }

    @Test
    public void testExample_TextFromFiles() throws Exception {
        Path original = tempDir.resolve("original.txt");
        Path response = tempDir.resolve("response.txt");
        Files.writeString(original, "Line one\nLine two\n");
        Files.writeString(response, "Thanks,\nSam\n");

        int code = executeCommand(new ExampleCmd(context),
                "--sender", "bob@x.com", "--subject", "Notes",
                "--original-file", original.toString(), "--response-file", response.toString());

        assertEquals(0, code);
        assertEquals("Line one\nLine two\n", stored().exampleResponses.get(0).originalContent);
        assertEquals("Thanks,\nSam\n", stored().exampleResponses.get(0).response);
    }

    @Test
    public void testExample_InlineAndFileTogetherRejected() throws Exception {
        Path original = tempDir.resolve("original.txt");
        Files.writeString(original, "x");

        int code = executeCommand(new ExampleCmd(context),
                "--sender", "bob@x.com", "--subject", "s",
                "--original", "y", "--original-file", original.toString(), "--response", "r");

        assertEquals(2, code);
        assertNull(stored());
    }

    @Test
    public void testExample_MissingResponseRejected() throws Exception {
        int code = executeCommand(new ExampleCmd(context),
                "--sender", "bob@x.com", "--subject", "s", "--original", "y");

        assertEquals(2, code);
    }
}
