package me.toymail.draftsmith.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    public void testReadJson_MissingFileReturnsNull() throws Exception {
        DocumentStore store = new DocumentStore(tempDir);

        assertNull(store.readJson("absent.json", TrainingContext.class));
        assertFalse(store.exists("absent.json"));
    }

    @Test
    public void testWriteJson_CreatesDirectoryAndLeavesNoTempFile() throws Exception {
        Path dir = tempDir.resolve("nested").resolve("state");
        DocumentStore store = new DocumentStore(dir);

        store.writeJson("training_context.json", new TrainingContext("Be brief."));

        assertTrue(store.exists("training_context.json"));
        assertFalse(Files.exists(dir.resolve("training_context.json.tmp")));
        String json = Files.readString(dir.resolve("training_context.json"));
        assertTrue(json.contains("\"system_prompt\""));
        assertTrue(json.contains("Be brief."));
    }

    @Test
    public void testWriteJson_ReplacesPreviousDocument() throws Exception {
        DocumentStore store = new DocumentStore(tempDir);
        store.writeJson("doc.json", new TrainingContext("first"));
        store.writeJson("doc.json", new TrainingContext("second"));

        TrainingContext loaded = store.readJson("doc.json", TrainingContext.class);

        assertEquals("second", loaded.systemPrompt);
    }

    @Test
    public void testReadJson_IgnoresUnknownFields() throws Exception {
        Files.writeString(tempDir.resolve("training_context.json"),
                "{\"system_prompt\":\"hi\",\"additional_instructions\":[],\"example_responses\":[],\"extra\":1}");
        DocumentStore store = new DocumentStore(tempDir);

        TrainingContext loaded = store.readJson("training_context.json", TrainingContext.class);

        assertEquals("hi", loaded.systemPrompt);
    }
}
