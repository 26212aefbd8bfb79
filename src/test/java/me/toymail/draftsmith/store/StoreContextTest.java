package me.toymail.draftsmith.store;

import me.toymail.draftsmith.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class StoreContextTest {

    @TempDir
    Path tempDir;

    private Path config(String dir, String email) throws Exception {
        Path d = Files.createDirectories(tempDir.resolve(dir));
        Path file = d.resolve("config.yaml");
        Files.writeString(file, "email: " + email + "\nimap_server: imap.example.com\n");
        return file;
    }

    @Test
    public void testConfigLoadedOnceAndCached() throws Exception {
        StoreContext context = StoreContext.initialize(config("a", "a@example.com"), mock(CredentialStore.class));

        assertSame(context.config(), context.config());
        assertEquals(tempDir.resolve("a").toAbsolutePath().toString(), context.documents().baseDir().toString());
    }

    @Test
    public void testUseConfigDropsCachedState() throws Exception {
        StoreContext context = StoreContext.initialize(config("a", "a@example.com"), mock(CredentialStore.class));
        ContextStore first = context.contextStore();

        context.useConfig(config("b", "b@example.com"));

        assertEquals("b@example.com", context.config().email);
        assertNotSame(first, context.contextStore());
        assertTrue(Files.exists(tempDir.resolve("b").resolve(ContextStore.TRAINING_FILE)));
    }

    @Test
    public void testMissingConfigFile() {
        StoreContext context = StoreContext.initialize(tempDir.resolve("none.yaml"), mock(CredentialStore.class));

        assertThrows(ConfigException.class, context::config);
    }
}
