package me.toymail.draftsmith.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.*;

/**
 * JSON documents in the state directory.
 * Writes go to a temp file that is then moved over the target, so a crash
 * mid-write leaves the previous document intact.
 */
public final class DocumentStore {
    private static final ObjectMapper M = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path baseDir;

    public DocumentStore(Path baseDir) {
        this.baseDir = baseDir;
    }

    public Path baseDir() { return baseDir; }

    public void ensure() throws IOException {
        Files.createDirectories(baseDir);
    }

    public <T> void writeJson(String name, T obj) throws IOException {
        ensure();
        Path p = baseDir.resolve(name);
        Path tmp = baseDir.resolve(name + ".tmp");
        Files.write(tmp, M.writeValueAsBytes(obj), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        try {
            Files.move(tmp, p, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, p, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public <T> T readJson(String name, Class<T> clazz) throws IOException {
        Path p = baseDir.resolve(name);
        if (!Files.exists(p)) return null;
        return M.readValue(Files.readAllBytes(p), clazz);
    }

    public boolean exists(String name) {
        return Files.exists(baseDir.resolve(name));
    }

    public Path path(String name) {
        return baseDir.resolve(name);
    }
}
