package io.usermn.sdk.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.usermn.sdk.internal.Json;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Storage persisted as a JSON object in a single file. Each commit writes a sibling temp file and moves it over the
 * target, so a crash or I/O failure never leaves a half-written file behind and the in-memory view only changes
 * once the move has succeeded.
 */
public final class FileStorage implements KeyValueStorage {

    private static final Logger LOGGER = Logger.getLogger(FileStorage.class.getName());
    private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Map<String, String> entries;

    public FileStorage(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        this.entries = load(file);
    }

    @Override
    public Map<String, String> snapshot() {
        return entries;
    }

    @Override
    public void commit(Map<String, String> puts, Set<String> removals) {
        lock.lock();
        try {
            Map<String, String> next = InMemoryStorage.apply(entries, puts, removals);
            persist(next);
            entries = next;
        } finally {
            lock.unlock();
        }
    }

    public Path getFile() {
        return file;
    }

    private void persist(Map<String, String> next) {
        Path tmp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            Files.write(tmp, Json.mapper().writeValueAsBytes(next));
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            deleteQuietly(tmp);
            throw new StorageException("persist " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static Map<String, String> load(Path file) {
        if (!Files.exists(file)) {
            return Map.of();
        }
        try {
            Map<String, String> stored = Json.mapper().readValue(file.toFile(), MAP_TYPE);
            return stored == null ? Map.of() : InMemoryStorage.apply(Map.of(), stored, Set.of());
        } catch (IOException ex) {
            throw new StorageException("load " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException ex) {
            LOGGER.fine(() -> "[usermn-sdk] could not remove temp file " + tmp + ": " + ex.getMessage());
        }
    }
}
