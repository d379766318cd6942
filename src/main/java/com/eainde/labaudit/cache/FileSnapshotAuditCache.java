package com.eainde.labaudit.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache persisted as a single JSON object file ({@code key -> raw output}).
 *
 * <p>The snapshot is loaded once at construction and rewritten in full after every
 * change: written to a sibling temp file first, then moved over the target. A missing,
 * unreadable or corrupt file starts an empty cache; write failures are logged and the
 * in-memory entry is kept.</p>
 */
@Slf4j
public class FileSnapshotAuditCache implements AuditCache {

    private static final TypeReference<Map<String, String>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, String> entries = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public FileSnapshotAuditCache(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        load();
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, String value) {
        if (key == null || value == null) {
            return;
        }
        synchronized (writeLock) {
            entries.put(key, value);
            persist();
        }
    }

    @Override
    public void invalidate(String key) {
        if (key == null) {
            return;
        }
        synchronized (writeLock) {
            if (entries.remove(key) != null) {
                persist();
            }
        }
    }

    @Override
    public int size() {
        return entries.size();
    }

    public Path getFile() {
        return file;
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("No audit cache snapshot at {} - starting empty", file);
            return;
        }
        try {
            Map<String, String> snapshot = objectMapper.readValue(file.toFile(), SNAPSHOT_TYPE);
            if (snapshot != null) {
                snapshot.forEach((k, v) -> {
                    if (k != null && v != null) {
                        entries.put(k, v);
                    }
                });
            }
            log.info("Loaded {} audit cache entries from {}", entries.size(), file);
        } catch (IOException e) {
            log.warn("Audit cache snapshot {} is unreadable - starting empty", file, e);
        }
    }

    private void persist() {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // sorted so identical content always yields an identical file
            objectMapper.writeValue(temp.toFile(), new TreeMap<>(entries));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException atomicMoveFailure) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("Failed to write audit cache snapshot {} - entry kept in memory only", file, e);
        }
    }
}
