package com.examkit.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Persists one index per source session under {@code <cacheDir>/<sessionId>/vector-index.json}.
 */
public class IndexStore {
    private static final Logger log = LoggerFactory.getLogger(IndexStore.class);
    static final String INDEX_FILE = "vector-index.json";

    private final Path cacheDir;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public IndexStore(Path cacheDir) {
        this.cacheDir = cacheDir;
    }

    public Path indexPath(String sessionId) {
        if (sessionId == null || sessionId.isBlank() || sessionId.contains("/") || sessionId.contains("\\")
                || sessionId.contains("..")) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return cacheDir.resolve(sessionId).resolve(INDEX_FILE);
    }

    public boolean exists(String sessionId) {
        return Files.exists(indexPath(sessionId));
    }

    public Optional<LocalJsonVectorIndex> load(String sessionId) throws IOException {
        Path path = indexPath(sessionId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        PersistedIndex persisted;
        try {
            persisted = objectMapper.readValue(path.toFile(), PersistedIndex.class);
        } catch (JsonProcessingException e) {
            throw new IndexCorruptedException("Index at " + path + " cannot be read", e);
        }
        if (persisted == null || persisted.metric() == null || persisted.chunks() == null) {
            throw new IndexCorruptedException("Index at " + path + " is incomplete", null);
        }
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(persisted.metric(), persisted.embeddingVersion());
        try {
            for (IndexedChunk entry : persisted.chunks()) {
                index.add(entry.chunk(), entry.embedding());
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IndexCorruptedException("Index at " + path + " holds inconsistent vectors", e);
        }
        log.debug("Loaded index session={} chunks={} version={}", sessionId, index.size(), index.embeddingVersion());
        return Optional.of(index);
    }

    public void save(String sessionId, LocalJsonVectorIndex index) throws IOException {
        Path path = indexPath(sessionId);
        Files.createDirectories(path.getParent());
        Path temp = path.resolveSibling(INDEX_FILE + ".tmp");
        PersistedIndex persisted = new PersistedIndex(index.embeddingVersion(), index.metric(), index.snapshot());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), persisted);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Saved index session={} chunks={} path={}", sessionId, persisted.chunks().size(), path);
    }

    record PersistedIndex(String embeddingVersion, DistanceMetric metric, List<IndexedChunk> chunks) {
    }
}
