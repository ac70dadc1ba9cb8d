package com.examkit.index;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examkit.embedding.BatchEmbedder;
import com.examkit.embedding.EmbeddedChunk;
import com.examkit.embedding.EmbeddingOutcome;
import com.examkit.embedding.EmbeddingService;
import com.examkit.ingest.DocumentChunk;

/**
 * Embeds chunks that the session index has not seen yet and persists the result. Chunks already
 * present by id are skipped, so re-running over the same material inserts nothing.
 */
public class IndexingService {
    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private final IndexStore indexStore;
    private final EmbeddingService embeddingService;
    private final BatchEmbedder batchEmbedder;
    private final DistanceMetric metric;
    private final Set<String> discardedSessions = ConcurrentHashMap.newKeySet();

    public IndexingService(IndexStore indexStore, EmbeddingService embeddingService, BatchEmbedder batchEmbedder,
            DistanceMetric metric) {
        this.indexStore = indexStore;
        this.embeddingService = embeddingService;
        this.batchEmbedder = batchEmbedder;
        this.metric = metric;
    }

    /**
     * Loads the session index, or starts an empty one. When the persisted index was built with
     * another embedding version it is discarded, and the next
     * {@link #embedAndIndex(String, LocalJsonVectorIndex, List)} for the session reports
     * {@code reembedded=true} and saves the rebuilt index.
     */
    public LocalJsonVectorIndex openIndex(String sessionId) throws IOException {
        Optional<LocalJsonVectorIndex> persisted = indexStore.load(sessionId);
        if (versionChanged(persisted)) {
            discardedSessions.add(sessionId);
        }
        return prepare(sessionId, persisted);
    }

    public IndexingReport embedAndIndex(String sessionId, List<DocumentChunk> chunks) throws IOException {
        Optional<LocalJsonVectorIndex> persisted = indexStore.load(sessionId);
        LocalJsonVectorIndex index = prepare(sessionId, persisted);
        boolean reembedded = versionChanged(persisted);
        discardedSessions.remove(sessionId);
        boolean dirty = persisted.isEmpty() || reembedded || persisted.get() != index;
        return embedAndIndex(sessionId, index, chunks, reembedded, dirty);
    }

    /**
     * Variant for callers that keep the index open across steps, such as the study pipeline.
     */
    public IndexingReport embedAndIndex(String sessionId, LocalJsonVectorIndex index, List<DocumentChunk> chunks)
            throws IOException {
        boolean reembedded = discardedSessions.remove(sessionId);
        return embedAndIndex(sessionId, index, chunks, reembedded, reembedded || !indexStore.exists(sessionId));
    }

    private boolean versionChanged(Optional<LocalJsonVectorIndex> persisted) {
        return persisted
                .map(previous -> previous.requiresReembedding(embeddingService.version()))
                .orElse(false);
    }

    private IndexingReport embedAndIndex(String sessionId, LocalJsonVectorIndex index, List<DocumentChunk> chunks,
            boolean reembedded, boolean dirty) throws IOException {
        List<DocumentChunk> pending = chunks.stream()
                .filter(chunk -> !index.contains(chunk.id()))
                .toList();
        int skipped = chunks.size() - pending.size();

        EmbeddingOutcome outcome = pending.isEmpty()
                ? new EmbeddingOutcome(List.of(), List.of(), 0)
                : batchEmbedder.embed(pending);
        int inserted = 0;
        for (EmbeddedChunk embedded : outcome.embedded()) {
            if (index.add(embedded.chunk(), embedded.embedding())) {
                inserted++;
            }
        }

        if (inserted > 0 || dirty) {
            indexStore.save(sessionId, index);
        }
        log.info("Indexed session={} inserted={} skipped={} failed={} cancelled={}",
                sessionId, inserted, skipped, outcome.failedChunks(), outcome.cancelledChunks());
        return new IndexingReport(sessionId, inserted, skipped, outcome.cancelledChunks(), reembedded,
                outcome.failures());
    }

    private LocalJsonVectorIndex prepare(String sessionId, Optional<LocalJsonVectorIndex> persisted) {
        if (persisted.isEmpty()) {
            return new LocalJsonVectorIndex(metric, embeddingService.version());
        }
        LocalJsonVectorIndex existing = persisted.get();
        if (!embeddingService.version().equals(existing.embeddingVersion())) {
            if (existing.size() > 0) {
                log.warn("Index for session {} was built with {} but current embedding is {}; re-embedding",
                        sessionId, existing.embeddingVersion(), embeddingService.version());
            }
            return new LocalJsonVectorIndex(metric, embeddingService.version());
        }
        if (existing.metric() != metric) {
            log.info("Index for session {} uses metric {}, configured {}; keeping vectors",
                    sessionId, existing.metric(), metric);
            LocalJsonVectorIndex switched = new LocalJsonVectorIndex(metric, embeddingService.version());
            existing.snapshot().forEach(entry -> switched.add(entry.chunk(), entry.embedding()));
            return switched;
        }
        return existing;
    }
}
