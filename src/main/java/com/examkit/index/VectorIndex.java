package com.examkit.index;

import java.util.List;
import java.util.Optional;

import com.examkit.ingest.DocumentChunk;

/**
 * Searchable vector store keyed by content-addressed chunk id. Implementations allow one writer
 * at a time and never expose a partially inserted entry to readers.
 */
public interface VectorIndex {

    /**
     * Inserts the chunk unless its id is already present.
     *
     * @return {@code true} when the chunk was inserted, {@code false} for an idempotent no-op
     */
    boolean add(DocumentChunk chunk, float[] embedding);

    boolean contains(String chunkId);

    int size();

    Optional<float[]> embeddingOf(String chunkId);

    Optional<DocumentChunk> chunk(String chunkId);

    /** All indexed chunks ordered by chunk id. */
    List<DocumentChunk> chunks();

    /**
     * Returns the {@code k} nearest chunks, nearest first, ties broken by lower chunk id.
     *
     * @throws IndexEmptyException when nothing has been indexed
     */
    List<SearchResult> search(float[] queryEmbedding, int k);

    DistanceMetric metric();
}
