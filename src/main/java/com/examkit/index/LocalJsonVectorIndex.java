package com.examkit.index;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.examkit.embedding.VectorMath;
import com.examkit.ingest.DocumentChunk;

/**
 * Exact in-memory index persisted as JSON by {@link IndexStore}. Entries are kept in chunk-id
 * order so scans, snapshots and serialized files are deterministic.
 */
public class LocalJsonVectorIndex implements VectorIndex {
    private static final Comparator<SearchResult> NEAREST_FIRST = Comparator
            .comparingDouble(SearchResult::distance)
            .thenComparing(result -> result.chunk().id());

    private final TreeMap<String, IndexedChunk> entries = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final DistanceMetric metric;
    private final String embeddingVersion;
    private int dimension;

    public LocalJsonVectorIndex(DistanceMetric metric, String embeddingVersion) {
        this.metric = metric;
        this.embeddingVersion = embeddingVersion;
    }

    @Override
    public boolean add(DocumentChunk chunk, float[] embedding) {
        lock.writeLock().lock();
        try {
            if (entries.containsKey(chunk.id())) {
                return false;
            }
            if (embedding == null || embedding.length == 0) {
                throw new IllegalArgumentException("Chunk " + chunk.id() + " has no embedding");
            }
            if (dimension == 0) {
                dimension = embedding.length;
            } else if (embedding.length != dimension) {
                throw new IllegalArgumentException("Embedding dimension " + embedding.length
                        + " does not match index dimension " + dimension);
            }
            entries.put(chunk.id(), new IndexedChunk(chunk, embedding.clone()));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean contains(String chunkId) {
        lock.readLock().lock();
        try {
            return entries.containsKey(chunkId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<float[]> embeddingOf(String chunkId) {
        lock.readLock().lock();
        try {
            IndexedChunk entry = entries.get(chunkId);
            return entry == null ? Optional.empty() : Optional.of(entry.embedding().clone());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<DocumentChunk> chunk(String chunkId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(chunkId)).map(IndexedChunk::chunk);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DocumentChunk> chunks() {
        lock.readLock().lock();
        try {
            return entries.values().stream().map(IndexedChunk::chunk).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SearchResult> search(float[] queryEmbedding, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }
        lock.readLock().lock();
        try {
            if (entries.isEmpty()) {
                throw new IndexEmptyException("Cannot search an empty index");
            }
            List<SearchResult> scored = new ArrayList<>(entries.size());
            for (IndexedChunk entry : entries.values()) {
                scored.add(new SearchResult(
                        entry.chunk(),
                        metric.distance(queryEmbedding, entry.embedding()),
                        VectorMath.cosine(queryEmbedding, entry.embedding())));
            }
            return scored.stream().sorted(NEAREST_FIRST).limit(k).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public DistanceMetric metric() {
        return metric;
    }

    public String embeddingVersion() {
        return embeddingVersion;
    }

    public boolean requiresReembedding(String currentVersion) {
        return size() > 0 && !currentVersion.equals(embeddingVersion);
    }

    List<IndexedChunk> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }
}
