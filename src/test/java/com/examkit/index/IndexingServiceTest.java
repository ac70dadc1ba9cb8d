package com.examkit.index;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.examkit.embedding.BatchEmbedder;
import com.examkit.embedding.EmbeddingService;
import com.examkit.embedding.TokenHashEmbeddingService;
import com.examkit.ingest.Chunker;
import com.examkit.ingest.DocumentChunk;
import com.examkit.ingest.Locator;
import com.examkit.ingest.SourceKind;
import com.examkit.ingest.SourceRecord;
import com.examkit.runtime.WorkerPool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexingServiceTest {

    @TempDir
    Path tempDir;

    private final WorkerPool workerPool = new WorkerPool(2);

    @AfterEach
    void closePool() {
        workerPool.close();
    }

    @Test
    void shouldInsertNothingWhenReindexingSameMaterial() throws IOException {
        CountingEmbeddingService embeddings = new CountingEmbeddingService(new TokenHashEmbeddingService(32), "v1");
        List<DocumentChunk> chunks = chunks();

        IndexingReport first = service(embeddings).embedAndIndex("s1", chunks);
        float[] query = embeddings.embed("hash table collisions");
        List<SearchResult> before = service(embeddings).openIndex("s1").search(query, 3);
        int callsAfterFirstRun = embeddings.calls.get();
        IndexingReport second = service(embeddings).embedAndIndex("s1", chunks);

        assertEquals(chunks.size(), first.inserted());
        assertEquals(0, second.inserted());
        assertEquals(chunks.size(), second.skipped());
        assertEquals(callsAfterFirstRun, embeddings.calls.get());
        assertEquals(chunks.size(), service(embeddings).openIndex("s1").size());
        assertEquals(before, service(embeddings).openIndex("s1").search(query, 3));
    }

    @Test
    void shouldReembedWhenEmbeddingVersionChanges() throws IOException {
        List<DocumentChunk> chunks = chunks();
        service(new CountingEmbeddingService(new TokenHashEmbeddingService(32), "v1")).embedAndIndex("s1", chunks);

        CountingEmbeddingService upgraded = new CountingEmbeddingService(new TokenHashEmbeddingService(16), "v2");
        IndexingReport report = service(upgraded).embedAndIndex("s1", chunks);

        assertTrue(report.reembedded());
        assertEquals(chunks.size(), report.inserted());
        LocalJsonVectorIndex reopened = service(upgraded).openIndex("s1");
        assertEquals("v2", reopened.embeddingVersion());
        assertEquals(16, reopened.embeddingOf(chunks.get(0).id()).orElseThrow().length);
    }

    @Test
    void shouldKeepVectorsWhenOnlyMetricChanges() throws IOException {
        CountingEmbeddingService embeddings = new CountingEmbeddingService(new TokenHashEmbeddingService(32), "v1");
        List<DocumentChunk> chunks = chunks();
        service(embeddings).embedAndIndex("s1", chunks);
        int calls = embeddings.calls.get();

        IndexingService l2 = new IndexingService(new IndexStore(tempDir), embeddings,
                new BatchEmbedder(embeddings, workerPool, 4, 5_000), DistanceMetric.L2);
        IndexingReport report = l2.embedAndIndex("s1", chunks);

        assertFalse(report.reembedded());
        assertEquals(0, report.inserted());
        assertEquals(calls, embeddings.calls.get());
        assertEquals(DistanceMetric.L2, l2.openIndex("s1").metric());
    }

    @Test
    void shouldOpenEmptyIndexForNewSession() throws IOException {
        LocalJsonVectorIndex index = service(new TokenHashEmbeddingService(8)).openIndex("fresh");

        assertEquals(0, index.size());
        assertEquals("token-hash-8", index.embeddingVersion());
    }

    private IndexingService service(EmbeddingService embeddings) {
        return new IndexingService(new IndexStore(tempDir), embeddings,
                new BatchEmbedder(embeddings, workerPool, 4, 5_000), DistanceMetric.COSINE);
    }

    private static List<DocumentChunk> chunks() {
        return new Chunker(80).chunk(List.of(
                new SourceRecord(Locator.timeRange(SourceKind.VIDEO, "rec", 0, 30),
                        "Hash tables map keys to buckets. Collisions are resolved by chaining or probing."),
                new SourceRecord(Locator.slide("deck", 5), "Load factor controls resize"),
                new SourceRecord(Locator.question("quiz", "Q1"), "What is the expected lookup cost?")));
    }

    private static class CountingEmbeddingService implements EmbeddingService {
        private final EmbeddingService delegate;
        private final String version;
        private final AtomicInteger calls = new AtomicInteger();

        CountingEmbeddingService(EmbeddingService delegate, String version) {
            this.delegate = delegate;
            this.version = version;
        }

        @Override
        public float[] embed(String text) {
            calls.incrementAndGet();
            return delegate.embed(text);
        }

        @Override
        public int dimension() {
            return delegate.dimension();
        }

        @Override
        public String version() {
            return version;
        }
    }
}
