package com.examkit.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.examkit.embedding.TokenHashEmbeddingService;
import com.examkit.ingest.ContentHashes;
import com.examkit.ingest.DocumentChunk;
import com.examkit.ingest.Locator;
import com.examkit.ingest.SourceKind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnIdenticalSearchResultsAfterReload() throws IOException {
        TokenHashEmbeddingService embeddings = new TokenHashEmbeddingService(32);
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(DistanceMetric.COSINE, embeddings.version());
        List<DocumentChunk> chunks = List.of(
                chunk(Locator.slide("deck", 1), "Dijkstra finds shortest paths"),
                chunk(Locator.timeRange(SourceKind.VIDEO, "rec", 10, 20), "Bellman-Ford handles negative edges"),
                chunk(Locator.question("final", "Q4"), "Prove Dijkstra is correct"));
        chunks.forEach(chunk -> index.add(chunk, embeddings.embed(chunk.text())));
        IndexStore store = new IndexStore(tempDir);

        store.save("week-3", index);
        LocalJsonVectorIndex reloaded = store.load("week-3").orElseThrow();

        float[] query = embeddings.embed("shortest paths with Dijkstra");
        assertEquals(index.search(query, 3), reloaded.search(query, 3));
        assertEquals(embeddings.version(), reloaded.embeddingVersion());
        assertEquals(DistanceMetric.COSINE, reloaded.metric());
        assertTrue(Files.exists(tempDir.resolve("week-3").resolve("vector-index.json")));
    }

    @Test
    void shouldReturnEmptyWhenNoIndexPersisted() throws IOException {
        assertTrue(new IndexStore(tempDir).load("unknown").isEmpty());
    }

    @Test
    void shouldRaiseCorruptionForUnreadableFile() throws IOException {
        Path sessionDir = Files.createDirectories(tempDir.resolve("broken"));
        Files.writeString(sessionDir.resolve("vector-index.json"), "{\"embeddingVersion\": \"v1\", \"chunks\": [");

        assertThrows(IndexCorruptedException.class, () -> new IndexStore(tempDir).load("broken"));
    }

    @Test
    void shouldRaiseCorruptionForInconsistentDimensions() throws IOException {
        Path sessionDir = Files.createDirectories(tempDir.resolve("mixed"));
        Files.writeString(sessionDir.resolve("vector-index.json"), """
                {"embeddingVersion": "v1", "metric": "COSINE", "chunks": [
                  {"chunk": %s, "embedding": [1.0, 0.0]},
                  {"chunk": %s, "embedding": [1.0, 0.0, 0.5]}
                ]}
                """.formatted(chunkJson("a", 1), chunkJson("b", 2)));

        assertThrows(IndexCorruptedException.class, () -> new IndexStore(tempDir).load("mixed"));
    }

    @Test
    void shouldRejectSessionIdsThatEscapeCacheDir() {
        IndexStore store = new IndexStore(tempDir);

        assertThrows(IllegalArgumentException.class, () -> store.indexPath("../etc"));
        assertThrows(IllegalArgumentException.class, () -> store.indexPath("a/b"));
    }

    private static String chunkJson(String id, int slide) {
        return "{\"id\": \"" + id + "\", \"text\": \"text\", \"locator\": {\"sourceKind\": \"slide\","
                + " \"sourceId\": \"deck\", \"position\": {\"type\": \"slide_number\", \"number\": " + slide + "}}}";
    }

    private static DocumentChunk chunk(Locator locator, String text) {
        return new DocumentChunk(ContentHashes.chunkId(locator, text), text, locator);
    }
}
