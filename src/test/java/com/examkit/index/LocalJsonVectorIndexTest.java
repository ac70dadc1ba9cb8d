package com.examkit.index;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.examkit.ingest.ContentHashes;
import com.examkit.ingest.DocumentChunk;
import com.examkit.ingest.Locator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalJsonVectorIndexTest {

    @Test
    void shouldIgnoreRepeatedInsertOfSameChunk() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(DistanceMetric.COSINE, "v1");
        DocumentChunk chunk = chunk(1, "stacks are LIFO");

        assertTrue(index.add(chunk, new float[] { 1f, 0f }));
        assertFalse(index.add(chunk, new float[] { 0f, 1f }));

        assertEquals(1, index.size());
        assertEquals(1f, index.embeddingOf(chunk.id()).orElseThrow()[0]);
    }

    @Test
    void shouldReturnNearestFirstAndBreakTiesByChunkId() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(DistanceMetric.COSINE, "v1");
        DocumentChunk far = chunk(1, "graphs");
        DocumentChunk tieA = chunk(2, "queues");
        DocumentChunk tieB = chunk(3, "deques");
        index.add(far, new float[] { 0f, 1f });
        index.add(tieA, new float[] { 1f, 0f });
        index.add(tieB, new float[] { 2f, 0f });

        List<SearchResult> results = index.search(new float[] { 1f, 0f }, 3);

        assertEquals(3, results.size());
        String firstTie = tieA.id().compareTo(tieB.id()) < 0 ? tieA.id() : tieB.id();
        assertEquals(firstTie, results.get(0).chunk().id());
        assertEquals(far.id(), results.get(2).chunk().id());
        assertEquals(0f, results.get(0).distance(), 1e-6);
        assertEquals(1f, results.get(2).distance(), 1e-6);
    }

    @Test
    void shouldLimitResultsToK() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(DistanceMetric.L2, "v1");
        for (int i = 1; i <= 5; i++) {
            index.add(chunk(i, "item " + i), new float[] { i, 0f });
        }

        List<SearchResult> results = index.search(new float[] { 0f, 0f }, 2);

        assertEquals(2, results.size());
        assertEquals(1f, results.get(0).distance(), 1e-6);
        assertEquals(2f, results.get(1).distance(), 1e-6);
        assertThrows(IllegalArgumentException.class, () -> index.search(new float[] { 0f, 0f }, 0));
    }

    @Test
    void shouldThrowWhenSearchingEmptyIndex() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(DistanceMetric.COSINE, "v1");

        assertThrows(IndexEmptyException.class, () -> index.search(new float[] { 1f }, 1));
    }

    @Test
    void shouldRejectMismatchedDimension() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(DistanceMetric.COSINE, "v1");
        index.add(chunk(1, "a"), new float[] { 1f, 0f });

        assertThrows(IllegalArgumentException.class, () -> index.add(chunk(2, "b"), new float[] { 1f, 0f, 0f }));
    }

    @Test
    void shouldFlagReembeddingOnlyForNonEmptyIndexWithOtherVersion() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(DistanceMetric.COSINE, "v1");
        assertFalse(index.requiresReembedding("v2"));

        index.add(chunk(1, "a"), new float[] { 1f });

        assertTrue(index.requiresReembedding("v2"));
        assertFalse(index.requiresReembedding("v1"));
    }

    static DocumentChunk chunk(int slide, String text) {
        Locator locator = Locator.slide("deck", slide);
        return new DocumentChunk(ContentHashes.chunkId(locator, text), text, locator);
    }
}
