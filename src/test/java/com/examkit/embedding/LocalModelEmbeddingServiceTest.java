package com.examkit.embedding;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalModelEmbeddingServiceTest {

    @Test
    void shouldBeDeterministicAndNormalized() {
        LocalModelEmbeddingService service = new LocalModelEmbeddingService(64);

        float[] first = service.embed("Binary search runs in logarithmic time");
        float[] second = service.embed("Binary search runs in logarithmic time");

        assertArrayEquals(first, second);
        assertEquals(1.0, VectorMath.cosine(first, first), 1e-5);
        assertEquals(64, first.length);
    }

    @Test
    void shouldScoreRelatedTextHigherThanUnrelatedText() {
        LocalModelEmbeddingService service = new LocalModelEmbeddingService(256);
        float[] query = service.embed("sorting algorithm complexity");

        float related = VectorMath.cosine(query, service.embed("merge sort algorithm has n log n complexity"));
        float unrelated = VectorMath.cosine(query, service.embed("the french revolution began in 1789"));

        assertTrue(related > unrelated, related + " <= " + unrelated);
    }

    @Test
    void shouldEmbedBlankTextAsZeroVector() {
        float[] vector = new LocalModelEmbeddingService(8).embed("  ");

        assertArrayEquals(new float[8], vector);
        assertEquals(0f, VectorMath.cosine(vector, vector));
    }
}
