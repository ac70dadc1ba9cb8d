package com.examkit.topic;

import java.util.Locale;
import java.util.Map;

import com.examkit.embedding.EmbeddingService;

/**
 * Maps text onto a few concept axes by vocabulary so tests can state which texts are related.
 */
public class ConceptEmbeddingService implements EmbeddingService {
    private static final Map<String, Integer> VOCABULARY = Map.ofEntries(
            Map.entry("big-o", 0), Map.entry("sorting", 0), Map.entry("sort", 0), Map.entry("complexity", 0),
            Map.entry("log", 0), Map.entry("quadratic", 0), Map.entry("search", 0), Map.entry("o(n", 0),
            Map.entry("graph", 1), Map.entry("bfs", 1), Map.entry("dfs", 1), Map.entry("vertex", 1),
            Map.entry("probability", 2), Map.entry("bayes", 2), Map.entry("variance", 2));

    @Override
    public float[] embed(String text) {
        float[] vector = new float[4];
        String lower = text.toLowerCase(Locale.ROOT);
        VOCABULARY.forEach((term, axis) -> {
            if (lower.contains(term)) {
                vector[axis] += 1f;
            }
        });
        if (vector[0] == 0f && vector[1] == 0f && vector[2] == 0f) {
            vector[3] = 1f;
        }
        return vector;
    }

    @Override
    public int dimension() {
        return 4;
    }

    @Override
    public String version() {
        return "concept-test-v1";
    }
}
