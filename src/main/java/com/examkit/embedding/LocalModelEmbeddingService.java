package com.examkit.embedding;

import java.util.Locale;
import java.util.Set;

/**
 * Offline embedding built from hashed tokens, character trigrams and a boost for vocabulary that
 * recurs across lecture material (complexity classes, proofs, exam phrasing).
 */
public class LocalModelEmbeddingService implements EmbeddingService {
    private static final String VERSION = "local-lecture-v1";
    private static final Set<String> LECTURE_TERMS = Set.of(
            "theorem", "lemma", "proof", "definition", "algorithm", "complexity",
            "derivation", "formula", "equation", "example", "exam", "lecture");

    private final int dimension;

    public LocalModelEmbeddingService(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
            if (LECTURE_TERMS.contains(token)) {
                addHashed(vector, "term:" + token, 1.6f);
            }
        }

        VectorMath.normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION + "-" + dimension;
    }

    private void addHashed(float[] vector, String key, float weight) {
        vector[Math.floorMod(key.hashCode(), vector.length)] += weight;
    }
}
