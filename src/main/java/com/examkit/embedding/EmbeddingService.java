package com.examkit.embedding;

import java.util.ArrayList;
import java.util.List;

public interface EmbeddingService {
    float[] embed(String text);

    int dimension();

    default List<float[]> embedBatch(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String text : texts) {
            out.add(embed(text));
        }
        return out;
    }

    default String version() {
        return "legacy-v1";
    }
}
