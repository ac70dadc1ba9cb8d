package com.examkit.topic;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.examkit.embedding.BatchEmbedder;

/**
 * Caches each topic's representative vector so the mapper and the retriever query with the same
 * embedding of the same text. Vectors are computed through the {@link BatchEmbedder}, so they get
 * its timeout and single retry; a failed text is not cached and is retried on the next request.
 */
public class TopicEmbeddings {
    private final BatchEmbedder embedder;
    private final Map<String, float[]> vectors = new ConcurrentHashMap<>();

    public TopicEmbeddings(BatchEmbedder embedder) {
        this.embedder = embedder;
    }

    /**
     * @throws com.examkit.embedding.EmbeddingException when the query text cannot be embedded
     */
    public float[] vectorFor(Topic topic) {
        return vectors.computeIfAbsent(topic.id() + "\u001F" + topic.queryText(),
                unused -> embedder.embedText(topic.queryText())).clone();
    }

    float[] vectorForText(String text) {
        return embedder.embedText(text);
    }
}
