package com.examkit.topic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examkit.embedding.EmbeddingException;
import com.examkit.embedding.VectorMath;
import com.examkit.index.VectorIndex;
import com.examkit.ingest.DocumentChunk;
import com.examkit.runtime.EngineSettings;
import com.examkit.runtime.WorkerPool;

/**
 * Scores every (chunk, topic) pair as a weighted blend of embedding similarity and literal
 * keyword hits, and keeps the pairs that reach the threshold. The relation is always rebuilt in
 * full; there is no incremental update.
 */
public class TopicMapper {
    private static final Logger log = LoggerFactory.getLogger(TopicMapper.class);
    private static final Comparator<TopicAssignment> ORDER = Comparator
            .comparing(TopicAssignment::topicId)
            .thenComparing(TopicAssignment::chunkId);

    private final TopicEmbeddings topicEmbeddings;
    private final WorkerPool workerPool;
    private final double threshold;
    private final double similarityWeight;
    private final double keywordWeight;

    public TopicMapper(TopicEmbeddings topicEmbeddings, WorkerPool workerPool, EngineSettings.TopicMapping settings) {
        this.topicEmbeddings = topicEmbeddings;
        this.workerPool = workerPool;
        this.threshold = settings.threshold();
        this.similarityWeight = settings.similarityWeight();
        this.keywordWeight = settings.keywordWeight();
    }

    /**
     * A topic whose query text cannot be embedded is reported in {@link TopicMapping#failedTopics()}
     * and the other topics are still mapped. A chunk that is not in the index and cannot be embedded
     * is left out of the relation.
     */
    public TopicMapping mapTopics(List<DocumentChunk> chunks, List<Topic> topics, VectorIndex index)
            throws InterruptedException {
        Map<String, float[]> chunkVectors = new LinkedHashMap<>();
        List<DocumentChunk> distinct = new ArrayList<>();
        for (DocumentChunk chunk : chunks) {
            if (chunkVectors.containsKey(chunk.id())) {
                continue;
            }
            Optional<float[]> indexed = index.embeddingOf(chunk.id());
            float[] vector;
            try {
                vector = indexed.isPresent() ? indexed.get() : topicEmbeddings.vectorForText(chunk.text());
            } catch (EmbeddingException e) {
                log.error("Chunk {} is not indexed and could not be embedded; leaving it unmapped: {}",
                        chunk.id(), e.getMessage());
                continue;
            }
            distinct.add(chunk);
            chunkVectors.put(chunk.id(), vector);
        }

        List<Future<List<TopicAssignment>>> futures = new ArrayList<>();
        for (Topic topic : topics) {
            futures.add(workerPool.submit(() -> mapTopic(topic, distinct, chunkVectors)));
        }

        List<TopicAssignment> assignments = new ArrayList<>();
        Map<String, String> failedTopics = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                List<TopicAssignment> forTopic = futures.get(i).get();
                log.info("Topic '{}': {} chunks mapped", topics.get(i).id(), forTopic.size());
                assignments.addAll(forTopic);
            } catch (ExecutionException e) {
                String message = String.valueOf(e.getCause().getMessage());
                log.error("Topic mapping failed for '{}': {}", topics.get(i).id(), message);
                failedTopics.put(topics.get(i).id(), message);
            } catch (InterruptedException e) {
                futures.forEach(future -> future.cancel(true));
                throw e;
            }
        }
        assignments.sort(ORDER);
        return new TopicMapping(assignments, failedTopics);
    }

    public double score(Topic topic, float[] topicVector, DocumentChunk chunk, float[] chunkVector) {
        double similarity = Math.max(0.0, VectorMath.cosine(chunkVector, topicVector));
        double blended = (similarityWeight * similarity) + (keywordWeight * keywordFraction(topic, chunk.text()));
        return Math.min(1.0, Math.max(0.0, blended));
    }

    static double keywordFraction(Topic topic, String text) {
        if (topic.keywords().isEmpty()) {
            return 0.0;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        long hits = topic.keywords().stream()
                .filter(keyword -> haystack.contains(keyword.toLowerCase(Locale.ROOT)))
                .count();
        return (double) hits / topic.keywords().size();
    }

    private List<TopicAssignment> mapTopic(Topic topic, List<DocumentChunk> chunks, Map<String, float[]> chunkVectors) {
        float[] topicVector = topicEmbeddings.vectorFor(topic);
        List<TopicAssignment> out = new ArrayList<>();
        for (DocumentChunk chunk : chunks) {
            double score = score(topic, topicVector, chunk, chunkVectors.get(chunk.id()));
            if (score >= threshold) {
                out.add(new TopicAssignment(chunk.id(), topic.id(), score));
            }
        }
        return out;
    }
}
