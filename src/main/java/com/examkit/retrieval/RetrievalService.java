package com.examkit.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examkit.embedding.VectorMath;
import com.examkit.index.SearchResult;
import com.examkit.index.VectorIndex;
import com.examkit.ingest.DocumentChunk;
import com.examkit.runtime.EngineSettings;
import com.examkit.topic.Topic;
import com.examkit.topic.TopicAssignment;
import com.examkit.topic.TopicEmbeddings;

/**
 * Selects generation context for a topic from the chunks mapped to it, falling back to a plain
 * similarity search over the whole index when the topic has no mapped chunks.
 */
public class RetrievalService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);
    private static final Comparator<RetrievedChunk> BEST_FIRST = Comparator
            .comparingDouble(RetrievedChunk::score).reversed()
            .thenComparing(hit -> hit.chunk().id());

    private final VectorIndex index;
    private final TopicEmbeddings topicEmbeddings;
    private final Map<String, List<String>> chunkIdsByTopic;
    private final double duplicateThreshold;
    private final int fallbackTopK;

    public RetrievalService(VectorIndex index, TopicEmbeddings topicEmbeddings, List<TopicAssignment> assignments,
            EngineSettings.Retrieval settings) {
        this.index = index;
        this.topicEmbeddings = topicEmbeddings;
        this.duplicateThreshold = settings.duplicateThreshold();
        this.fallbackTopK = settings.fallbackTopK();
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (TopicAssignment assignment : assignments) {
            grouped.computeIfAbsent(assignment.topicId(), unused -> new ArrayList<>()).add(assignment.chunkId());
        }
        this.chunkIdsByTopic = grouped;
    }

    /**
     * @throws IllegalArgumentException when {@code budget} is not positive
     * @throws com.examkit.index.IndexEmptyException when the topic needs the fallback search and the
     *         index is empty
     */
    public RetrievalResult retrieve(Topic topic, int budget) {
        if (budget < 1) {
            throw new IllegalArgumentException("budget must be >= 1, got " + budget);
        }
        float[] topicVector = topicEmbeddings.vectorFor(topic);
        List<String> assigned = chunkIdsByTopic.getOrDefault(topic.id(), List.of());

        boolean fallbackUsed = assigned.isEmpty();
        List<RetrievedChunk> ranked = fallbackUsed
                ? fallbackCandidates(topic, topicVector)
                : assignedCandidates(assigned, topicVector);

        List<RetrievedChunk> unique = deduplicate(ranked);

        List<RetrievedChunk> selected = new ArrayList<>();
        int used = 0;
        for (RetrievedChunk candidate : unique) {
            int length = candidate.chunk().text().length();
            if (used + length > budget) {
                break;
            }
            selected.add(candidate);
            used += length;
        }

        boolean budgetTooSmall = selected.isEmpty() && !unique.isEmpty();
        if (budgetTooSmall) {
            log.warn("Budget {} is smaller than the top-ranked candidate ({} chars) for topic '{}'",
                    budget, unique.get(0).chunk().text().length(), topic.id());
        }
        log.debug("Retrieved {} of {} candidates for topic '{}' using {}/{} chars (fallback={})",
                selected.size(), unique.size(), topic.id(), used, budget, fallbackUsed);
        return new RetrievalResult(topic.id(), budget, selected, fallbackUsed, budgetTooSmall);
    }

    private List<RetrievedChunk> assignedCandidates(List<String> chunkIds, float[] topicVector) {
        List<RetrievedChunk> candidates = new ArrayList<>();
        for (String chunkId : chunkIds) {
            Optional<DocumentChunk> chunk = index.chunk(chunkId);
            Optional<float[]> vector = index.embeddingOf(chunkId);
            if (chunk.isEmpty() || vector.isEmpty()) {
                log.debug("Assigned chunk {} is not in the index; skipping", chunkId);
                continue;
            }
            candidates.add(new RetrievedChunk(chunk.get(), VectorMath.cosine(vector.get(), topicVector)));
        }
        candidates.sort(BEST_FIRST);
        return candidates;
    }

    private List<RetrievedChunk> fallbackCandidates(Topic topic, float[] topicVector) {
        log.warn("Topic '{}' has no assigned chunks; falling back to similarity search over the full index",
                topic.id());
        List<SearchResult> results = index.search(topicVector, fallbackTopK);
        List<RetrievedChunk> candidates = new ArrayList<>();
        for (SearchResult result : results) {
            candidates.add(new RetrievedChunk(result.chunk(), result.similarity()));
        }
        candidates.sort(BEST_FIRST);
        return candidates;
    }

    private List<RetrievedChunk> deduplicate(List<RetrievedChunk> ranked) {
        List<RetrievedChunk> kept = new ArrayList<>();
        List<Set<String>> keptTokens = new ArrayList<>();
        for (RetrievedChunk candidate : ranked) {
            Set<String> tokens = TextOverlap.tokens(candidate.chunk().text());
            boolean duplicate = keptTokens.stream()
                    .anyMatch(existing -> TextOverlap.jaccard(existing, tokens) > duplicateThreshold);
            if (duplicate) {
                log.debug("Dropping near-duplicate chunk {}", candidate.chunk().id());
                continue;
            }
            kept.add(candidate);
            keptTokens.add(tokens);
        }
        return kept;
    }
}
