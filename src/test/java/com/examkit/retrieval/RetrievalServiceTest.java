package com.examkit.retrieval;

import java.util.Comparator;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.examkit.embedding.BatchEmbedder;
import com.examkit.index.DistanceMetric;
import com.examkit.index.IndexEmptyException;
import com.examkit.index.LocalJsonVectorIndex;
import com.examkit.ingest.ContentHashes;
import com.examkit.ingest.DocumentChunk;
import com.examkit.ingest.Locator;
import com.examkit.runtime.EngineSettings;
import com.examkit.runtime.WorkerPool;
import com.examkit.topic.ConceptEmbeddingService;
import com.examkit.topic.Topic;
import com.examkit.topic.TopicAssignment;
import com.examkit.topic.TopicEmbeddings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrievalServiceTest {

    private static final Topic COMPLEXITY = new Topic("complexity", "Algorithmic complexity",
            List.of("Big-O", "sorting"), true);
    private static final Topic GRAPHS = new Topic("graphs", "Graph traversal", List.of("BFS"), false);

    private final ConceptEmbeddingService embeddings = new ConceptEmbeddingService();
    private final EngineSettings.Retrieval settings = EngineSettings.defaults().retrieval();
    private final WorkerPool workerPool = new WorkerPool(2);

    @AfterEach
    void closePool() {
        workerPool.close();
    }

    @Test
    void shouldReturnSameResultForSameInputs() {
        List<DocumentChunk> chunks = complexityChunks();
        LocalJsonVectorIndex index = index(chunks);

        RetrievalResult first = service(index, assign(COMPLEXITY, chunks)).retrieve(COMPLEXITY, 2000);
        RetrievalResult second = service(index, assign(COMPLEXITY, chunks)).retrieve(COMPLEXITY, 2000);

        assertEquals(first, second);
        assertFalse(first.fallbackUsed());
    }

    @Test
    void shouldDropNearDuplicateChunks() {
        List<DocumentChunk> chunks = List.of(
                chunk(1, "merge sort splits the array and merges sorted halves in n log n time"),
                chunk(2, "merge sort splits the array and merges the sorted halves in n log n time"),
                chunk(3, "insertion sort is quadratic on reversed input"));
        LocalJsonVectorIndex index = index(chunks);

        RetrievalResult result = service(index, assign(COMPLEXITY, chunks)).retrieve(COMPLEXITY, 2000);

        assertEquals(2, result.hits().size());
        List<RetrievedChunk> hits = result.hits();
        for (int i = 0; i < hits.size(); i++) {
            for (int j = i + 1; j < hits.size(); j++) {
                assertTrue(TextOverlap.jaccard(hits.get(i).chunk().text(), hits.get(j).chunk().text()) <= 0.8);
            }
        }
    }

    @Test
    void shouldStopAtFirstChunkThatExceedsBudget() {
        List<DocumentChunk> chunks = complexityChunks();
        LocalJsonVectorIndex index = index(chunks);
        List<DocumentChunk> rankOrder = chunks.stream().sorted(Comparator.comparing(DocumentChunk::id)).toList();
        int budget = rankOrder.get(0).text().length() + rankOrder.get(1).text().length();

        RetrievalResult result = service(index, assign(COMPLEXITY, chunks)).retrieve(COMPLEXITY, budget);

        assertTrue(result.totalLength() <= budget);
        assertEquals(List.of(rankOrder.get(0), rankOrder.get(1)),
                result.hits().stream().map(RetrievedChunk::chunk).toList());
        assertFalse(result.budgetTooSmall());
    }

    @Test
    void shouldFlagBudgetTooSmallWhenNothingFits() {
        List<DocumentChunk> chunks = complexityChunks();
        LocalJsonVectorIndex index = index(chunks);

        RetrievalResult result = service(index, assign(COMPLEXITY, chunks)).retrieve(COMPLEXITY, 5);

        assertTrue(result.isEmpty());
        assertTrue(result.budgetTooSmall());
    }

    @Test
    void shouldStopAtOversizedTopCandidateEvenWhenSmallerOneWouldFit() {
        DocumentChunk oversized = chunk(1, "Big-O sorting ".repeat(10).strip());
        DocumentChunk small = chunk(2, "abc");
        LocalJsonVectorIndex index = index(List.of(oversized, small));

        RetrievalResult result = service(index, assign(COMPLEXITY, List.of(oversized, small)))
                .retrieve(COMPLEXITY, 100);

        assertTrue(oversized.text().length() > 100);
        assertTrue(result.isEmpty());
        assertTrue(result.budgetTooSmall());
    }

    @Test
    void shouldFallBackToIndexSearchForTopicWithoutAssignments() {
        List<DocumentChunk> chunks = List.of(chunk(1, "BFS explores a graph breadth first"), chunk(2, "Big-O bounds"));
        LocalJsonVectorIndex index = index(chunks);

        RetrievalResult result = service(index, List.of()).retrieve(GRAPHS, 2000);

        assertTrue(result.fallbackUsed());
        assertEquals(chunks.get(0), result.hits().get(0).chunk());
        assertTrue(result.hits().get(0).score() > result.hits().get(1).score());
    }

    @Test
    void shouldRejectNonPositiveBudget() {
        LocalJsonVectorIndex index = index(complexityChunks());

        assertThrows(IllegalArgumentException.class, () -> service(index, List.of()).retrieve(COMPLEXITY, 0));
    }

    @Test
    void shouldPropagateEmptyIndexOnFallback() {
        LocalJsonVectorIndex empty = new LocalJsonVectorIndex(DistanceMetric.COSINE, embeddings.version());

        assertThrows(IndexEmptyException.class, () -> service(empty, List.of()).retrieve(GRAPHS, 100));
    }

    @Test
    void shouldTreatTwoEmptyTextsAsIdentical() {
        assertEquals(1.0, TextOverlap.jaccard("", " "));
        assertEquals(0.0, TextOverlap.jaccard("heap", ""));
        assertEquals(0.5, TextOverlap.jaccard("a b c", "b c d"), 1e-9);
    }

    private RetrievalService service(LocalJsonVectorIndex index, List<TopicAssignment> assignments) {
        return new RetrievalService(index, new TopicEmbeddings(new BatchEmbedder(embeddings, workerPool, 8, 5_000)),
                assignments, settings);
    }

    private LocalJsonVectorIndex index(List<DocumentChunk> chunks) {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(DistanceMetric.COSINE, embeddings.version());
        chunks.forEach(chunk -> index.add(chunk, embeddings.embed(chunk.text())));
        return index;
    }

    private static List<TopicAssignment> assign(Topic topic, List<DocumentChunk> chunks) {
        return chunks.stream().map(chunk -> new TopicAssignment(chunk.id(), topic.id(), 0.8)).toList();
    }

    private static List<DocumentChunk> complexityChunks() {
        return List.of(
                chunk(1, "Big-O describes asymptotic growth"),
                chunk(2, "Sorting algorithms compared by running time"),
                chunk(3, "Binary search is O(log n) on sorted arrays"),
                chunk(4, "Quadratic sorting is slow on large inputs"));
    }

    private static DocumentChunk chunk(int slide, String text) {
        Locator locator = Locator.slide("deck", slide);
        return new DocumentChunk(ContentHashes.chunkId(locator, text), text, locator);
    }
}
