package com.examkit.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.examkit.citation.Citation;
import com.examkit.citation.CitationRegistry;
import com.examkit.coverage.CoverageReport;
import com.examkit.coverage.CoverageScorer;
import com.examkit.embedding.BatchEmbedder;
import com.examkit.embedding.EmbeddingFailure;
import com.examkit.embedding.EmbeddingService;
import com.examkit.index.IndexEmptyException;
import com.examkit.index.IndexStore;
import com.examkit.index.IndexingReport;
import com.examkit.index.IndexingService;
import com.examkit.index.LocalJsonVectorIndex;
import com.examkit.ingest.Chunker;
import com.examkit.ingest.DocumentChunk;
import com.examkit.ingest.SourceRecord;
import com.examkit.retrieval.RetrievalResult;
import com.examkit.retrieval.RetrievalService;
import com.examkit.runtime.EngineSettings;
import com.examkit.runtime.WorkerPool;
import com.examkit.topic.Topic;
import com.examkit.topic.TopicAssignment;
import com.examkit.topic.TopicEmbeddings;
import com.examkit.topic.TopicMapper;
import com.examkit.topic.TopicMapping;

/**
 * Runs chunking, indexing, topic mapping, coverage scoring and per-topic synthesis for one
 * session. Topics are synthesized concurrently; the index and the run's citation registry are the
 * only shared state.
 *
 * <p>{@link #cancel()} stops the run between embedding batches and between topics. A cancelled
 * pipeline instance is not reusable.
 */
public class StudyPipeline {
    private static final Logger log = LoggerFactory.getLogger(StudyPipeline.class);

    private final Chunker chunker;
    private final BatchEmbedder batchEmbedder;
    private final IndexingService indexingService;
    private final TopicEmbeddings topicEmbeddings;
    private final TopicMapper topicMapper;
    private final CoverageScorer coverageScorer;
    private final ContentGenerator contentGenerator;
    private final EngineSettings settings;
    private final WorkerPool workerPool;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public StudyPipeline(EngineSettings settings, EmbeddingService embeddingService, WorkerPool workerPool,
            ContentGenerator contentGenerator) {
        this.settings = settings;
        this.workerPool = workerPool;
        this.contentGenerator = contentGenerator;
        this.chunker = new Chunker(settings.chunking().maxChars());
        this.batchEmbedder = new BatchEmbedder(embeddingService, workerPool,
                settings.embedding().batchSize(), settings.embedding().timeoutMs());
        this.indexingService = new IndexingService(new IndexStore(settings.index().cacheDir()), embeddingService,
                batchEmbedder, settings.index().metric());
        this.topicEmbeddings = new TopicEmbeddings(batchEmbedder);
        this.topicMapper = new TopicMapper(topicEmbeddings, workerPool, settings.topicMapping());
        this.coverageScorer = new CoverageScorer(settings.coverage());
    }

    public void cancel() {
        cancelled.set(true);
        batchEmbedder.cancel();
    }

    public BuildReport build(String sessionId, List<SourceRecord> records, List<Topic> topics, int budget)
            throws IOException, InterruptedException {
        MDC.put("session", sessionId);
        try {
            List<DocumentChunk> chunks = chunker.chunk(records);
            LocalJsonVectorIndex index = indexingService.openIndex(sessionId);
            IndexingReport indexing = indexingService.embedAndIndex(sessionId, index, chunks);
            for (EmbeddingFailure failure : indexing.failures()) {
                log.error("Embedding batch {} failed for {} chunks: {}", failure.batchIndex(),
                        failure.chunkIds().size(), failure.message());
            }

            List<DocumentChunk> indexed = chunks.stream().filter(chunk -> index.contains(chunk.id())).toList();
            TopicMapping mapping = topicMapper.mapTopics(indexed, topics, index);
            List<TopicAssignment> assignments = mapping.assignments();
            CoverageReport coverage = coverageScorer.scoreCoverage(topics, assignments, indexed);

            CitationRegistry registry = new CitationRegistry();
            RetrievalService retrieval = new RetrievalService(index, topicEmbeddings, assignments, settings.retrieval());
            List<TopicSection> sections = synthesize(topics, budget, retrieval, registry, index);

            boolean wasCancelled = cancelled.get() || batchEmbedder.isCancelled();
            log.info("Build session={} chunks={} assignments={} sections={} citations={} violations={} cancelled={}",
                    sessionId, chunks.size(), assignments.size(), sections.size(), registry.size(),
                    registry.violations().size(), wasCancelled);
            return new BuildReport(sessionId, chunks.size(), indexing, assignments.size(), mapping.failedTopics(),
                    coverage, sections, registry.citations(), registry.violations(), wasCancelled);
        } finally {
            MDC.remove("session");
        }
    }

    private List<TopicSection> synthesize(List<Topic> topics, int budget, RetrievalService retrieval,
            CitationRegistry registry, LocalJsonVectorIndex index) throws InterruptedException {
        List<Future<TopicSection>> futures = new ArrayList<>();
        for (Topic topic : topics) {
            futures.add(workerPool.submit(() -> synthesizeTopic(topic, budget, retrieval, registry, index)));
        }
        List<TopicSection> sections = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                TopicSection section = futures.get(i).get();
                if (section != null) {
                    sections.add(section);
                }
            } catch (ExecutionException e) {
                Topic topic = topics.get(i);
                log.error("Synthesis failed for topic '{}'", topic.id(), e.getCause());
                sections.add(new TopicSection(topic.id(), topic.name(), false, false, List.of(),
                        String.valueOf(e.getCause().getMessage())));
            } catch (InterruptedException e) {
                cancel();
                futures.forEach(future -> future.cancel(true));
                throw e;
            }
        }
        return sections;
    }

    private TopicSection synthesizeTopic(Topic topic, int budget, RetrievalService retrieval,
            CitationRegistry registry, LocalJsonVectorIndex index) {
        if (cancelled.get()) {
            return null;
        }
        MDC.put("topic", topic.id());
        try {
            RetrievalResult result;
            try {
                result = retrieval.retrieve(topic, budget);
            } catch (IndexEmptyException e) {
                log.error("Cannot retrieve context for topic '{}': {}", topic.id(), e.getMessage());
                return new TopicSection(topic.id(), topic.name(), true, false, List.of(), e.getMessage());
            }

            List<TopicSection.CitedUnit> units = new ArrayList<>();
            for (ContentUnit unit : contentGenerator.generate(topic, result.hits())) {
                List<Citation> citations = new ArrayList<>();
                for (String chunkId : unit.sourceChunkIds()) {
                    index.chunk(chunkId).map(registry::cite).ifPresent(citation -> {
                        if (!citations.contains(citation)) {
                            citations.add(citation);
                        }
                    });
                }
                registry.attach(unit.unitId(), citations);
                units.add(new TopicSection.CitedUnit(unit.unitId(), unit.text(), citations));
            }
            return new TopicSection(topic.id(), topic.name(), result.fallbackUsed(), result.budgetTooSmall(), units,
                    null);
        } finally {
            MDC.remove("topic");
        }
    }
}
