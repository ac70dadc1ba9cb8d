package com.examkit;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examkit.coverage.CoverageRecord;
import com.examkit.coverage.CoverageReport;
import com.examkit.coverage.CoverageReportWriter;
import com.examkit.coverage.CoverageScorer;
import com.examkit.embedding.BatchEmbedder;
import com.examkit.embedding.EmbeddingService;
import com.examkit.embedding.EmbeddingServices;
import com.examkit.index.IndexStore;
import com.examkit.index.IndexingReport;
import com.examkit.index.IndexingService;
import com.examkit.index.LocalJsonVectorIndex;
import com.examkit.ingest.Chunker;
import com.examkit.ingest.DocumentChunk;
import com.examkit.ingest.SourceRecord;
import com.examkit.ingest.SourceRecordStore;
import com.examkit.pipeline.BuildArtifactsWriter;
import com.examkit.pipeline.BuildReport;
import com.examkit.pipeline.ExtractiveContentGenerator;
import com.examkit.pipeline.StudyPipeline;
import com.examkit.retrieval.RetrievalResult;
import com.examkit.retrieval.RetrievalService;
import com.examkit.retrieval.RetrievedChunk;
import com.examkit.runtime.EngineSettings;
import com.examkit.runtime.WorkerPool;
import com.examkit.topic.Topic;
import com.examkit.topic.TopicAssignment;
import com.examkit.topic.TopicCatalog;
import com.examkit.topic.TopicEmbeddings;
import com.examkit.topic.TopicMapper;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "examkit",
        mixinStandardHelpOptions = true,
        version = "examkit 0.1.0",
        description = "Indexes lecture material and builds topic-indexed, cited study content.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_USAGE = 2;
    static final int EXIT_MISSING_REQUIRED = 3;
    static final int EXIT_CANCELLED = 4;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "config/examkit.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "build")
    Mode mode;

    @Option(names = "--session", description = "Source session id", required = true)
    String sessionId;

    @Option(names = "--records-dir", description = "Directory holding <session>_{transcript,slides,exam}.jsonl; defaults to the index cache dir")
    Path recordsDir;

    @Option(names = "--records", description = "Explicit normalized JSONL record files (repeatable)")
    List<Path> recordFiles = new ArrayList<>();

    @Option(names = "--topics", description = "Topics YAML file", defaultValue = "config/topics.yml")
    Path topicsPath;

    @Option(names = "--topic", description = "Topic id used in retrieve mode")
    String topicId;

    @Option(names = "--budget", description = "Character budget per topic; defaults to retrieval.defaultBudget")
    Integer budget;

    @Option(names = "--out-dir", description = "Directory for build artifacts", defaultValue = "out")
    Path outDir;

    @Option(names = "--allow-missing-required", description = "Do not fail the build when a required topic is missing", defaultValue = "false")
    boolean allowMissingRequired;

    enum Mode {
        index,
        coverage,
        retrieve,
        build
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        EngineSettings settings = EngineSettings.load(configPath);
        log.info("Starting examkit in {} mode for session {}", mode, sessionId);
        log.info("Using config file: {} (cacheDir={}, metric={}, maxChars={})", configPath,
                settings.index().cacheDir(), settings.index().metric(), settings.chunking().maxChars());
        int effectiveBudget = budget == null ? settings.retrieval().defaultBudget() : budget;
        if (effectiveBudget < 1) {
            log.error("--budget must be >= 1");
            return EXIT_USAGE;
        }

        EmbeddingService embeddingService = EmbeddingServices.fromEnvironment(settings.embedding());
        try (WorkerPool workerPool = new WorkerPool(settings.workerThreads())) {
            return switch (mode) {
                case index -> runIndex(settings, embeddingService, workerPool);
                case coverage -> runCoverage(settings, embeddingService, workerPool);
                case retrieve -> runRetrieve(settings, embeddingService, workerPool, effectiveBudget);
                case build -> runBuild(settings, embeddingService, workerPool, effectiveBudget);
            };
        }
    }

    private int runIndex(EngineSettings settings, EmbeddingService embeddingService, WorkerPool workerPool)
            throws IOException {
        List<DocumentChunk> chunks = new Chunker(settings.chunking().maxChars()).chunk(loadRecords(settings));
        IndexingReport report = indexingService(settings, embeddingService, workerPool).embedAndIndex(sessionId, chunks);
        log.info("Indexed session: inserted={}, skipped={}, failed={}, cancelled={}, reembedded={}",
                report.inserted(), report.skipped(), report.failedChunks(), report.cancelled(), report.reembedded());
        report.failures().forEach(failure -> log.error("Batch {} failed ({} chunks): {}",
                failure.batchIndex(), failure.chunkIds().size(), failure.message()));
        return 0;
    }

    private int runCoverage(EngineSettings settings, EmbeddingService embeddingService, WorkerPool workerPool)
            throws IOException, InterruptedException {
        List<Topic> topics = new TopicCatalog().load(topicsPath);
        LocalJsonVectorIndex index = indexingService(settings, embeddingService, workerPool).openIndex(sessionId);
        List<DocumentChunk> chunks = index.chunks();
        TopicEmbeddings topicEmbeddings = new TopicEmbeddings(batchEmbedder(settings, embeddingService, workerPool));
        List<TopicAssignment> assignments = new TopicMapper(topicEmbeddings, workerPool, settings.topicMapping())
                .mapTopics(chunks, topics, index)
                .assignments();
        CoverageReport report = new CoverageScorer(settings.coverage()).scoreCoverage(topics, assignments, chunks);
        for (CoverageRecord record : report.records()) {
            log.info("Topic {} status={} score={} chunks={} keywordHitRatio={}",
                    record.topicId(),
                    record.status(),
                    String.format(Locale.ROOT, "%.3f", record.coverageScore()),
                    record.matchedChunkCount(),
                    String.format(Locale.ROOT, "%.2f", record.keywordHitRatio()));
        }
        System.out.println(report.summary());
        CoverageReportWriter writer = new CoverageReportWriter();
        writer.writeCsv(report, outDir.resolve(sessionId + "_coverage.csv"));
        writer.writeJson(report, outDir.resolve(sessionId + "_coverage.json"));
        return coverageExitCode(report.blockingTopics().isEmpty());
    }

    private int runRetrieve(EngineSettings settings, EmbeddingService embeddingService, WorkerPool workerPool,
            int effectiveBudget) throws IOException, InterruptedException {
        if (topicId == null || topicId.isBlank()) {
            log.error("--topic is required in retrieve mode");
            return EXIT_USAGE;
        }
        List<Topic> topics = new TopicCatalog().load(topicsPath);
        Topic topic = topics.stream().filter(candidate -> candidate.id().equals(topicId)).findFirst().orElse(null);
        if (topic == null) {
            log.error("Unknown topic id {}", topicId);
            return EXIT_USAGE;
        }
        LocalJsonVectorIndex index = indexingService(settings, embeddingService, workerPool).openIndex(sessionId);
        TopicEmbeddings topicEmbeddings = new TopicEmbeddings(batchEmbedder(settings, embeddingService, workerPool));
        List<TopicAssignment> assignments = new TopicMapper(topicEmbeddings, workerPool, settings.topicMapping())
                .mapTopics(index.chunks(), List.of(topic), index)
                .assignments();
        RetrievalResult result = new RetrievalService(index, topicEmbeddings, assignments, settings.retrieval())
                .retrieve(topic, effectiveBudget);
        log.info("Topic {} fallbackUsed={} budgetTooSmall={}", topic.id(), result.fallbackUsed(),
                result.budgetTooSmall());
        List<RetrievedChunk> hits = result.hits();
        for (int i = 0; i < hits.size(); i++) {
            RetrievedChunk hit = hits.get(i);
            log.info("Result #{} score={} locator={} text={}",
                    i + 1,
                    String.format(Locale.ROOT, "%.4f", hit.score()),
                    hit.chunk().locator().key(),
                    hit.chunk().text());
        }
        return 0;
    }

    private int runBuild(EngineSettings settings, EmbeddingService embeddingService, WorkerPool workerPool,
            int effectiveBudget) throws IOException, InterruptedException {
        List<Topic> topics = new TopicCatalog().load(topicsPath);
        List<SourceRecord> records = loadRecords(settings);
        if (records.isEmpty()) {
            log.error("No source records found for session {}; run the ingestion step first", sessionId);
            return EXIT_USAGE;
        }
        StudyPipeline pipeline = new StudyPipeline(settings, embeddingService, workerPool,
                new ExtractiveContentGenerator());
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = cancelOnShutdown(pipeline, finished, settings.embedding().timeoutMs() * 2);
        Runtime.getRuntime().addShutdownHook(hook);
        BuildReport report;
        try {
            report = pipeline.build(sessionId, records, topics, effectiveBudget);
            new BuildArtifactsWriter().write(report, outDir);
        } finally {
            finished.countDown();
            removeHook(hook);
        }
        System.out.println(report.coverage().summary());

        if (!report.violations().isEmpty()) {
            log.warn("{} content units have no citation", report.violations().size());
        }
        if (report.cancelled()) {
            log.error("Build for session {} was cancelled", sessionId);
            return EXIT_CANCELLED;
        }
        return coverageExitCode(report.blockingTopicIds().isEmpty());
    }

    /**
     * Cancels the build when the JVM is asked to stop and waits up to {@code waitMs} for the
     * cancelled run to write its artifacts.
     */
    static Thread cancelOnShutdown(StudyPipeline pipeline, CountDownLatch finished, long waitMs) {
        return new Thread(() -> {
            log.warn("Shutdown requested; cancelling build");
            pipeline.cancel();
            try {
                if (!finished.await(waitMs, TimeUnit.MILLISECONDS)) {
                    log.warn("Build did not stop within {}ms", waitMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "examkit-shutdown");
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is already shutting down; keeping the cancel hook");
        }
    }

    private int coverageExitCode(boolean noBlockingTopics) {
        if (noBlockingTopics) {
            return 0;
        }
        if (allowMissingRequired) {
            log.warn("Required topics are missing coverage; continuing because --allow-missing-required is set");
            return 0;
        }
        log.error("Required topics are missing coverage; failing the build");
        return EXIT_MISSING_REQUIRED;
    }

    private List<SourceRecord> loadRecords(EngineSettings settings) throws IOException {
        SourceRecordStore store = new SourceRecordStore();
        if (!recordFiles.isEmpty()) {
            List<SourceRecord> records = new ArrayList<>();
            for (Path file : recordFiles) {
                records.addAll(store.load(file));
            }
            return records;
        }
        Path dir = recordsDir == null ? settings.index().cacheDir() : recordsDir;
        return store.loadSession(dir, sessionId);
    }

    private IndexingService indexingService(EngineSettings settings, EmbeddingService embeddingService,
            WorkerPool workerPool) {
        return new IndexingService(new IndexStore(settings.index().cacheDir()), embeddingService,
                batchEmbedder(settings, embeddingService, workerPool), settings.index().metric());
    }

    private static BatchEmbedder batchEmbedder(EngineSettings settings, EmbeddingService embeddingService,
            WorkerPool workerPool) {
        return new BatchEmbedder(embeddingService, workerPool, settings.embedding().batchSize(),
                settings.embedding().timeoutMs());
    }
}
