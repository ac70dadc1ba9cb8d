package com.examkit.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.examkit.index.DistanceMetric;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Immutable, validated view of {@link AppConfig}. Components take the slice they need at
 * construction time; nothing reads configuration after that.
 */
public record EngineSettings(
        Chunking chunking,
        Embedding embedding,
        Index index,
        TopicMapping topicMapping,
        Retrieval retrieval,
        Coverage coverage,
        int workerThreads) {

    public EngineSettings {
        Objects.requireNonNull(chunking, "chunking");
        Objects.requireNonNull(embedding, "embedding");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(topicMapping, "topicMapping");
        Objects.requireNonNull(retrieval, "retrieval");
        Objects.requireNonNull(coverage, "coverage");
        requirePositive(workerThreads, "workers.threads");
    }

    public static EngineSettings defaults() {
        return from(new AppConfig());
    }

    public static EngineSettings load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            return defaults();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue(configPath.toFile(), AppConfig.class);
        return from(config == null ? new AppConfig() : config);
    }

    public static EngineSettings from(AppConfig config) {
        AppConfig.ChunkingConfig chunking = config.getChunking();
        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        AppConfig.IndexConfig index = config.getIndex();
        AppConfig.TopicMappingConfig mapping = config.getTopicMapping();
        AppConfig.RetrievalConfig retrieval = config.getRetrieval();
        AppConfig.CoverageConfig coverage = config.getCoverage();
        return new EngineSettings(
                new Chunking(chunking.getMaxChars()),
                new Embedding(embedding.getDimension(), embedding.getBatchSize(), embedding.getTimeoutMs()),
                new Index(DistanceMetric.parse(index.getMetric()), Path.of(index.getCacheDir())),
                new TopicMapping(mapping.getThreshold(), mapping.getSimilarityWeight(), mapping.getKeywordWeight()),
                new Retrieval(retrieval.getDuplicateThreshold(), retrieval.getFallbackTopK(), retrieval.getDefaultBudget()),
                new Coverage(coverage.getChunkWeight(), coverage.getKeywordWeight(), coverage.getSaturationCount(),
                        coverage.getHighThreshold(), coverage.getLowThreshold()),
                config.getWorkers().getThreads());
    }

    public record Chunking(int maxChars) {
        public Chunking {
            requirePositive(maxChars, "chunking.maxChars");
        }
    }

    public record Embedding(int dimension, int batchSize, long timeoutMs) {
        public Embedding {
            requirePositive(dimension, "embedding.dimension");
            requirePositive(batchSize, "embedding.batchSize");
            if (timeoutMs < 1) {
                throw new IllegalArgumentException("embedding.timeoutMs must be >= 1");
            }
        }
    }

    public record Index(DistanceMetric metric, Path cacheDir) {
        public Index {
            Objects.requireNonNull(metric, "index.metric");
            Objects.requireNonNull(cacheDir, "index.cacheDir");
        }
    }

    public record TopicMapping(double threshold, double similarityWeight, double keywordWeight) {
        public TopicMapping {
            requireUnit(threshold, "topicMapping.threshold");
            requireUnit(similarityWeight, "topicMapping.similarityWeight");
            requireUnit(keywordWeight, "topicMapping.keywordWeight");
            if (similarityWeight + keywordWeight <= 0) {
                throw new IllegalArgumentException("topicMapping weights must not both be zero");
            }
        }
    }

    public record Retrieval(double duplicateThreshold, int fallbackTopK, int defaultBudget) {
        public Retrieval {
            requireUnit(duplicateThreshold, "retrieval.duplicateThreshold");
            requirePositive(fallbackTopK, "retrieval.fallbackTopK");
            requirePositive(defaultBudget, "retrieval.defaultBudget");
        }
    }

    public record Coverage(double chunkWeight, double keywordWeight, int saturationCount,
            double highThreshold, double lowThreshold) {
        public Coverage {
            requireUnit(chunkWeight, "coverage.chunkWeight");
            requireUnit(keywordWeight, "coverage.keywordWeight");
            requirePositive(saturationCount, "coverage.saturationCount");
            requireUnit(highThreshold, "coverage.highThreshold");
            requireUnit(lowThreshold, "coverage.lowThreshold");
            if (lowThreshold > highThreshold) {
                throw new IllegalArgumentException("coverage.lowThreshold must not exceed coverage.highThreshold");
            }
        }
    }

    private static void requirePositive(long value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got " + value);
        }
    }

    private static void requireUnit(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1], got " + value);
        }
    }
}
