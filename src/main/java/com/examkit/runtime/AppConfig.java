package com.examkit.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ChunkingConfig chunking = new ChunkingConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private IndexConfig index = new IndexConfig();
    private TopicMappingConfig topicMapping = new TopicMappingConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private CoverageConfig coverage = new CoverageConfig();
    private WorkersConfig workers = new WorkersConfig();

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public TopicMappingConfig getTopicMapping() {
        return topicMapping;
    }

    public void setTopicMapping(TopicMappingConfig topicMapping) {
        this.topicMapping = topicMapping == null ? new TopicMappingConfig() : topicMapping;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public CoverageConfig getCoverage() {
        return coverage;
    }

    public void setCoverage(CoverageConfig coverage) {
        this.coverage = coverage == null ? new CoverageConfig() : coverage;
    }

    public WorkersConfig getWorkers() {
        return workers;
    }

    public void setWorkers(WorkersConfig workers) {
        this.workers = workers == null ? new WorkersConfig() : workers;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int maxChars = 500;

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private int dimension = 384;
        private int batchSize = 32;
        private long timeoutMs = 30000;

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String metric = "cosine";
        private String cacheDir = "cache";

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric;
        }

        public String getCacheDir() {
            return cacheDir;
        }

        public void setCacheDir(String cacheDir) {
            this.cacheDir = cacheDir;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TopicMappingConfig {
        private double threshold = 0.3;
        private double similarityWeight = 0.6;
        private double keywordWeight = 0.4;

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public double getSimilarityWeight() {
            return similarityWeight;
        }

        public void setSimilarityWeight(double similarityWeight) {
            this.similarityWeight = similarityWeight;
        }

        public double getKeywordWeight() {
            return keywordWeight;
        }

        public void setKeywordWeight(double keywordWeight) {
            this.keywordWeight = keywordWeight;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private double duplicateThreshold = 0.8;
        private int fallbackTopK = 8;
        private int defaultBudget = 2000;

        public double getDuplicateThreshold() {
            return duplicateThreshold;
        }

        public void setDuplicateThreshold(double duplicateThreshold) {
            this.duplicateThreshold = duplicateThreshold;
        }

        public int getFallbackTopK() {
            return fallbackTopK;
        }

        public void setFallbackTopK(int fallbackTopK) {
            this.fallbackTopK = fallbackTopK;
        }

        public int getDefaultBudget() {
            return defaultBudget;
        }

        public void setDefaultBudget(int defaultBudget) {
            this.defaultBudget = defaultBudget;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CoverageConfig {
        private double chunkWeight = 0.5;
        private double keywordWeight = 0.5;
        private int saturationCount = 3;
        private double highThreshold = 0.7;
        private double lowThreshold = 0.3;

        public double getChunkWeight() {
            return chunkWeight;
        }

        public void setChunkWeight(double chunkWeight) {
            this.chunkWeight = chunkWeight;
        }

        public double getKeywordWeight() {
            return keywordWeight;
        }

        public void setKeywordWeight(double keywordWeight) {
            this.keywordWeight = keywordWeight;
        }

        public int getSaturationCount() {
            return saturationCount;
        }

        public void setSaturationCount(int saturationCount) {
            this.saturationCount = saturationCount;
        }

        public double getHighThreshold() {
            return highThreshold;
        }

        public void setHighThreshold(double highThreshold) {
            this.highThreshold = highThreshold;
        }

        public double getLowThreshold() {
            return lowThreshold;
        }

        public void setLowThreshold(double lowThreshold) {
            this.lowThreshold = lowThreshold;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WorkersConfig {
        private int threads = 4;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }
}
