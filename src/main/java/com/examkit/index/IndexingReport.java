package com.examkit.index;

import java.util.List;

import com.examkit.embedding.EmbeddingFailure;

public record IndexingReport(
        String sessionId,
        int inserted,
        int skipped,
        int cancelled,
        boolean reembedded,
        List<EmbeddingFailure> failures) {

    public int failedChunks() {
        return failures.stream().mapToInt(failure -> failure.chunkIds().size()).sum();
    }
}
