package com.examkit.embedding;

import java.util.List;

public record EmbeddingOutcome(List<EmbeddedChunk> embedded, List<EmbeddingFailure> failures, int cancelledChunks) {

    public int failedChunks() {
        return failures.stream().mapToInt(failure -> failure.chunkIds().size()).sum();
    }

    public boolean complete() {
        return failures.isEmpty() && cancelledChunks == 0;
    }
}
