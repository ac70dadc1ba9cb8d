package com.examkit.embedding;

import java.util.List;

public record EmbeddingFailure(int batchIndex, List<String> chunkIds, String message) {
}
