package com.examkit.embedding;

import com.examkit.ingest.DocumentChunk;

public record EmbeddedChunk(DocumentChunk chunk, float[] embedding) {
}
