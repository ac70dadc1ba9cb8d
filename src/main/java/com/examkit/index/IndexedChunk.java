package com.examkit.index;

import com.examkit.ingest.DocumentChunk;

public record IndexedChunk(DocumentChunk chunk, float[] embedding) {
}
