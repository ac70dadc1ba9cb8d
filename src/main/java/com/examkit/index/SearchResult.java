package com.examkit.index;

import com.examkit.ingest.DocumentChunk;

public record SearchResult(DocumentChunk chunk, float distance, float similarity) {
}
