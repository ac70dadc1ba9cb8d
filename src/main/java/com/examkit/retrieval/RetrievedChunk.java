package com.examkit.retrieval;

import com.examkit.ingest.DocumentChunk;

public record RetrievedChunk(DocumentChunk chunk, double score) {
}
