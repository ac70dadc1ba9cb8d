package com.examkit.ingest;

public record DocumentChunk(String id, String text, Locator locator) {
}
