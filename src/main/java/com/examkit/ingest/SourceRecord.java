package com.examkit.ingest;

import java.util.Objects;

public record SourceRecord(Locator locator, String text) {
    public SourceRecord {
        Objects.requireNonNull(locator, "locator");
        text = text == null ? "" : text;
    }
}
