package com.examkit.ingest;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceKind {
    VIDEO,
    TRANSCRIPT,
    SLIDE,
    EXAM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SourceKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("source kind must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "video", "asr" -> VIDEO;
            case "transcript" -> TRANSCRIPT;
            case "slide", "slides" -> SLIDE;
            case "exam" -> EXAM;
            default -> throw new IllegalArgumentException("Unknown source kind: " + value);
        };
    }

    public boolean isTimed() {
        return this == VIDEO || this == TRANSCRIPT;
    }
}
