package com.examkit.ingest;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record Locator(SourceKind sourceKind, String sourceId, Position position) {
    public Locator {
        Objects.requireNonNull(sourceKind, "sourceKind");
        Objects.requireNonNull(position, "position");
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
        sourceId = sourceId.strip();
        boolean matches = switch (sourceKind) {
            case VIDEO, TRANSCRIPT -> position instanceof Position.TimeRange;
            case SLIDE -> position instanceof Position.SlideNumber;
            case EXAM -> position instanceof Position.QuestionId;
        };
        if (!matches) {
            throw new IllegalArgumentException(
                    "Position " + position.canonical() + " does not fit source kind " + sourceKind.wireName());
        }
    }

    public static Locator timeRange(SourceKind kind, String sourceId, double startSeconds, double endSeconds) {
        return new Locator(kind, sourceId, new Position.TimeRange(startSeconds, endSeconds));
    }

    public static Locator slide(String sourceId, int slideNumber) {
        return new Locator(SourceKind.SLIDE, sourceId, new Position.SlideNumber(slideNumber));
    }

    public static Locator question(String sourceId, String questionId) {
        return new Locator(SourceKind.EXAM, sourceId, new Position.QuestionId(questionId));
    }

    /** Canonical join key shared by chunks and citations that point at the same span. */
    @JsonIgnore
    public String key() {
        return sourceKind.wireName() + "|" + sourceId + "|" + position.canonical();
    }
}
