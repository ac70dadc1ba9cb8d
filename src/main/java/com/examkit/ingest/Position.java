package com.examkit.ingest;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Where inside a source a span of text sits. Exactly one shape applies per source kind:
 * time ranges for recordings, slide numbers for decks and question ids for exams.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Position.TimeRange.class, name = "time_range"),
        @JsonSubTypes.Type(value = Position.SlideNumber.class, name = "slide_number"),
        @JsonSubTypes.Type(value = Position.QuestionId.class, name = "question_id")
})
public interface Position {

    String canonical();

    record TimeRange(double startSeconds, double endSeconds) implements Position {
        public TimeRange {
            if (startSeconds < 0 || endSeconds < startSeconds) {
                throw new IllegalArgumentException("Invalid time range " + startSeconds + "-" + endSeconds);
            }
        }

        @Override
        public String canonical() {
            return String.format(Locale.ROOT, "t=%.3f-%.3f", startSeconds, endSeconds);
        }
    }

    record SlideNumber(int number) implements Position {
        public SlideNumber {
            if (number < 1) {
                throw new IllegalArgumentException("Slide numbers start at 1, got " + number);
            }
        }

        @Override
        public String canonical() {
            return "slide=" + number;
        }
    }

    record QuestionId(String id) implements Position {
        public QuestionId {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("question id must not be blank");
            }
            id = id.strip();
        }

        @Override
        public String canonical() {
            return "q=" + id;
        }
    }
}
