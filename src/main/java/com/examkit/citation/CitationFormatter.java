package com.examkit.citation;

import java.util.Locale;

import com.examkit.ingest.Locator;
import com.examkit.ingest.Position;

public final class CitationFormatter {
    private CitationFormatter() {
    }

    public static String displayText(Locator locator) {
        Position position = locator.position();
        String label;
        if (position instanceof Position.TimeRange range) {
            label = "[vid " + timecode(range.startSeconds()) + "]";
        } else if (position instanceof Position.SlideNumber slide) {
            label = "[slide " + slide.number() + "]";
        } else if (position instanceof Position.QuestionId question) {
            label = "[exam " + question.id() + "]";
        } else {
            label = "[" + locator.sourceKind().wireName() + "]";
        }
        return label + " " + locator.sourceId();
    }

    static String timecode(double seconds) {
        long total = (long) Math.floor(seconds);
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long secs = total % 60;
        return String.format(Locale.ROOT, "%02d:%02d:%02d", hours, minutes, secs);
    }
}
