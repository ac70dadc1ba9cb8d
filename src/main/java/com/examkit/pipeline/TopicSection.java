package com.examkit.pipeline;

import java.util.List;

import com.examkit.citation.Citation;

public record TopicSection(
        String topicId,
        String topicName,
        boolean fallbackUsed,
        boolean budgetTooSmall,
        List<CitedUnit> units,
        String error) {

    public TopicSection {
        units = List.copyOf(units);
    }

    public boolean failed() {
        return error != null;
    }

    public record CitedUnit(String unitId, String text, List<Citation> citations) {
        public CitedUnit {
            citations = List.copyOf(citations);
        }
    }
}
