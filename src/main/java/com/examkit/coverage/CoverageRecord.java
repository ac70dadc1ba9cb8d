package com.examkit.coverage;

import java.util.List;

/**
 * Coverage of one topic. {@code weightedCoverage} is {@code coverageScore} scaled by the topic's
 * configured weight and is only used for reporting; status and blocking follow the unweighted score.
 */
public record CoverageRecord(
        String topicId,
        String topicName,
        boolean required,
        int matchedChunkCount,
        double keywordHitRatio,
        double coverageScore,
        double weight,
        double weightedCoverage,
        CoverageStatus status,
        List<String> missingKeywords) {

    public boolean blocking() {
        return required && status == CoverageStatus.MISSING;
    }
}
