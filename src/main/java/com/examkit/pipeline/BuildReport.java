package com.examkit.pipeline;

import java.util.List;
import java.util.Map;

import com.examkit.citation.Citation;
import com.examkit.citation.UncitedContentViolation;
import com.examkit.coverage.CoverageRecord;
import com.examkit.coverage.CoverageReport;
import com.examkit.index.IndexingReport;

public record BuildReport(
        String sessionId,
        int chunkCount,
        IndexingReport indexing,
        int assignmentCount,
        Map<String, String> topicMappingFailures,
        CoverageReport coverage,
        List<TopicSection> sections,
        List<Citation> citations,
        List<UncitedContentViolation> violations,
        boolean cancelled) {

    public BuildReport {
        topicMappingFailures = Map.copyOf(topicMappingFailures);
        sections = List.copyOf(sections);
        citations = List.copyOf(citations);
        violations = List.copyOf(violations);
    }

    public List<String> blockingTopicIds() {
        return coverage.blockingTopics().stream().map(CoverageRecord::topicId).toList();
    }

    /** A build fails when a required topic is missing, unless the caller allows it. */
    public boolean failed(boolean allowMissingRequired) {
        return cancelled || (!allowMissingRequired && !blockingTopicIds().isEmpty());
    }
}
