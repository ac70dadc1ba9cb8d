package com.examkit.topic;

import java.util.List;
import java.util.Map;

/**
 * The (chunk, topic) relation plus the topics that could not be scored, keyed by topic id with the
 * failure message. A failed topic has no assignments.
 */
public record TopicMapping(List<TopicAssignment> assignments, Map<String, String> failedTopics) {

    public TopicMapping {
        assignments = List.copyOf(assignments);
        failedTopics = Map.copyOf(failedTopics);
    }

    public boolean complete() {
        return failedTopics.isEmpty();
    }
}
