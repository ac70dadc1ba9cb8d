package com.examkit.coverage;

import java.util.List;

public class MissingRequiredTopicCoverageException extends RuntimeException {
    private final List<String> topicIds;

    public MissingRequiredTopicCoverageException(List<String> topicIds) {
        super("Required topics without coverage: " + String.join(", ", topicIds));
        this.topicIds = List.copyOf(topicIds);
    }

    public List<String> topicIds() {
        return topicIds;
    }
}
