package com.examkit.topic;

public record TopicAssignment(String chunkId, String topicId, double score) {
    public TopicAssignment {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("assignment score must be within [0,1], got " + score);
        }
    }
}
