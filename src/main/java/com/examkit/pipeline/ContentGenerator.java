package com.examkit.pipeline;

import java.util.List;

import com.examkit.retrieval.RetrievedChunk;
import com.examkit.topic.Topic;

/**
 * Produces study content for a topic from its retrieved context. Each unit names the chunks it
 * draws on so the pipeline can bind it to citations.
 */
@FunctionalInterface
public interface ContentGenerator {
    List<ContentUnit> generate(Topic topic, List<RetrievedChunk> context);
}
