package com.examkit.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.examkit.retrieval.RetrievedChunk;
import com.examkit.topic.Topic;

/**
 * Offline generator that lifts the leading sentence of each retrieved chunk. Used when no
 * language model is configured.
 */
public class ExtractiveContentGenerator implements ContentGenerator {
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final int MAX_SENTENCE_CHARS = 240;

    @Override
    public List<ContentUnit> generate(Topic topic, List<RetrievedChunk> context) {
        if (context.isEmpty()) {
            return List.of(new ContentUnit(topic.id() + "#1", topic.id(),
                    "No source material was found for " + topic.name() + ".", List.of()));
        }
        List<ContentUnit> units = new ArrayList<>();
        for (RetrievedChunk hit : context) {
            String sentence = SENTENCE_END.split(hit.chunk().text().strip(), 2)[0];
            if (sentence.length() > MAX_SENTENCE_CHARS) {
                sentence = sentence.substring(0, MAX_SENTENCE_CHARS) + "...";
            }
            units.add(new ContentUnit(topic.id() + "#" + (units.size() + 1), topic.id(), sentence,
                    List.of(hit.chunk().id())));
        }
        return units;
    }
}
