package com.examkit.topic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class TopicCatalog {
    private static final Logger log = LoggerFactory.getLogger(TopicCatalog.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public List<Topic> load(Path topicsPath) throws IOException {
        if (!Files.exists(topicsPath)) {
            throw new IOException("Topics file not found: " + topicsPath);
        }
        TopicsFile file = mapper.readValue(topicsPath.toFile(), TopicsFile.class);
        List<Topic> topics = validate(file == null || file.topics() == null ? List.of() : file.topics());
        log.info("Loaded {} topics ({} required) from {}", topics.size(),
                topics.stream().filter(Topic::required).count(), topicsPath);
        return topics;
    }

    public static List<Topic> validate(List<Topic> topics) {
        Set<String> seen = new HashSet<>();
        for (Topic topic : topics) {
            if (!seen.add(topic.id())) {
                throw new IllegalArgumentException("Duplicate topic id: " + topic.id());
            }
        }
        return List.copyOf(topics);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TopicsFile(List<Topic> topics) {
    }
}
