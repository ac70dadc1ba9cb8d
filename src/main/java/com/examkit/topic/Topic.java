package com.examkit.topic;

import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Topic(String id, String name, List<String> keywords, boolean required, String description,
        double weight) {

    @JsonCreator
    public Topic {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("topic name must not be blank");
        }
        name = name.strip();
        if (id == null || id.isBlank()) {
            id = name.toLowerCase(Locale.ROOT).replace(' ', '_');
        }
        keywords = keywords == null
                ? List.of()
                : keywords.stream().filter(keyword -> keyword != null && !keyword.isBlank()).map(String::strip).toList();
        description = description == null ? "" : description.strip();
        weight = weight <= 0 ? 1.0 : weight;
    }

    public Topic(String id, String name, List<String> keywords, boolean required) {
        this(id, name, keywords, required, "", 1.0);
    }

    /** Text embedded to represent the topic as a query vector: name, description, then keywords. */
    public String queryText() {
        StringBuilder text = new StringBuilder(name);
        if (!description.isEmpty()) {
            text.append(' ').append(description);
        }
        for (String keyword : keywords) {
            text.append(' ').append(keyword);
        }
        return text.toString();
    }
}
