package com.examkit.topic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopicCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadTopicsAndDeriveMissingIds() throws IOException {
        Path file = tempDir.resolve("topics.yml");
        Files.writeString(file, """
                topics:
                  - id: complexity
                    name: Algorithmic complexity
                    keywords: [Big-O, " sorting ", ""]
                    required: true
                    description: " Growth of running time. "
                    weight: 2.5
                  - name: Graph Traversal
                    keywords: [BFS]
                    color: blue
                """);

        List<Topic> topics = new TopicCatalog().load(file);

        assertEquals(2, topics.size());
        assertEquals(List.of("Big-O", "sorting"), topics.get(0).keywords());
        assertTrue(topics.get(0).required());
        assertEquals(2.5, topics.get(0).weight());
        assertEquals("Algorithmic complexity Growth of running time. Big-O sorting", topics.get(0).queryText());
        assertEquals("graph_traversal", topics.get(1).id());
        assertFalse(topics.get(1).required());
        assertEquals(1.0, topics.get(1).weight());
        assertEquals("Graph Traversal BFS", topics.get(1).queryText());
    }

    @Test
    void shouldRejectDuplicateIds() {
        List<Topic> topics = List.of(new Topic("a", "A", List.of(), false), new Topic("a", "Other", List.of(), true));

        assertThrows(IllegalArgumentException.class, () -> TopicCatalog.validate(topics));
    }

    @Test
    void shouldFailForMissingFile() {
        assertThrows(IOException.class, () -> new TopicCatalog().load(tempDir.resolve("none.yml")));
    }

    @Test
    void shouldRejectScoreOutsideUnitRange() {
        assertThrows(IllegalArgumentException.class, () -> new TopicAssignment("c", "t", 1.2));
    }
}
