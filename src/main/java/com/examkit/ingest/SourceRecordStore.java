package com.examkit.ingest;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the normalized JSONL records written by the transcript, slide and exam parsers.
 *
 * <p>Each line is an object with {@code source}, {@code text} and one positional field
 * ({@code start}/{@code end}, {@code slide_number} or {@code question_id}). {@code source_id} is
 * optional and defaults to the file's session-qualified stem.
 */
public class SourceRecordStore {
    private static final Logger log = LoggerFactory.getLogger(SourceRecordStore.class);
    private static final List<String> SESSION_PARTS = List.of("transcript", "slides", "exam");

    private final ObjectMapper mapper = new ObjectMapper();

    public List<SourceRecord> loadSession(Path cacheDir, String sessionId) throws IOException {
        List<SourceRecord> records = new ArrayList<>();
        for (String part : SESSION_PARTS) {
            Path file = cacheDir.resolve(sessionId + "_" + part + ".jsonl");
            if (!Files.exists(file)) {
                log.debug("No {} records for session {} at {}", part, sessionId, file);
                continue;
            }
            records.addAll(load(file));
        }
        log.info("Loaded {} source records for session {}", records.size(), sessionId);
        return records;
    }

    public List<SourceRecord> load(Path jsonlPath) throws IOException {
        String defaultSourceId = stem(jsonlPath);
        List<SourceRecord> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(jsonlPath, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(toRecord(mapper.readTree(line), defaultSourceId, lineNumber));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    throw new IOException("Invalid record at " + jsonlPath + ":" + lineNumber + ": " + e.getMessage(), e);
                }
            }
        }
        return records;
    }

    private SourceRecord toRecord(JsonNode node, String defaultSourceId, int lineNumber) {
        SourceKind kind = SourceKind.fromWireName(node.path("source").asText(""));
        String sourceId = node.hasNonNull("source_id") ? node.get("source_id").asText() : defaultSourceId;
        String text = node.path("text").asText("");
        Locator locator = switch (kind) {
            case VIDEO, TRANSCRIPT -> {
                double start = node.path("start").asDouble(0.0);
                double end = node.hasNonNull("end") ? node.get("end").asDouble() : start;
                yield Locator.timeRange(kind, sourceId, start, end);
            }
            case SLIDE -> {
                if (!node.hasNonNull("slide_number")) {
                    throw new IllegalArgumentException("slide record has no slide_number");
                }
                yield Locator.slide(sourceId, node.get("slide_number").asInt(0));
            }
            case EXAM -> Locator.question(sourceId,
                    node.hasNonNull("question_id") ? node.get("question_id").asText() : "Q" + lineNumber);
        };
        return new SourceRecord(locator, text);
    }

    private static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
