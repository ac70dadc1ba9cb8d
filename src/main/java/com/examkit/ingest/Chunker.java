package com.examkit.ingest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits normalized source records into bounded, non-overlapping chunks.
 *
 * <p>Text is cut on paragraph and sentence boundaries first and on word boundaries only when a
 * single sentence exceeds the limit. Output is a pure function of the input records.
 */
public class Chunker {
    private static final Logger log = LoggerFactory.getLogger(Chunker.class);
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x09\\x0B\\x0C\\x0E-\\x1F\\x7F-\\x9F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxChars;

    public Chunker(int maxChars) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars must be >= 1");
        }
        this.maxChars = maxChars;
    }

    public int maxChars() {
        return maxChars;
    }

    public List<DocumentChunk> chunk(List<SourceRecord> records) {
        Map<String, DocumentChunk> byId = new LinkedHashMap<>();
        for (SourceRecord record : records) {
            for (DocumentChunk chunk : chunk(record)) {
                if (byId.putIfAbsent(chunk.id(), chunk) != null) {
                    log.debug("Dropping repeated chunk {} from {}", chunk.id(), chunk.locator().key());
                }
            }
        }
        log.info("Split {} records into {} chunks (maxChars={})", records.size(), byId.size(), maxChars);
        return List.copyOf(byId.values());
    }

    public List<DocumentChunk> chunk(SourceRecord record) {
        String flattened = collapse(record.text());
        if (flattened.isEmpty()) {
            return List.of();
        }
        if (flattened.length() <= maxChars) {
            return List.of(toChunk(record.locator(), flattened));
        }

        List<String> pieces = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(stripControl(record.text()))) {
            for (String sentence : SENTENCE_END.split(collapse(paragraph))) {
                if (sentence.isEmpty()) {
                    continue;
                }
                if (sentence.length() <= maxChars) {
                    pieces.add(sentence);
                } else {
                    pieces.addAll(splitOnWords(sentence));
                }
            }
        }

        List<DocumentChunk> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String piece : pieces) {
            if (current.length() > 0 && current.length() + 1 + piece.length() > maxChars) {
                chunks.add(toChunk(record.locator(), current.toString()));
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(piece);
        }
        if (current.length() > 0) {
            chunks.add(toChunk(record.locator(), current.toString()));
        }
        return chunks;
    }

    private List<String> splitOnWords(String sentence) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : sentence.split(" ")) {
            if (word.length() > maxChars) {
                if (current.length() > 0) {
                    out.add(current.toString());
                    current.setLength(0);
                }
                // no boundary to honour inside a single oversized token
                for (int start = 0; start < word.length(); start += maxChars) {
                    out.add(word.substring(start, Math.min(word.length(), start + maxChars)));
                }
                continue;
            }
            if (current.length() > 0 && current.length() + 1 + word.length() > maxChars) {
                out.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
        }
        if (current.length() > 0) {
            out.add(current.toString());
        }
        return out;
    }

    private static DocumentChunk toChunk(Locator locator, String text) {
        return new DocumentChunk(ContentHashes.chunkId(locator, text), text, locator);
    }

    static String collapse(String text) {
        return WHITESPACE.matcher(stripControl(text)).replaceAll(" ").strip();
    }

    private static String stripControl(String text) {
        return CONTROL_CHARS.matcher(text).replaceAll(" ");
    }
}
