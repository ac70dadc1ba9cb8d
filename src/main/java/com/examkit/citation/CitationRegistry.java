package com.examkit.citation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examkit.ingest.ContentHashes;
import com.examkit.ingest.DocumentChunk;

/**
 * Append-only registry of the citations used during one synthesis run.
 *
 * <p>{@link #cite} is an atomic check-or-create keyed by the chunk's locator, so chunks sharing a
 * locator always resolve to one citation, even when topics are synthesized concurrently.
 */
public class CitationRegistry {
    private static final Logger log = LoggerFactory.getLogger(CitationRegistry.class);

    private final Map<String, Citation> byLocatorKey = new ConcurrentHashMap<>();
    private final Map<String, List<Citation>> byUnit = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<UncitedContentViolation> violations = new ConcurrentLinkedQueue<>();
    private final AtomicInteger counter = new AtomicInteger();

    public Citation cite(DocumentChunk chunk) {
        return byLocatorKey.computeIfAbsent(chunk.locator().key(), unused -> new Citation(
                ContentHashes.locatorId(chunk.locator()),
                counter.incrementAndGet(),
                CitationFormatter.displayText(chunk.locator()),
                chunk.locator()));
    }

    /**
     * Records that a generated unit relies on the given citations.
     *
     * @return {@code false} when the unit carries no citation; the unit is then reported as an
     *         {@link UncitedContentViolation} instead of being rejected
     */
    public boolean attach(String unitId, List<Citation> citations) {
        if (unitId == null || unitId.isBlank()) {
            throw new IllegalArgumentException("unitId must not be blank");
        }
        for (Citation citation : citations) {
            Citation known = byLocatorKey.get(citation.locator().key());
            if (known == null || !known.id().equals(citation.id())) {
                throw new IllegalArgumentException("Citation " + citation.id() + " was not issued by this registry");
            }
        }
        byUnit.compute(unitId, (unused, existing) -> {
            List<Citation> merged = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            for (Citation citation : citations) {
                if (!merged.contains(citation)) {
                    merged.add(citation);
                }
            }
            return List.copyOf(merged);
        });
        if (citations.isEmpty()) {
            violations.add(new UncitedContentViolation(unitId, "content unit has no citation"));
            log.warn("Uncited content unit {}", unitId);
            return false;
        }
        return true;
    }

    public List<Citation> citationsFor(String unitId) {
        return byUnit.getOrDefault(unitId, List.of());
    }

    public List<Citation> citations() {
        return byLocatorKey.values().stream()
                .sorted(Comparator.comparingInt(Citation::number))
                .toList();
    }

    public List<UncitedContentViolation> violations() {
        return List.copyOf(violations);
    }

    public int size() {
        return byLocatorKey.size();
    }
}
