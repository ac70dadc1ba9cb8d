package com.examkit.citation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import com.examkit.ingest.ContentHashes;
import com.examkit.ingest.DocumentChunk;
import com.examkit.ingest.Locator;
import com.examkit.ingest.SourceKind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CitationRegistryTest {

    @Test
    void shouldShareOneCitationPerLocator() {
        CitationRegistry registry = new CitationRegistry();
        Locator locator = Locator.timeRange(SourceKind.VIDEO, "lecture-02", 125.4, 140.0);

        Citation first = registry.cite(chunk(locator, "part one"));
        Citation second = registry.cite(chunk(locator, "part two"));
        Citation other = registry.cite(chunk(Locator.slide("deck", 2), "slide text"));

        assertSame(first, second);
        assertEquals(1, first.number());
        assertEquals(2, other.number());
        assertEquals("[1]", first.marker());
        assertEquals("[vid 00:02:05] lecture-02", first.displayText());
        assertEquals(ContentHashes.locatorId(locator), first.id());
        assertEquals(2, registry.size());
    }

    @Test
    void shouldAssignUniqueNumbersUnderConcurrentUse() throws Exception {
        CitationRegistry registry = new CitationRegistry();
        List<Locator> locators = new ArrayList<>();
        for (int i = 1; i <= 50; i++) {
            locators.add(Locator.slide("deck", i));
        }
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Citation>> tasks = new ArrayList<>();
            for (int round = 0; round < 4; round++) {
                for (Locator locator : locators) {
                    tasks.add(() -> registry.cite(chunk(locator, "text")));
                }
            }
            for (Future<Citation> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(50, registry.size());
        Set<Integer> numbers = new HashSet<>();
        registry.citations().forEach(citation -> numbers.add(citation.number()));
        assertEquals(50, numbers.size());
        assertEquals(1, registry.citations().get(0).number());
        assertEquals(50, registry.citations().get(49).number());
    }

    @Test
    void shouldRecordViolationForUnitWithoutCitations() {
        CitationRegistry registry = new CitationRegistry();

        boolean cited = registry.attach("graphs#1", List.of());

        assertFalse(cited);
        assertEquals(1, registry.violations().size());
        assertEquals("graphs#1", registry.violations().get(0).unitId());
    }

    @Test
    void shouldAttachIssuedCitationsOnce() {
        CitationRegistry registry = new CitationRegistry();
        Citation citation = registry.cite(chunk(Locator.question("final", "Q7"), "Prove it"));

        assertTrue(registry.attach("proofs#1", List.of(citation)));
        assertTrue(registry.attach("proofs#1", List.of(citation)));

        assertEquals(List.of(citation), registry.citationsFor("proofs#1"));
        assertTrue(registry.violations().isEmpty());
        assertEquals("[exam Q7] final", citation.displayText());
    }

    @Test
    void shouldRejectCitationFromAnotherRegistry() {
        Citation foreign = new CitationRegistry().cite(chunk(Locator.slide("deck", 1), "x"));

        assertThrows(IllegalArgumentException.class, () -> new CitationRegistry().attach("u", List.of(foreign)));
    }

    @Test
    void shouldFormatLongTimecodes() {
        assertEquals("01:01:01", CitationFormatter.timecode(3661.9));
        assertEquals("[slide 4] deck", CitationFormatter.displayText(Locator.slide("deck", 4)));
    }

    private static DocumentChunk chunk(Locator locator, String text) {
        return new DocumentChunk(ContentHashes.chunkId(locator, text), text, locator);
    }
}
