package com.examkit.retrieval;

import java.util.List;

/**
 * Ranked, deduplicated and budget-bounded chunks for one topic.
 *
 * @param fallbackUsed the topic had no assigned chunks and the hits come from a similarity search
 *        over the whole index
 * @param budgetTooSmall candidates existed but none was selected. Packing stops at the first
 *        candidate that would overflow, so this is set as soon as the top-ranked candidate alone
 *        exceeds the budget, even when a lower-ranked, shorter candidate would have fit. It is not
 *        "the budget is smaller than the smallest candidate".
 */
public record RetrievalResult(String topicId, int budget, List<RetrievedChunk> hits, boolean fallbackUsed,
        boolean budgetTooSmall) {

    public RetrievalResult {
        hits = List.copyOf(hits);
    }

    public int totalLength() {
        return hits.stream().mapToInt(hit -> hit.chunk().text().length()).sum();
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
