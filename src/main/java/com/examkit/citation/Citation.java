package com.examkit.citation;

import com.examkit.ingest.Locator;

/**
 * A source reference shared by every chunk cut from the same locator.
 *
 * @param id hash of the locator key, stable across runs
 * @param number 1-based position in first-use order, stable within one run
 */
public record Citation(String id, int number, String displayText, Locator locator) {

    public String marker() {
        return "[" + number + "]";
    }
}
