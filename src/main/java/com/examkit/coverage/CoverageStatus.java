package com.examkit.coverage;

public enum CoverageStatus {
    COVERED,
    PARTIAL,
    MISSING
}
