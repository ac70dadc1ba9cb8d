package com.examkit.citation;

public record UncitedContentViolation(String unitId, String message) {
}
