package com.examkit.index;

public class IndexEmptyException extends IllegalStateException {
    public IndexEmptyException(String message) {
        super(message);
    }
}
