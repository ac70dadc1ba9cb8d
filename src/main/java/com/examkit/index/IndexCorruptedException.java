package com.examkit.index;

import java.io.IOException;

public class IndexCorruptedException extends IOException {
    public IndexCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
