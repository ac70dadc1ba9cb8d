package com.examkit.pipeline;

import java.util.List;

public record ContentUnit(String unitId, String topicId, String text, List<String> sourceChunkIds) {
    public ContentUnit {
        sourceChunkIds = sourceChunkIds == null ? List.of() : List.copyOf(sourceChunkIds);
    }
}
