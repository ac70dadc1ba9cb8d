package com.examkit.citation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;

public class CitationExporter {
    private final ObjectMapper objectMapper = new ObjectMapper();

    public Path export(List<Citation> citations, Path outputPath) throws IOException {
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), citations);
        return outputPath;
    }
}
