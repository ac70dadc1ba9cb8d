package com.examkit.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examkit.citation.CitationExporter;
import com.examkit.citation.UncitedContentViolation;
import com.examkit.coverage.CoverageReportWriter;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes a build's citations, coverage table and cited content next to each other in the output
 * directory, prefixed with the session id.
 */
public class BuildArtifactsWriter {
    private static final Logger log = LoggerFactory.getLogger(BuildArtifactsWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CoverageReportWriter coverageWriter = new CoverageReportWriter();
    private final CitationExporter citationExporter = new CitationExporter();

    public List<Path> write(BuildReport report, Path outDir) throws IOException {
        Files.createDirectories(outDir);
        String prefix = report.sessionId();

        Path citations = citationExporter.export(report.citations(), outDir.resolve(prefix + "_citations.json"));

        Path coverage = coverageWriter.writeCsv(report.coverage(), outDir.resolve(prefix + "_coverage.csv"));

        Path content = outDir.resolve(prefix + "_content.json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(content.toFile(), report.sections());

        Path qa = outDir.resolve(prefix + "_qa.json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(qa.toFile(), new QaSummary(
                report.violations().size(),
                report.violations().stream().map(UncitedContentViolation::unitId).toList(),
                report.blockingTopicIds(),
                report.indexing().failedChunks(),
                report.topicMappingFailures().keySet().stream().sorted().toList()));

        log.info("Wrote build artifacts for session {} to {}", prefix, outDir);
        return List.of(citations, coverage, content, qa);
    }

    record QaSummary(int uncitedUnits, List<String> uncitedUnitIds, List<String> missingRequiredTopics,
            int failedEmbeddingChunks, List<String> unmappedTopics) {
    }
}
