package com.examkit.coverage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/**
 * Writes the coverage table as CSV (highest score first) and the full report as JSON.
 */
public class CoverageReportWriter {
    private static final Logger log = LoggerFactory.getLogger(CoverageReportWriter.class);

    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public Path writeCsv(CoverageReport report, Path outputPath) throws IOException {
        createParent(outputPath);
        List<CsvRow> rows = report.records().stream()
                .sorted(Comparator.comparingDouble(CoverageRecord::coverageScore).reversed()
                        .thenComparing(CoverageRecord::topicId))
                .map(CsvRow::of)
                .toList();
        CsvSchema schema = csvMapper.schemaFor(CsvRow.class).withHeader();
        csvMapper.writer(schema).writeValue(outputPath.toFile(), rows);
        log.info("Coverage report saved to: {}", outputPath);
        return outputPath;
    }

    public Path writeJson(CoverageReport report, Path outputPath) throws IOException {
        createParent(outputPath);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), report);
        return outputPath;
    }

    private static void createParent(Path outputPath) throws IOException {
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
    }

    @JsonPropertyOrder({
            "topic_id", "name", "required", "chunk_count", "keyword_hit_ratio", "coverage_score", "weight",
            "weighted_coverage", "status",
            "missing_keywords" })
    record CsvRow(
            @JsonProperty("topic_id") String topicId,
            @JsonProperty("name") String name,
            @JsonProperty("required") boolean required,
            @JsonProperty("chunk_count") int chunkCount,
            @JsonProperty("keyword_hit_ratio") String keywordHitRatio,
            @JsonProperty("coverage_score") String coverageScore,
            @JsonProperty("weight") String weight,
            @JsonProperty("weighted_coverage") String weightedCoverage,
            @JsonProperty("status") String status,
            @JsonProperty("missing_keywords") String missingKeywords) {

        static CsvRow of(CoverageRecord record) {
            return new CsvRow(
                    record.topicId(),
                    record.topicName(),
                    record.required(),
                    record.matchedChunkCount(),
                    String.format(Locale.ROOT, "%.3f", record.keywordHitRatio()),
                    String.format(Locale.ROOT, "%.3f", record.coverageScore()),
                    String.format(Locale.ROOT, "%.2f", record.weight()),
                    String.format(Locale.ROOT, "%.3f", record.weightedCoverage()),
                    record.status().name().toLowerCase(Locale.ROOT),
                    String.join(";", record.missingKeywords()));
        }
    }
}
