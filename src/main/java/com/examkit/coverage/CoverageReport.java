package com.examkit.coverage;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record CoverageReport(List<CoverageRecord> records) {

    public CoverageReport {
        records = List.copyOf(records);
    }

    public List<CoverageRecord> blockingTopics() {
        return records.stream().filter(CoverageRecord::blocking).toList();
    }

    public List<CoverageRecord> gaps() {
        return records.stream().filter(record -> record.status() != CoverageStatus.COVERED).toList();
    }

    /**
     * @throws MissingRequiredTopicCoverageException when a required topic is missing and the caller
     *         did not allow it
     */
    public void requireCoverage(boolean allowMissingRequired) {
        List<CoverageRecord> blocking = blockingTopics();
        if (!blocking.isEmpty() && !allowMissingRequired) {
            throw new MissingRequiredTopicCoverageException(blocking.stream().map(CoverageRecord::topicId).toList());
        }
    }

    public Statistics statistics() {
        if (records.isEmpty()) {
            return new Statistics(0.0, 0.0, 0.0, 0.0);
        }
        double[] scores = records.stream().mapToDouble(CoverageRecord::coverageScore).sorted().toArray();
        double mean = 0.0;
        for (double score : scores) {
            mean += score;
        }
        mean /= scores.length;
        return new Statistics(mean, scores[scores.length / 2], scores[0], scores[scores.length - 1]);
    }

    public String summary() {
        if (records.isEmpty()) {
            return "No coverage data available.";
        }
        Statistics stats = statistics();
        List<String> lines = new ArrayList<>();
        lines.add("Topic Coverage Summary");
        lines.add("=".repeat(50));
        lines.add("Total Topics: " + records.size());
        lines.add(String.format(Locale.ROOT, "Mean Coverage: %.1f%%", stats.mean() * 100));
        lines.add(String.format(Locale.ROOT, "Median Coverage: %.1f%%", stats.median() * 100));
        lines.add(String.format(Locale.ROOT, "Coverage Range: %.1f%% - %.1f%%", stats.min() * 100, stats.max() * 100));
        lines.add("");
        List<CoverageRecord> gaps = gaps();
        if (gaps.isEmpty()) {
            lines.add("All topics have adequate coverage");
        } else {
            lines.add(gaps.size() + " topics below full coverage:");
            for (CoverageRecord gap : gaps) {
                lines.add(String.format(Locale.ROOT, "  - %s: %.1f%% (%s%s)",
                        gap.topicName(),
                        gap.coverageScore() * 100,
                        gap.status().name().toLowerCase(Locale.ROOT),
                        gap.required() ? ", required" : ""));
            }
        }
        return String.join("\n", lines);
    }

    public record Statistics(double mean, double median, double min, double max) {
    }
}
