package com.examkit.coverage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examkit.ingest.DocumentChunk;
import com.examkit.runtime.EngineSettings;
import com.examkit.topic.Topic;
import com.examkit.topic.TopicAssignment;

public class CoverageScorer {
    private static final Logger log = LoggerFactory.getLogger(CoverageScorer.class);

    private final EngineSettings.Coverage settings;

    public CoverageScorer(EngineSettings.Coverage settings) {
        this.settings = settings;
    }

    public CoverageReport scoreCoverage(List<Topic> topics, List<TopicAssignment> assignments,
            List<DocumentChunk> chunks) {
        Map<String, String> textById = new LinkedHashMap<>();
        for (DocumentChunk chunk : chunks) {
            textById.put(chunk.id(), chunk.text());
        }
        Map<String, Set<String>> chunkIdsByTopic = new LinkedHashMap<>();
        for (TopicAssignment assignment : assignments) {
            chunkIdsByTopic.computeIfAbsent(assignment.topicId(), unused -> new LinkedHashSet<>())
                    .add(assignment.chunkId());
        }

        List<CoverageRecord> records = new ArrayList<>();
        for (Topic topic : topics) {
            Set<String> matched = chunkIdsByTopic.getOrDefault(topic.id(), Set.of());
            StringBuilder union = new StringBuilder();
            for (String chunkId : matched) {
                String text = textById.get(chunkId);
                if (text == null) {
                    log.warn("Assignment for topic {} references unknown chunk {}", topic.id(), chunkId);
                    continue;
                }
                union.append(text.toLowerCase(Locale.ROOT)).append('\n');
            }
            records.add(score(topic, matched.size(), union.toString()));
        }

        CoverageReport report = new CoverageReport(records);
        for (CoverageRecord blocking : report.blockingTopics()) {
            log.warn("Required topic '{}' has no coverage", blocking.topicId());
        }
        return report;
    }

    CoverageRecord score(Topic topic, int matchedChunkCount, String lowerCasedText) {
        List<String> missing = new ArrayList<>();
        for (String keyword : topic.keywords()) {
            if (!lowerCasedText.contains(keyword.toLowerCase(Locale.ROOT))) {
                missing.add(keyword);
            }
        }
        double keywordHitRatio;
        if (topic.keywords().isEmpty()) {
            keywordHitRatio = matchedChunkCount > 0 ? 1.0 : 0.0;
        } else {
            keywordHitRatio = (double) (topic.keywords().size() - missing.size()) / topic.keywords().size();
        }
        double normalizedCount = Math.min(1.0, (double) matchedChunkCount / settings.saturationCount());
        double coverageScore = clamp(settings.chunkWeight() * normalizedCount + settings.keywordWeight() * keywordHitRatio);

        CoverageStatus status;
        if (coverageScore >= settings.highThreshold()) {
            status = CoverageStatus.COVERED;
        } else if (coverageScore >= settings.lowThreshold()) {
            status = CoverageStatus.PARTIAL;
        } else {
            status = CoverageStatus.MISSING;
        }
        return new CoverageRecord(topic.id(), topic.name(), topic.required(), matchedChunkCount, keywordHitRatio,
                coverageScore, topic.weight(), coverageScore * topic.weight(), status, List.copyOf(missing));
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
