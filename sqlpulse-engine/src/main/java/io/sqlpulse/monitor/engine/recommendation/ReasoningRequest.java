package io.sqlpulse.monitor.engine.recommendation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.check.InspectionLevel;
import io.sqlpulse.monitor.common.metrics.MetricSample;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bounded payload sent to the reasoning service: the level, every finding and as many samples as fit.
 * Samples of the findings' own subsystems go first.
 */
public final class ReasoningRequest {
    private final String json;
    private final int findingCount;
    private final int sampleCount;
    private final boolean truncated;

    private ReasoningRequest(String json, int findingCount, int sampleCount, boolean truncated) {
        this.json = json;
        this.findingCount = findingCount;
        this.sampleCount = sampleCount;
        this.truncated = truncated;
    }

    public static ReasoningRequest bounded(InspectionLevel level, List<Finding> findings, List<MetricSample> samples,
                                           int maxBytes, ObjectMapper mapper) throws RecommendationServiceException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("level", level.name());
        List<Map<String, Object>> findingList = new ArrayList<>();
        for (Finding finding : findings) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("key", finding.getKey());
            item.put("metric", finding.getMetricName());
            item.put("severity", finding.getSeverity().name());
            item.put("value", finding.getValue());
            item.put("limit", finding.getLimit());
            item.put("description", finding.getDescription());
            findingList.add(item);
        }
        payload.put("findings", findingList);
        Map<String, String> sampleMap = new LinkedHashMap<>();
        payload.put("samples", sampleMap);

        int size = byteSize(serialize(payload, mapper));
        if (size > maxBytes) {
            throw new RecommendationServiceException("Findings alone need " + size
                    + " bytes, more than the request limit of " + maxBytes);
        }

        List<MetricSample> ordered = prioritize(findings, samples);
        boolean truncated = false;
        for (MetricSample sample : ordered) {
            if (sampleMap.containsKey(sample.getName())) {
                continue;
            }
            // "name":"value", plus separator
            int entrySize = byteSize(serialize(sample.getName(), mapper))
                    + byteSize(serialize(sample.getValue().display(), mapper)) + 2;
            if (size + entrySize > maxBytes) {
                truncated = true;
                break;
            }
            sampleMap.put(sample.getName(), sample.getValue().display());
            size += entrySize;
        }

        return new ReasoningRequest(serialize(payload, mapper), findings.size(), sampleMap.size(), truncated);
    }

    private static List<MetricSample> prioritize(List<Finding> findings, List<MetricSample> samples) {
        Set<String> roots = new HashSet<>();
        for (Finding finding : findings) {
            roots.add(root(finding.getMetricName()));
        }
        List<MetricSample> related = new ArrayList<>();
        List<MetricSample> others = new ArrayList<>();
        for (MetricSample sample : samples) {
            (roots.contains(root(sample.getName())) ? related : others).add(sample);
        }
        related.addAll(others);
        return related;
    }

    private static String root(String metricName) {
        int dot = metricName.indexOf('.');
        return dot > 0 ? metricName.substring(0, dot) : metricName;
    }

    private static String serialize(Object value, ObjectMapper mapper) throws RecommendationServiceException {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RecommendationServiceException("Cannot serialize reasoning request", e);
        }
    }

    private static int byteSize(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    public String toJson() { return json; }
    public int getFindingCount() { return findingCount; }
    public int getSampleCount() { return sampleCount; }
    public boolean isTruncated() { return truncated; }
    public int sizeInBytes() { return byteSize(json); }
}
