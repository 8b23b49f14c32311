package io.sqlpulse.monitor.common.report;

import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.check.InspectionLevel;
import io.sqlpulse.monitor.common.metrics.CollectorFailure;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.recommendation.Recommendation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one monitoring run. Assembled once by {@link ReportBuilder}; only the approval state of
 * its recommendations can change afterwards.
 */
public final class Report {
    private final Instant timestamp;
    private final ConnectionIdentity connection;
    private final InspectionLevel level;
    private final List<CheckType> resolvedChecks;
    private final Map<CheckType, String> skippedChecks;
    private final Map<String, List<MetricSample>> samplesByCollector;
    private final List<CollectorFailure> failures;
    private final List<Finding> findings;
    private final List<Recommendation> recommendations;
    private final RecommendationMode recommendationMode;
    private final String fallbackReason;
    private final Instant captureStart;
    private final Instant captureEnd;

    Report(ReportBuilder builder) {
        this.timestamp = builder.timestamp;
        this.connection = builder.connection;
        this.level = builder.level;
        this.resolvedChecks = List.copyOf(builder.resolvedChecks);
        this.skippedChecks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.skippedChecks));
        Map<String, List<MetricSample>> grouped = new LinkedHashMap<>();
        builder.samplesByCollector.forEach((collector, samples) -> grouped.put(collector, List.copyOf(samples)));
        this.samplesByCollector = Collections.unmodifiableMap(grouped);
        this.failures = List.copyOf(builder.failures);
        this.findings = List.copyOf(builder.findings);
        this.recommendations = List.copyOf(builder.recommendations);
        this.recommendationMode = builder.recommendationMode;
        this.fallbackReason = builder.fallbackReason;
        this.captureStart = builder.captureStart;
        this.captureEnd = builder.captureEnd;
    }

    public Instant getTimestamp() { return timestamp; }
    public ConnectionIdentity getConnection() { return connection; }
    public InspectionLevel getLevel() { return level; }
    public List<CheckType> getResolvedChecks() { return resolvedChecks; }
    public Map<CheckType, String> getSkippedChecks() { return skippedChecks; }
    public Map<String, List<MetricSample>> getSamplesByCollector() { return samplesByCollector; }
    public List<CollectorFailure> getFailures() { return failures; }
    public List<Finding> getFindings() { return findings; }
    public List<Recommendation> getRecommendations() { return recommendations; }
    public RecommendationMode getRecommendationMode() { return recommendationMode; }
    public Optional<String> getFallbackReason() { return Optional.ofNullable(fallbackReason); }
    public Instant getCaptureStart() { return captureStart; }
    public Instant getCaptureEnd() { return captureEnd; }

    /**
     * A degraded report is complete but at least one collector failed.
     */
    public boolean isDegraded() {
        return !failures.isEmpty();
    }

    public List<MetricSample> getAllSamples() {
        List<MetricSample> all = new ArrayList<>();
        samplesByCollector.values().forEach(all::addAll);
        return all;
    }

    public Optional<MetricSample> findSample(String name) {
        return samplesByCollector.values().stream()
                .flatMap(List::stream)
                .filter(sample -> sample.getName().equals(name))
                .findFirst();
    }

    public Optional<Recommendation> findRecommendation(String id) {
        return recommendations.stream().filter(r -> r.getId().equals(id)).findFirst();
    }

    @Override
    public String toString() {
        return "Report{" +
                "timestamp=" + timestamp +
                ", connection=" + connection +
                ", level=" + level +
                ", collectors=" + samplesByCollector.keySet() +
                ", failures=" + failures.size() +
                ", findings=" + findings.size() +
                ", recommendations=" + recommendations.size() +
                ", mode=" + recommendationMode +
                '}';
    }
}
