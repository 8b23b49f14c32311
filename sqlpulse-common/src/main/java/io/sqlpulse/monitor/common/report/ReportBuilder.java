package io.sqlpulse.monitor.common.report;

import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.check.InspectionLevel;
import io.sqlpulse.monitor.common.metrics.CollectorFailure;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.recommendation.Recommendation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Accumulates the immutable outputs of a run and assembles the {@link Report} exactly once.
 */
public class ReportBuilder {
    Instant timestamp;
    ConnectionIdentity connection;
    InspectionLevel level;
    final List<CheckType> resolvedChecks = new ArrayList<>();
    final Map<CheckType, String> skippedChecks = new EnumMap<>(CheckType.class);
    final Map<String, List<MetricSample>> samplesByCollector = new LinkedHashMap<>();
    final List<CollectorFailure> failures = new ArrayList<>();
    final List<Finding> findings = new ArrayList<>();
    final List<Recommendation> recommendations = new ArrayList<>();
    RecommendationMode recommendationMode = RecommendationMode.LOCAL;
    String fallbackReason;
    Instant captureStart;
    Instant captureEnd;

    private boolean built;

    public ReportBuilder timestamp(Instant timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public ReportBuilder connection(ConnectionIdentity connection) {
        this.connection = connection;
        return this;
    }

    public ReportBuilder level(InspectionLevel level) {
        this.level = level;
        return this;
    }

    public ReportBuilder resolvedChecks(Collection<CheckType> checks) {
        this.resolvedChecks.clear();
        this.resolvedChecks.addAll(checks);
        return this;
    }

    public ReportBuilder skippedChecks(Map<CheckType, String> skipped) {
        this.skippedChecks.clear();
        this.skippedChecks.putAll(skipped);
        return this;
    }

    /**
     * Samples are grouped by their collector, keeping first-seen collector order.
     */
    public ReportBuilder addSamples(Collection<MetricSample> samples) {
        for (MetricSample sample : samples) {
            samplesByCollector.computeIfAbsent(sample.getCollector(), k -> new ArrayList<>()).add(sample);
        }
        return this;
    }

    public ReportBuilder failures(Collection<CollectorFailure> failures) {
        this.failures.clear();
        this.failures.addAll(failures);
        return this;
    }

    public ReportBuilder findings(Collection<Finding> findings) {
        this.findings.clear();
        this.findings.addAll(findings);
        return this;
    }

    public ReportBuilder recommendations(Collection<Recommendation> recommendations, RecommendationMode mode, String fallbackReason) {
        this.recommendations.clear();
        this.recommendations.addAll(recommendations);
        this.recommendationMode = Objects.requireNonNull(mode, "mode");
        this.fallbackReason = fallbackReason;
        return this;
    }

    public ReportBuilder captureWindow(Instant start, Instant end) {
        this.captureStart = start;
        this.captureEnd = end;
        return this;
    }

    /**
     * @throws IllegalStateException when called twice or when a recommendation references an unknown finding
     */
    public Report build() {
        if (built) {
            throw new IllegalStateException("Report has already been assembled");
        }
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(level, "level");
        if (captureStart == null) {
            captureStart = timestamp;
        }
        if (captureEnd == null) {
            captureEnd = captureStart;
        }

        Set<String> findingKeys = new HashSet<>();
        findings.forEach(f -> findingKeys.add(f.getKey()));
        for (Recommendation recommendation : recommendations) {
            for (String key : recommendation.getFindingKeys()) {
                if (!findingKeys.contains(key)) {
                    throw new IllegalStateException("Recommendation " + recommendation.getId()
                            + " references unknown finding " + key);
                }
            }
        }

        built = true;
        return new Report(this);
    }
}
