package io.sqlpulse.monitor.common.analysis;

import io.sqlpulse.monitor.common.metrics.MetricSample;

import java.util.Collections;
import java.util.List;

/**
 * Output of one analysis pass: the derived indicator samples, the findings in report order
 * and the names of the thresholds whose metric was present and therefore evaluated.
 */
public final class AnalysisResult {
    private final List<MetricSample> derivedSamples;
    private final List<Finding> findings;
    private final List<String> evaluatedThresholds;

    public AnalysisResult(List<MetricSample> derivedSamples, List<Finding> findings, List<String> evaluatedThresholds) {
        this.derivedSamples = List.copyOf(derivedSamples);
        this.findings = List.copyOf(findings);
        this.evaluatedThresholds = List.copyOf(evaluatedThresholds);
    }

    public static AnalysisResult empty() {
        return new AnalysisResult(Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    }

    public List<MetricSample> getDerivedSamples() { return derivedSamples; }
    public List<Finding> getFindings() { return findings; }
    public List<String> getEvaluatedThresholds() { return evaluatedThresholds; }
}
