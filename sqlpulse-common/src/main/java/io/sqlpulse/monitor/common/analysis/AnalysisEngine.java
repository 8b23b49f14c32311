package io.sqlpulse.monitor.common.analysis;

import io.sqlpulse.monitor.common.metrics.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Evaluates thresholds against the samples of a run. Stateless: identical samples and thresholds
 * always produce identical findings in identical order.
 */
public class AnalysisEngine {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisEngine.class);

    public AnalysisResult analyze(List<MetricSample> samples, List<Threshold> thresholds) {
        Map<String, MetricSample> byName = new LinkedHashMap<>();
        for (MetricSample sample : samples) {
            byName.putIfAbsent(sample.getName(), sample);
        }

        List<MetricSample> derived = DerivedIndicators.derive(byName);
        for (MetricSample sample : derived) {
            byName.putIfAbsent(sample.getName(), sample);
        }

        Map<String, Finding> findingsByKey = new LinkedHashMap<>();
        List<String> evaluated = new ArrayList<>();

        for (Threshold threshold : thresholds) {
            MetricSample sample = byName.get(threshold.getMetricName());
            if (sample == null) {
                logger.debug("Metric {} not collected, skipping threshold {}",
                        threshold.getMetricName(), threshold.getName());
                continue;
            }

            OptionalDouble value = sample.getValue().asNumber();
            if (value.isEmpty()) {
                logger.warn("Metric {} is not numeric ({}), skipping threshold {}",
                        threshold.getMetricName(), sample.getValue().getKind(), threshold.getName());
                continue;
            }

            evaluated.add(threshold.getName());
            if (threshold.isViolatedBy(value.getAsDouble())) {
                Finding finding = new Finding(threshold, sample.getCollector(), value.getAsDouble());
                findingsByKey.putIfAbsent(finding.getKey(), finding);
            }
        }

        List<Finding> findings = new ArrayList<>(findingsByKey.values());
        findings.sort(Finding.REPORT_ORDER);

        logger.debug("Analysis produced {} derived samples and {} findings from {} thresholds",
                derived.size(), findings.size(), evaluated.size());
        return new AnalysisResult(derived, findings, evaluated);
    }
}
