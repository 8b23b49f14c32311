package io.sqlpulse.monitor.common.analysis;

import io.sqlpulse.monitor.common.metrics.MetricValue;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * A threshold violation observed on one metric. Identified within a run by
 * metric name and severity.
 */
public final class Finding {

    /**
     * Most severe first, then metric name, then threshold name.
     */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::getSeverity, Comparator.reverseOrder())
            .thenComparing(Finding::getMetricName)
            .thenComparing(Finding::getThresholdName);

    private final String thresholdName;
    private final String metricName;
    private final String collector;
    private final Severity severity;
    private final ThresholdOperator operator;
    private final double value;
    private final double limit;
    private final String description;

    public Finding(Threshold threshold, String collector, double value) {
        this.thresholdName = threshold.getName();
        this.metricName = threshold.getMetricName();
        this.collector = Objects.requireNonNull(collector, "collector");
        this.severity = threshold.getSeverity();
        this.operator = threshold.getOperator();
        this.value = value;
        this.limit = threshold.getLimit();
        this.description = String.format(Locale.ROOT, "%s is %s (threshold %s: %s %s)",
                metricName,
                MetricValue.formatNumber(value),
                thresholdName,
                operator.getSymbol(),
                MetricValue.formatNumber(limit));
    }

    public static String key(String metricName, Severity severity) {
        return metricName + ":" + severity.name();
    }

    public String getKey() {
        return key(metricName, severity);
    }

    public String getThresholdName() { return thresholdName; }
    public String getMetricName() { return metricName; }
    public String getCollector() { return collector; }
    public Severity getSeverity() { return severity; }
    public ThresholdOperator getOperator() { return operator; }
    public double getValue() { return value; }
    public double getLimit() { return limit; }
    public String getDescription() { return description; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Finding)) return false;
        Finding that = (Finding) o;
        return Double.compare(value, that.value) == 0
                && Double.compare(limit, that.limit) == 0
                && thresholdName.equals(that.thresholdName)
                && metricName.equals(that.metricName)
                && collector.equals(that.collector)
                && severity == that.severity
                && operator == that.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(thresholdName, metricName, collector, severity, operator, value, limit);
    }

    @Override
    public String toString() {
        return "Finding{" + severity + " " + description + "}";
    }
}
