package io.sqlpulse.monitor.common.analysis;

import io.sqlpulse.monitor.common.metrics.MetricValue;

import java.util.Objects;

/**
 * A configured rule: metric name, comparator, limit and the severity of a violation
 */
public final class Threshold {
    private final String name;
    private final String metricName;
    private final ThresholdOperator operator;
    private final double limit;
    private final Severity severity;

    public Threshold(String name, String metricName, ThresholdOperator operator, double limit, Severity severity) {
        this.name = Objects.requireNonNull(name, "name");
        this.metricName = Objects.requireNonNull(metricName, "metricName");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.severity = Objects.requireNonNull(severity, "severity");
        if (Double.isNaN(limit) || Double.isInfinite(limit)) {
            throw new IllegalArgumentException("Threshold limit must be finite: " + limit);
        }
        this.limit = limit;
    }

    public String getName() { return name; }
    public String getMetricName() { return metricName; }
    public ThresholdOperator getOperator() { return operator; }
    public double getLimit() { return limit; }
    public Severity getSeverity() { return severity; }

    public Threshold withLimit(double newLimit) {
        return new Threshold(name, metricName, operator, newLimit, severity);
    }

    public boolean isViolatedBy(double value) {
        return operator.test(value, limit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Threshold)) return false;
        Threshold that = (Threshold) o;
        return Double.compare(limit, that.limit) == 0
                && name.equals(that.name)
                && metricName.equals(that.metricName)
                && operator == that.operator
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, metricName, operator, limit, severity);
    }

    @Override
    public String toString() {
        return name + "{" + metricName + " " + operator.getSymbol() + " "
                + MetricValue.formatNumber(limit) + " -> " + severity + "}";
    }
}
