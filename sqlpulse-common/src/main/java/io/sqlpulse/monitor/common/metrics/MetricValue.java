package io.sqlpulse.monitor.common.metrics;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Typed value of a single metric: a number, a piece of text or a duration
 */
public final class MetricValue {

    public enum Kind {
        NUMBER,
        TEXT,
        DURATION
    }

    private final Kind kind;
    private final double number;
    private final String text;
    private final Duration duration;

    private MetricValue(Kind kind, double number, String text, Duration duration) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.duration = duration;
    }

    public static MetricValue number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Metric value must be finite: " + value);
        }
        return new MetricValue(Kind.NUMBER, value, null, null);
    }

    public static MetricValue text(String value) {
        return new MetricValue(Kind.TEXT, 0.0, Objects.requireNonNull(value, "value"), null);
    }

    public static MetricValue duration(Duration value) {
        return new MetricValue(Kind.DURATION, 0.0, null, Objects.requireNonNull(value, "value"));
    }

    public Kind getKind() { return kind; }

    /**
     * Numeric view used by threshold evaluation. Durations compare in milliseconds,
     * text never compares.
     */
    public OptionalDouble asNumber() {
        switch (kind) {
            case NUMBER:
                return OptionalDouble.of(number);
            case DURATION:
                return OptionalDouble.of(duration.toNanos() / 1_000_000.0);
            default:
                return OptionalDouble.empty();
        }
    }

    public String asText() {
        return kind == Kind.TEXT ? text : display();
    }

    public Duration asDuration() {
        if (kind != Kind.DURATION) {
            throw new IllegalStateException("Not a duration value: " + kind);
        }
        return duration;
    }

    /**
     * Locale independent rendering, identical for identical values.
     */
    public String display() {
        switch (kind) {
            case NUMBER:
                return formatNumber(number);
            case DURATION:
                return formatNumber(duration.toNanos() / 1_000_000.0) + "ms";
            default:
                return text;
        }
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).setScale(4, java.math.RoundingMode.HALF_UP).stripTrailingZeros();
        return decimal.toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricValue)) return false;
        MetricValue that = (MetricValue) o;
        return kind == that.kind
                && Double.compare(number, that.number) == 0
                && Objects.equals(text, that.text)
                && Objects.equals(duration, that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text, duration);
    }

    @Override
    public String toString() {
        return display();
    }
}
