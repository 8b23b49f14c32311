package io.sqlpulse.monitor.common.metrics;

import java.time.Instant;
import java.util.Objects;

/**
 * One named metric value captured by a collector at a point in time
 */
public final class MetricSample {
    private final String name;
    private final MetricValue value;
    private final String collector;
    private final Instant timestamp;

    private MetricSample(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.value = Objects.requireNonNull(builder.value, "value");
        this.collector = Objects.requireNonNull(builder.collector, "collector");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MetricSample of(String collector, String name, MetricValue value, Instant timestamp) {
        return builder().collector(collector).name(name).value(value).timestamp(timestamp).build();
    }

    // Getters
    public String getName() { return name; }
    public MetricValue getValue() { return value; }
    public String getCollector() { return collector; }
    public Instant getTimestamp() { return timestamp; }

    public static class Builder {
        private String name;
        private MetricValue value;
        private String collector;
        private Instant timestamp = Instant.now();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder value(MetricValue value) {
            this.value = value;
            return this;
        }

        public Builder number(double number) {
            this.value = MetricValue.number(number);
            return this;
        }

        public Builder text(String text) {
            this.value = MetricValue.text(text);
            return this;
        }

        public Builder collector(String collector) {
            this.collector = collector;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public MetricSample build() {
            return new MetricSample(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricSample)) return false;
        MetricSample that = (MetricSample) o;
        return name.equals(that.name)
                && value.equals(that.value)
                && collector.equals(that.collector)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, collector, timestamp);
    }

    @Override
    public String toString() {
        return "MetricSample{" +
                "name='" + name + '\'' +
                ", value=" + value +
                ", collector='" + collector + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
