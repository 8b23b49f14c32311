package io.sqlpulse.monitor.common.metrics;

import java.time.Instant;
import java.util.Objects;

/**
 * Records a collector that could not deliver its metrics during a run
 */
public final class CollectorFailure {
    private final String collector;
    private final String errorMessage;
    private final Instant timestamp;

    public CollectorFailure(String collector, String errorMessage, Instant timestamp) {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.errorMessage = errorMessage == null ? "unknown error" : errorMessage;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public String getCollector() { return collector; }
    public String getErrorMessage() { return errorMessage; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CollectorFailure)) return false;
        CollectorFailure that = (CollectorFailure) o;
        return collector.equals(that.collector)
                && errorMessage.equals(that.errorMessage)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collector, errorMessage, timestamp);
    }

    @Override
    public String toString() {
        return "CollectorFailure{" +
                "collector='" + collector + '\'' +
                ", errorMessage='" + errorMessage + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
