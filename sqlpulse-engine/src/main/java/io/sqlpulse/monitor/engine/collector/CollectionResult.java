package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.metrics.CollectorFailure;
import io.sqlpulse.monitor.common.metrics.MetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Union of the samples of every collector that succeeded plus one failure per collector that did not
 */
public final class CollectionResult {
    private final List<MetricSample> samples;
    private final List<CollectorFailure> failures;
    private final Instant startedAt;
    private final Instant finishedAt;

    public CollectionResult(List<MetricSample> samples, List<CollectorFailure> failures,
                            Instant startedAt, Instant finishedAt) {
        this.samples = List.copyOf(samples);
        this.failures = List.copyOf(failures);
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public List<MetricSample> getSamples() { return samples; }
    public List<CollectorFailure> getFailures() { return failures; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
