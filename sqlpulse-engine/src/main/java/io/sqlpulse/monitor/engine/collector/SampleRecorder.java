package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.metrics.MetricValue;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Accumulates the samples of one collector, stamping each with the clock at the time it is recorded
 */
class SampleRecorder {
    private final String collector;
    private final Clock clock;
    private final List<MetricSample> samples = new ArrayList<>();

    SampleRecorder(String collector, Clock clock) {
        this.collector = collector;
        this.clock = clock;
    }

    SampleRecorder number(String name, double value) {
        return add(name, MetricValue.number(value));
    }

    SampleRecorder text(String name, String value) {
        return add(name, MetricValue.text(value));
    }

    SampleRecorder duration(String name, Duration value) {
        return add(name, MetricValue.duration(value));
    }

    /**
     * Records the numeric variable if present and parseable, otherwise records nothing
     */
    SampleRecorder numberFrom(Map<String, String> variables, String variable, String name) {
        OptionalDouble value = StatusRows.number(variables, variable);
        if (value.isPresent()) {
            number(name, value.getAsDouble());
        }
        return this;
    }

    SampleRecorder secondsFrom(Map<String, String> variables, String variable, String name) {
        OptionalDouble value = StatusRows.number(variables, variable);
        if (value.isPresent()) {
            duration(name, Duration.ofMillis(Math.round(value.getAsDouble() * 1000.0)));
        }
        return this;
    }

    SampleRecorder millisFrom(Map<String, String> variables, String variable, String name) {
        OptionalDouble value = StatusRows.number(variables, variable);
        if (value.isPresent()) {
            duration(name, Duration.ofMillis(Math.round(value.getAsDouble())));
        }
        return this;
    }

    private SampleRecorder add(String name, MetricValue value) {
        samples.add(MetricSample.builder()
                .collector(collector)
                .name(name)
                .value(value)
                .timestamp(clock.instant())
                .build());
        return this;
    }

    List<MetricSample> samples() {
        return List.copyOf(samples);
    }
}
