package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.metrics.CollectorFailure;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the selected collectors one after another on the run's session. A failing collector is
 * recorded and the remaining collectors still run.
 */
public class CollectorSet {
    private static final Logger logger = LoggerFactory.getLogger(CollectorSet.class);
    private static final Logger eventLogger = LoggerFactory.getLogger("io.sqlpulse.monitor.events");

    private final List<MetricsCollector> collectors;
    private final Clock clock;

    public CollectorSet(List<MetricsCollector> collectors, Clock clock) {
        this.collectors = new ArrayList<>(collectors);
        this.clock = clock;
        logger.debug("Created CollectorSet with {} collectors", collectors.size());
    }

    public CollectionResult collectAll(Session session) {
        List<MetricSample> samples = new ArrayList<>();
        List<CollectorFailure> failures = new ArrayList<>();
        Instant startedAt = clock.instant();

        for (MetricsCollector collector : collectors) {
            long start = System.nanoTime();
            try {
                List<MetricSample> collected = collector.collect(session);
                samples.addAll(collected);
                eventLogger.info("COLLECTOR_OK|collector={}|samples={}|elapsed_ms={}",
                        collector.name(), collected.size(), (System.nanoTime() - start) / 1_000_000L);
            } catch (QueryException e) {
                logger.warn("Collector {} failed on statement [{}]: {}", collector.name(), e.getStatement(), e.getMessage());
                failures.add(fail(collector, e));
            } catch (RuntimeException e) {
                logger.error("Collector {} failed unexpectedly", collector.name(), e);
                failures.add(fail(collector, e));
            }
        }

        return new CollectionResult(samples, failures, startedAt, clock.instant());
    }

    private CollectorFailure fail(MetricsCollector collector, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        eventLogger.info("COLLECTOR_FAILED|collector={}|error={}", collector.name(), message);
        return new CollectorFailure(collector.name(), message, clock.instant());
    }
}
