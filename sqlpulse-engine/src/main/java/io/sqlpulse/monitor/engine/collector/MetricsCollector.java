package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;

import java.util.List;

/**
 * Gathers one family of metrics from the monitored server or its host
 */
public interface MetricsCollector {

    /**
     * Collector name, used to group samples and failures in the report
     */
    String name();

    CheckType checkType();

    /**
     * Collect the metrics of this family. Must only issue read-only statements.
     *
     * @param session the run's session
     * @return samples, each carrying its own capture timestamp
     * @throws QueryException if a statement fails
     */
    List<MetricSample> collect(Session session) throws QueryException;
}
