package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.MetricNames;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Statement digests and metadata locks from performance_schema. Only the enabled flag is reported
 * when performance_schema is off.
 */
public class PerformanceSchemaCollector implements MetricsCollector {

    static final int TOP_QUERIES = 5;
    static final int MAX_QUERY_TEXT = 200;

    static final String ENABLED_QUERY = "SHOW GLOBAL VARIABLES LIKE 'performance_schema'";
    static final String TOP_QUERIES_QUERY =
            "SELECT COALESCE(digest_text, 'Unknown') AS query_text, count_star AS executions, "
                    + "COALESCE(avg_timer_wait / 1000000000, 0) AS avg_latency_ms, "
                    + "COALESCE(sum_timer_wait / 1000000000, 0) AS total_latency_ms "
                    + "FROM performance_schema.events_statements_summary_by_digest "
                    + "ORDER BY sum_timer_wait DESC LIMIT " + TOP_QUERIES;
    // avg_timer_wait is in picoseconds; 10^12 ps is one second
    static final String LATENCY_QUERY =
            "SELECT COUNT(CASE WHEN avg_timer_wait > 1000000000000 THEN 1 END) AS high_latency_count, "
                    + "COALESCE(MAX(avg_timer_wait), 0) / 1000000000 AS max_avg_latency_ms "
                    + "FROM performance_schema.events_statements_summary_by_digest";
    static final String LOCKS_QUERY =
            "SELECT COUNT(*) AS held FROM performance_schema.metadata_locks WHERE owner_thread_id IS NOT NULL";

    private final Clock clock;

    public PerformanceSchemaCollector(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return CheckType.PERFORMANCE_SCHEMA.getKey();
    }

    @Override
    public CheckType checkType() {
        return CheckType.PERFORMANCE_SCHEMA;
    }

    @Override
    public List<MetricSample> collect(Session session) throws QueryException {
        SampleRecorder recorder = new SampleRecorder(name(), clock);

        Map<String, String> variables = StatusRows.variables(session, ENABLED_QUERY);
        boolean enabled = StatusRows.isOn(variables.get("performance_schema"));
        recorder.text(MetricNames.PERFORMANCE_SCHEMA_ENABLED, enabled ? "ON" : "OFF");
        if (!enabled) {
            return recorder.samples();
        }

        List<Map<String, Object>> top = session.execute(TOP_QUERIES_QUERY);
        for (int i = 0; i < top.size(); i++) {
            Map<String, Object> row = top.get(i);
            String prefix = MetricNames.PERFORMANCE_SCHEMA_TOP_QUERY_PREFIX + (i + 1) + ".";
            recorder.text(prefix + "text", abbreviate(StatusRows.text(row, "query_text")))
                    .number(prefix + "executions", StatusRows.numberOrZero(row, "executions"))
                    .duration(prefix + "avg_latency", millis(StatusRows.numberOrZero(row, "avg_latency_ms")))
                    .duration(prefix + "total_latency", millis(StatusRows.numberOrZero(row, "total_latency_ms")));
        }

        List<Map<String, Object>> latency = session.execute(LATENCY_QUERY);
        if (!latency.isEmpty()) {
            Map<String, Object> row = latency.get(0);
            recorder.number(MetricNames.PERFORMANCE_SCHEMA_HIGH_LATENCY_COUNT, StatusRows.numberOrZero(row, "high_latency_count"))
                    .duration(MetricNames.PERFORMANCE_SCHEMA_MAX_AVG_LATENCY, millis(StatusRows.numberOrZero(row, "max_avg_latency_ms")));
        }

        List<Map<String, Object>> locks = session.execute(LOCKS_QUERY);
        if (!locks.isEmpty()) {
            recorder.number(MetricNames.PERFORMANCE_SCHEMA_METADATA_LOCKS_HELD, StatusRows.numberOrZero(locks.get(0), "held"));
        }

        return recorder.samples();
    }

    private static Duration millis(double value) {
        return Duration.ofNanos(Math.round(value * 1_000_000.0));
    }

    private static String abbreviate(String text) {
        String singleLine = text.replaceAll("\\s+", " ").trim();
        return singleLine.length() <= MAX_QUERY_TEXT ? singleLine : singleLine.substring(0, MAX_QUERY_TEXT - 3) + "...";
    }
}
