package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.MetricNames;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Slow query log settings and counters. When the log is written to a table the most recent entries
 * are inspected as well.
 */
public class SlowQueryMetricsCollector implements MetricsCollector {

    static final String VARIABLES_QUERY =
            "SHOW GLOBAL VARIABLES WHERE Variable_name IN ('slow_query_log', 'long_query_time', 'log_output')";
    static final String STATUS_QUERY =
            "SHOW GLOBAL STATUS WHERE Variable_name IN ('Slow_queries', 'Uptime')";
    static final String RECENT_QUERY =
            "SELECT start_time, CAST(query_time AS CHAR) AS query_time, sql_text "
                    + "FROM mysql.slow_log ORDER BY start_time DESC LIMIT 10";

    private final Clock clock;

    public SlowQueryMetricsCollector(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return CheckType.SLOW_QUERIES.getKey();
    }

    @Override
    public CheckType checkType() {
        return CheckType.SLOW_QUERIES;
    }

    @Override
    public List<MetricSample> collect(Session session) throws QueryException {
        SampleRecorder recorder = new SampleRecorder(name(), clock);

        Map<String, String> variables = StatusRows.variables(session, VARIABLES_QUERY);
        String logEnabled = variables.getOrDefault("slow_query_log", "OFF");
        recorder.text(MetricNames.SLOW_QUERIES_LOG_ENABLED, StatusRows.isOn(logEnabled) ? "ON" : "OFF")
                .secondsFrom(variables, "long_query_time", MetricNames.SLOW_QUERIES_LONG_QUERY_TIME);

        Map<String, String> status = StatusRows.variables(session, STATUS_QUERY);
        recorder.numberFrom(status, "Slow_queries", MetricNames.SLOW_QUERIES_TOTAL)
                .secondsFrom(status, "Uptime", MetricNames.SLOW_QUERIES_UPTIME);

        String logOutput = variables.getOrDefault("log_output", "").toUpperCase(Locale.ROOT);
        if (StatusRows.isOn(logEnabled) && logOutput.contains("TABLE")) {
            List<Map<String, Object>> recent = session.execute(RECENT_QUERY);
            Duration max = Duration.ZERO;
            for (Map<String, Object> row : recent) {
                Duration queryTime = StatusRows.parseTime(row.get("query_time"));
                if (queryTime.compareTo(max) > 0) {
                    max = queryTime;
                }
            }
            recorder.number(MetricNames.SLOW_QUERIES_RECENT_COUNT, recent.size())
                    .duration(MetricNames.SLOW_QUERIES_RECENT_MAX_QUERY_TIME, max);
        }

        return recorder.samples();
    }
}
