package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.MetricNames;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Server version and uptime, thread counts against max_connections, aborted connections and sleeping sessions
 */
public class ConnectionStatsCollector implements MetricsCollector {

    static final String VERSION_QUERY = "SELECT VERSION() AS version";
    static final String STATUS_QUERY = "SHOW GLOBAL STATUS";
    static final String MAX_CONNECTIONS_QUERY = "SHOW GLOBAL VARIABLES LIKE 'max_connections'";
    static final String PROCESSLIST_QUERY = "SHOW FULL PROCESSLIST";

    private final Clock clock;

    public ConnectionStatsCollector(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return CheckType.CONNECTIONS.getKey();
    }

    @Override
    public CheckType checkType() {
        return CheckType.CONNECTIONS;
    }

    @Override
    public List<MetricSample> collect(Session session) throws QueryException {
        SampleRecorder recorder = new SampleRecorder(name(), clock);

        List<Map<String, Object>> version = session.execute(VERSION_QUERY);
        if (!version.isEmpty()) {
            recorder.text(MetricNames.SERVER_VERSION, StatusRows.text(version.get(0), "version"));
        }

        Map<String, String> status = StatusRows.variables(session, STATUS_QUERY);
        recorder.secondsFrom(status, "Uptime", MetricNames.SERVER_UPTIME)
                .numberFrom(status, "Threads_connected", MetricNames.CONNECTIONS_CURRENT)
                .numberFrom(status, "Threads_running", MetricNames.CONNECTIONS_RUNNING)
                .numberFrom(status, "Max_used_connections", MetricNames.CONNECTIONS_MAX_USED)
                .numberFrom(status, "Aborted_connects", MetricNames.CONNECTIONS_ABORTED_CONNECTS)
                .numberFrom(status, "Aborted_clients", MetricNames.CONNECTIONS_ABORTED_CLIENTS);

        Map<String, String> variables = StatusRows.variables(session, MAX_CONNECTIONS_QUERY);
        recorder.numberFrom(variables, "max_connections", MetricNames.CONNECTIONS_MAX);

        List<Map<String, Object>> processes = session.execute(PROCESSLIST_QUERY);
        recorder.number(MetricNames.CONNECTIONS_SLEEPING, StatusRows.count(processes, "Command", "Sleep"));

        return recorder.samples();
    }
}
