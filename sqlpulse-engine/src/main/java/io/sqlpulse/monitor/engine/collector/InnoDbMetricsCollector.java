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
 * Buffer pool reads and pages, data I/O and row lock waits
 */
public class InnoDbMetricsCollector implements MetricsCollector {

    static final String STATUS_QUERY = "SHOW GLOBAL STATUS LIKE 'Innodb_%'";
    static final String BUFFER_POOL_SIZE_QUERY = "SHOW GLOBAL VARIABLES LIKE 'innodb_buffer_pool_size'";

    private final Clock clock;

    public InnoDbMetricsCollector(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return CheckType.INNODB.getKey();
    }

    @Override
    public CheckType checkType() {
        return CheckType.INNODB;
    }

    @Override
    public List<MetricSample> collect(Session session) throws QueryException {
        SampleRecorder recorder = new SampleRecorder(name(), clock);

        Map<String, String> status = StatusRows.variables(session, STATUS_QUERY);
        recorder.numberFrom(status, "Innodb_buffer_pool_read_requests", MetricNames.INNODB_BUFFER_POOL_READ_REQUESTS)
                .numberFrom(status, "Innodb_buffer_pool_reads", MetricNames.INNODB_BUFFER_POOL_READS)
                .numberFrom(status, "Innodb_buffer_pool_pages_total", MetricNames.INNODB_BUFFER_POOL_PAGES_TOTAL)
                .numberFrom(status, "Innodb_buffer_pool_pages_free", MetricNames.INNODB_BUFFER_POOL_PAGES_FREE)
                .numberFrom(status, "Innodb_buffer_pool_pages_dirty", MetricNames.INNODB_BUFFER_POOL_PAGES_DIRTY)
                .numberFrom(status, "Innodb_data_reads", MetricNames.INNODB_DATA_READS)
                .numberFrom(status, "Innodb_data_writes", MetricNames.INNODB_DATA_WRITES)
                .numberFrom(status, "Innodb_row_lock_waits", MetricNames.INNODB_ROW_LOCK_WAITS)
                .millisFrom(status, "Innodb_row_lock_time_avg", MetricNames.INNODB_ROW_LOCK_TIME_AVG);

        Map<String, String> variables = StatusRows.variables(session, BUFFER_POOL_SIZE_QUERY);
        recorder.numberFrom(variables, "innodb_buffer_pool_size", MetricNames.INNODB_BUFFER_POOL_SIZE_BYTES);

        return recorder.samples();
    }
}
