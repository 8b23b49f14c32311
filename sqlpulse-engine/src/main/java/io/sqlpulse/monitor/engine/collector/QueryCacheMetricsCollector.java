package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.MetricNames;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Query cache configuration and Qcache counters. Servers without a query cache (MySQL 8) report the
 * type as UNAVAILABLE and nothing else.
 */
public class QueryCacheMetricsCollector implements MetricsCollector {
    private static final Logger logger = LoggerFactory.getLogger(QueryCacheMetricsCollector.class);

    static final String UNAVAILABLE = "UNAVAILABLE";
    static final String VARIABLES_QUERY = "SHOW GLOBAL VARIABLES LIKE 'query_cache%'";
    static final String STATUS_QUERY = "SHOW GLOBAL STATUS LIKE 'Qcache%'";

    private final Clock clock;

    public QueryCacheMetricsCollector(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return CheckType.QUERY_CACHE.getKey();
    }

    @Override
    public CheckType checkType() {
        return CheckType.QUERY_CACHE;
    }

    @Override
    public List<MetricSample> collect(Session session) throws QueryException {
        SampleRecorder recorder = new SampleRecorder(name(), clock);

        Map<String, String> variables = StatusRows.variables(session, VARIABLES_QUERY);
        String type = variables.get("query_cache_type");
        if (type == null || type.isBlank()) {
            logger.info("Query cache is not available on this server");
            recorder.text(MetricNames.QUERY_CACHE_TYPE, UNAVAILABLE);
            return recorder.samples();
        }

        recorder.text(MetricNames.QUERY_CACHE_TYPE, type)
                .numberFrom(variables, "query_cache_size", MetricNames.QUERY_CACHE_SIZE_BYTES)
                .numberFrom(variables, "query_cache_limit", MetricNames.QUERY_CACHE_LIMIT_BYTES);

        Map<String, String> status = StatusRows.variables(session, STATUS_QUERY);
        recorder.numberFrom(status, "Qcache_hits", MetricNames.QUERY_CACHE_HITS)
                .numberFrom(status, "Qcache_inserts", MetricNames.QUERY_CACHE_INSERTS)
                .numberFrom(status, "Qcache_not_cached", MetricNames.QUERY_CACHE_NOT_CACHED)
                .numberFrom(status, "Qcache_lowmem_prunes", MetricNames.QUERY_CACHE_LOWMEM_PRUNES)
                .numberFrom(status, "Qcache_free_memory", MetricNames.QUERY_CACHE_FREE_MEMORY_BYTES)
                .numberFrom(status, "Qcache_total_blocks", MetricNames.QUERY_CACHE_TOTAL_BLOCKS)
                .numberFrom(status, "Qcache_free_blocks", MetricNames.QUERY_CACHE_FREE_BLOCKS)
                .numberFrom(status, "Qcache_queries_in_cache", MetricNames.QUERY_CACHE_QUERIES_IN_CACHE);

        return recorder.samples();
    }
}
