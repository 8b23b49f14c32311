package io.sqlpulse.monitor.common.analysis;

import io.sqlpulse.monitor.common.metrics.MetricNames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static io.sqlpulse.monitor.common.analysis.ThresholdOperator.GREATER_THAN;
import static io.sqlpulse.monitor.common.analysis.ThresholdOperator.LESS_THAN;

/**
 * Built-in threshold table. Settings may override limits by rule name.
 */
public final class DefaultThresholds {

    private static final List<Threshold> DEFAULTS;

    static {
        List<Threshold> rules = new ArrayList<>();
        rules.add(new Threshold("cpu_usage", MetricNames.HOST_CPU_USAGE_PERCENT, GREATER_THAN, 80, Severity.WARNING));
        rules.add(new Threshold("memory_usage", MetricNames.HOST_MEMORY_USAGE_PERCENT, GREATER_THAN, 85, Severity.WARNING));
        rules.add(new Threshold("swap_usage", MetricNames.HOST_SWAP_USAGE_PERCENT, GREATER_THAN, 50, Severity.WARNING));
        rules.add(new Threshold("disk_usage", MetricNames.HOST_DISK_USAGE_PERCENT, GREATER_THAN, 90, Severity.CRITICAL));
        rules.add(new Threshold("connection_usage", MetricNames.CONNECTIONS_USAGE_PERCENT, GREATER_THAN, 80, Severity.WARNING));
        rules.add(new Threshold("aborted_connects", MetricNames.CONNECTIONS_ABORTED_CONNECTS, GREATER_THAN, 100, Severity.INFO));
        rules.add(new Threshold("buffer_pool_hit_ratio", MetricNames.INNODB_BUFFER_POOL_HIT_RATIO, LESS_THAN, 0.95, Severity.WARNING));
        rules.add(new Threshold("query_cache_hit_ratio", MetricNames.QUERY_CACHE_HIT_RATIO, LESS_THAN, 0.30, Severity.WARNING));
        rules.add(new Threshold("query_cache_memory_usage", MetricNames.QUERY_CACHE_MEMORY_USAGE_PERCENT, GREATER_THAN, 95, Severity.WARNING));
        rules.add(new Threshold("query_cache_fragmentation", MetricNames.QUERY_CACHE_FRAGMENTATION_PERCENT, GREATER_THAN, 20, Severity.INFO));
        rules.add(new Threshold("query_cache_lowmem_prunes", MetricNames.QUERY_CACHE_LOWMEM_PRUNE_RATIO, GREATER_THAN, 0.33, Severity.WARNING));
        rules.add(new Threshold("slow_queries", MetricNames.SLOW_QUERIES_PER_MINUTE, GREATER_THAN, 10, Severity.WARNING));
        rules.add(new Threshold("recent_slow_queries", MetricNames.SLOW_QUERIES_RECENT_COUNT, GREATER_THAN, 5, Severity.INFO));
        rules.add(new Threshold("high_latency_queries", MetricNames.PERFORMANCE_SCHEMA_HIGH_LATENCY_COUNT, GREATER_THAN, 0, Severity.WARNING));
        rules.add(new Threshold("tables_without_index", MetricNames.TABLES_WITHOUT_INDEX_COUNT, GREATER_THAN, 0, Severity.WARNING));
        rules.add(new Threshold("large_tables", MetricNames.TABLES_LARGE_COUNT, GREATER_THAN, 0, Severity.INFO));
        rules.add(new Threshold("fragmented_tables", MetricNames.TABLES_FRAGMENTED_COUNT, GREATER_THAN, 0, Severity.INFO));
        rules.add(new Threshold("redundant_indexes", MetricNames.INDEXES_REDUNDANT_COUNT, GREATER_THAN, 0, Severity.INFO));
        DEFAULTS = Collections.unmodifiableList(rules);
    }

    private DefaultThresholds() {
    }

    public static List<Threshold> all() {
        return DEFAULTS;
    }

    public static Optional<Threshold> byName(String name) {
        return DEFAULTS.stream().filter(t -> t.getName().equals(name)).findFirst();
    }
}
