package io.sqlpulse.monitor.engine.recommendation;

import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.metrics.MetricNames;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.metrics.MetricValue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Static advice table keyed by metric name. Command templates are filled in with the run's own
 * samples; when an input is missing the rule gives advice only.
 */
public final class LocalRecommendationRules {

    static final String SUBSYSTEM_HOST = "host";
    static final String SUBSYSTEM_CONNECTIONS = "connections";
    static final String SUBSYSTEM_BUFFER_POOL = "innodb.buffer_pool";
    static final String SUBSYSTEM_QUERY_CACHE = "query_cache";
    static final String SUBSYSTEM_SLOW_QUERIES = "slow_queries";
    static final String SUBSYSTEM_PERFORMANCE_SCHEMA = "performance_schema";
    static final String SUBSYSTEM_TABLES = "tables";
    static final String SUBSYSTEM_INDEXES = "indexes";

    @FunctionalInterface
    interface AdviceTemplate {
        String render(Finding finding, Map<String, MetricSample> samples);
    }

    @FunctionalInterface
    interface CommandTemplate {
        Optional<String> render(Map<String, MetricSample> samples);
    }

    static final class Rule {
        final String subsystem;
        final AdviceTemplate advice;
        final CommandTemplate command;

        Rule(String subsystem, AdviceTemplate advice, CommandTemplate command) {
            this.subsystem = subsystem;
            this.advice = advice;
            this.command = command;
        }
    }

    private static final CommandTemplate NO_COMMAND = samples -> Optional.empty();

    private final Map<String, Rule> rules = new HashMap<>();

    public LocalRecommendationRules() {
        rule(MetricNames.HOST_CPU_USAGE_PERCENT, SUBSYSTEM_HOST,
                (f, s) -> "Host CPU usage is " + percent(f.getValue()) + " (limit " + percent(f.getLimit())
                        + "). Identify the most expensive statements and consider more CPU capacity.",
                NO_COMMAND);
        rule(MetricNames.HOST_MEMORY_USAGE_PERCENT, SUBSYSTEM_HOST,
                (f, s) -> "Host memory usage is " + percent(f.getValue()) + " (limit " + percent(f.getLimit())
                        + "). Check that the buffer pool and per-connection buffers fit in physical memory.",
                NO_COMMAND);
        rule(MetricNames.HOST_SWAP_USAGE_PERCENT, SUBSYSTEM_HOST,
                (f, s) -> "Swap usage is " + percent(f.getValue())
                        + ". A swapping database server degrades badly; reduce memory pressure.",
                NO_COMMAND);
        rule(MetricNames.HOST_DISK_USAGE_PERCENT, SUBSYSTEM_HOST,
                (f, s) -> "Disk usage is " + percent(f.getValue()) + " (limit " + percent(f.getLimit())
                        + "). Purge old binary logs, archive unused data or grow the volume.",
                NO_COMMAND);

        rule(MetricNames.CONNECTIONS_USAGE_PERCENT, SUBSYSTEM_CONNECTIONS,
                (f, s) -> "Connection usage is " + percent(f.getValue()) + " of max_connections (limit "
                        + percent(f.getLimit()) + "). Raise max_connections or introduce connection pooling.",
                samples -> number(samples, MetricNames.CONNECTIONS_MAX)
                        .filter(max -> max > 0)
                        .map(max -> "SET GLOBAL max_connections = " + (long) Math.ceil(max * 1.5)));
        rule(MetricNames.CONNECTIONS_ABORTED_CONNECTS, SUBSYSTEM_CONNECTIONS,
                (f, s) -> MetricValue.formatNumber(f.getValue())
                        + " connection attempts were aborted. Check client credentials, network stability and connect_timeout.",
                NO_COMMAND);

        rule(MetricNames.INNODB_BUFFER_POOL_HIT_RATIO, SUBSYSTEM_BUFFER_POOL,
                (f, s) -> "InnoDB buffer pool hit ratio is " + percent(f.getValue() * 100.0) + " (limit "
                        + percent(f.getLimit() * 100.0) + "). Too many reads go to disk; grow innodb_buffer_pool_size.",
                samples -> number(samples, MetricNames.INNODB_BUFFER_POOL_SIZE_BYTES)
                        .filter(size -> size > 0)
                        .map(size -> "SET GLOBAL innodb_buffer_pool_size = " + (long) (size * 2)));

        rule(MetricNames.QUERY_CACHE_HIT_RATIO, SUBSYSTEM_QUERY_CACHE,
                (f, s) -> "Query cache hit ratio is " + percent(f.getValue() * 100.0)
                        + ". The cache may cost more than it saves; review the workload or disable it.",
                NO_COMMAND);
        rule(MetricNames.QUERY_CACHE_MEMORY_USAGE_PERCENT, SUBSYSTEM_QUERY_CACHE,
                (f, s) -> "Query cache memory usage is " + percent(f.getValue()) + ". Consider a larger query_cache_size.",
                LocalRecommendationRules::growQueryCache);
        rule(MetricNames.QUERY_CACHE_FRAGMENTATION_PERCENT, SUBSYSTEM_QUERY_CACHE,
                (f, s) -> "Query cache fragmentation is " + percent(f.getValue()) + ". Defragment the cache.",
                samples -> Optional.of("FLUSH QUERY CACHE"));
        rule(MetricNames.QUERY_CACHE_LOWMEM_PRUNE_RATIO, SUBSYSTEM_QUERY_CACHE,
                (f, s) -> "Queries are pruned from the cache for lack of memory (prune ratio "
                        + MetricValue.formatNumber(f.getValue()) + "). Consider a larger query_cache_size.",
                LocalRecommendationRules::growQueryCache);

        rule(MetricNames.SLOW_QUERIES_PER_MINUTE, SUBSYSTEM_SLOW_QUERIES,
                (f, s) -> MetricValue.formatNumber(f.getValue()) + " slow queries per minute (limit "
                        + MetricValue.formatNumber(f.getLimit()) + "). Review the slow query log and add missing indexes.",
                LocalRecommendationRules::enableSlowLog);
        rule(MetricNames.SLOW_QUERIES_RECENT_COUNT, SUBSYSTEM_SLOW_QUERIES,
                (f, s) -> MetricValue.formatNumber(f.getValue())
                        + " recent entries in the slow query log. Analyse them with EXPLAIN.",
                NO_COMMAND);

        rule(MetricNames.PERFORMANCE_SCHEMA_HIGH_LATENCY_COUNT, SUBSYSTEM_PERFORMANCE_SCHEMA,
                (f, s) -> MetricValue.formatNumber(f.getValue())
                        + " statement digests average more than one second." + topQuery(s),
                NO_COMMAND);

        rule(MetricNames.TABLES_WITHOUT_INDEX_COUNT, SUBSYSTEM_TABLES,
                (f, s) -> "Tables without any index: " + list(s, MetricNames.TABLES_WITHOUT_INDEX_LIST)
                        + ". Add a primary key or suitable indexes.",
                NO_COMMAND);
        rule(MetricNames.TABLES_LARGE_COUNT, SUBSYSTEM_TABLES,
                (f, s) -> "Tables over 1 GiB: " + list(s, MetricNames.TABLES_LARGE_LIST)
                        + ". Consider partitioning or archiving old rows.",
                NO_COMMAND);
        rule(MetricNames.TABLES_FRAGMENTED_COUNT, SUBSYSTEM_TABLES,
                (f, s) -> "Fragmented tables: " + list(s, MetricNames.TABLES_FRAGMENTED_LIST)
                        + ". Rebuild them to reclaim free space.",
                LocalRecommendationRules::optimizeTables);

        rule(MetricNames.INDEXES_REDUNDANT_COUNT, SUBSYSTEM_INDEXES,
                (f, s) -> "Redundant indexes: " + list(s, MetricNames.INDEXES_REDUNDANT_LIST)
                        + ". Each is a left prefix of another index on the same table and can likely be dropped.",
                NO_COMMAND);
    }

    private void rule(String metric, String subsystem, AdviceTemplate advice, CommandTemplate command) {
        rules.put(metric, new Rule(subsystem, advice, command));
    }

    Optional<Rule> ruleFor(String metricName) {
        return Optional.ofNullable(rules.get(metricName));
    }

    /**
     * Subsystem a metric belongs to. Metrics without a rule use their first name segment.
     */
    public String subsystemFor(String metricName) {
        Rule rule = rules.get(metricName);
        if (rule != null) {
            return rule.subsystem;
        }
        if (metricName.startsWith("innodb.buffer_pool.")) {
            return SUBSYSTEM_BUFFER_POOL;
        }
        int dot = metricName.indexOf('.');
        return dot > 0 ? metricName.substring(0, dot) : metricName;
    }

    /**
     * Advice for a finding no rule covers
     */
    static String genericAdvice(Finding finding) {
        return finding.getDescription() + ". Review this metric against the workload.";
    }

    private static Optional<String> growQueryCache(Map<String, MetricSample> samples) {
        return number(samples, MetricNames.QUERY_CACHE_SIZE_BYTES)
                .filter(size -> size > 0)
                .map(size -> "SET GLOBAL query_cache_size = " + (long) (size * 2));
    }

    private static Optional<String> enableSlowLog(Map<String, MetricSample> samples) {
        MetricSample enabled = samples.get(MetricNames.SLOW_QUERIES_LOG_ENABLED);
        if (enabled != null && "OFF".equalsIgnoreCase(enabled.getValue().asText())) {
            return Optional.of("SET GLOBAL slow_query_log = 'ON'");
        }
        return Optional.empty();
    }

    private static Optional<String> optimizeTables(Map<String, MetricSample> samples) {
        MetricSample list = samples.get(MetricNames.TABLES_FRAGMENTED_LIST);
        if (list == null || list.getValue().asText().isBlank()) {
            return Optional.empty();
        }
        String tables = Arrays.stream(list.getValue().asText().split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .map(LocalRecommendationRules::quoteTable)
                .collect(Collectors.joining(", "));
        return Optional.of("OPTIMIZE TABLE " + tables);
    }

    private static String quoteTable(String qualifiedName) {
        int dot = qualifiedName.indexOf('.');
        if (dot < 0) {
            return quote(qualifiedName);
        }
        return quote(qualifiedName.substring(0, dot)) + "." + quote(qualifiedName.substring(dot + 1));
    }

    private static String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    private static String topQuery(Map<String, MetricSample> samples) {
        MetricSample top = samples.get(MetricNames.PERFORMANCE_SCHEMA_TOP_QUERY_PREFIX + "1.text");
        if (top == null) {
            return " Review events_statements_summary_by_digest.";
        }
        return " The most expensive statement is: " + top.getValue().asText();
    }

    private static String list(Map<String, MetricSample> samples, String name) {
        MetricSample list = samples.get(name);
        if (list == null || list.getValue().asText().isBlank()) {
            return "(not listed)";
        }
        return list.getValue().asText().replace(",", ", ");
    }

    private static Optional<Double> number(Map<String, MetricSample> samples, String name) {
        MetricSample sample = samples.get(name);
        if (sample == null) {
            return Optional.empty();
        }
        OptionalDouble value = sample.getValue().asNumber();
        return value.isPresent() ? Optional.of(value.getAsDouble()) : Optional.empty();
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }
}
