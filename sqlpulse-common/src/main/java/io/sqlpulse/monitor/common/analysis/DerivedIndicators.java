package io.sqlpulse.monitor.common.analysis;

import io.sqlpulse.monitor.common.metrics.MetricNames;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.metrics.MetricValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Ratios and percentages computed from raw counters. A zero denominator yields 0, never an error.
 */
public final class DerivedIndicators {

    private DerivedIndicators() {
    }

    public static double ratio(double numerator, double denominator) {
        if (denominator <= 0.0) {
            return 0.0;
        }
        return numerator / denominator;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * hits / (hits + misses), in [0, 1]
     */
    public static double hitRatio(double hits, double misses) {
        return clamp(ratio(hits, hits + misses), 0.0, 1.0);
    }

    /**
     * current / max * 100, in [0, 100]
     */
    public static double usagePercent(double current, double max) {
        return clamp(ratio(current, max) * 100.0, 0.0, 100.0);
    }

    /**
     * 1 - diskReads / logicalReads, in [0, 1]. The read ratio counts as 0 when no logical reads happened.
     */
    public static double bufferPoolEfficiency(double diskReads, double logicalReads) {
        return clamp(1.0 - ratio(diskReads, logicalReads), 0.0, 1.0);
    }

    /**
     * Derives indicator samples from the raw samples of a run. An indicator is only produced when
     * all of its inputs are present.
     */
    public static List<MetricSample> derive(Map<String, MetricSample> samples) {
        List<MetricSample> derived = new ArrayList<>();

        addIfPresent(derived, samples, MetricNames.CONNECTIONS_USAGE_PERCENT,
                MetricNames.CONNECTIONS_CURRENT, MetricNames.CONNECTIONS_MAX,
                (current, max) -> usagePercent(current, max));
        addIfPresent(derived, samples, MetricNames.CONNECTIONS_MAX_USED_PERCENT,
                MetricNames.CONNECTIONS_MAX_USED, MetricNames.CONNECTIONS_MAX,
                (maxUsed, max) -> usagePercent(maxUsed, max));

        addIfPresent(derived, samples, MetricNames.INNODB_BUFFER_POOL_HIT_RATIO,
                MetricNames.INNODB_BUFFER_POOL_READS, MetricNames.INNODB_BUFFER_POOL_READ_REQUESTS,
                DerivedIndicators::bufferPoolEfficiency);
        addIfPresent(derived, samples, MetricNames.INNODB_BUFFER_POOL_USAGE_PERCENT,
                MetricNames.INNODB_BUFFER_POOL_PAGES_TOTAL, MetricNames.INNODB_BUFFER_POOL_PAGES_FREE,
                (total, free) -> usagePercent(total - free, total));

        if (isQueryCacheEnabled(samples)) {
            addIfPresent(derived, samples, MetricNames.QUERY_CACHE_HIT_RATIO,
                    MetricNames.QUERY_CACHE_HITS, MetricNames.QUERY_CACHE_INSERTS,
                    DerivedIndicators::hitRatio);
            addIfPresent(derived, samples, MetricNames.QUERY_CACHE_FRAGMENTATION_PERCENT,
                    MetricNames.QUERY_CACHE_FREE_BLOCKS, MetricNames.QUERY_CACHE_TOTAL_BLOCKS,
                    (free, total) -> usagePercent(free, total));
            addIfPresent(derived, samples, MetricNames.QUERY_CACHE_MEMORY_USAGE_PERCENT,
                    MetricNames.QUERY_CACHE_SIZE_BYTES, MetricNames.QUERY_CACHE_FREE_MEMORY_BYTES,
                    (size, free) -> usagePercent(size - free, size));
            addIfPresent(derived, samples, MetricNames.QUERY_CACHE_LOWMEM_PRUNE_RATIO,
                    MetricNames.QUERY_CACHE_LOWMEM_PRUNES, MetricNames.QUERY_CACHE_INSERTS,
                    (prunes, inserts) -> Math.max(0.0, ratio(prunes, inserts)));
        }

        addIfPresent(derived, samples, MetricNames.SLOW_QUERIES_PER_MINUTE,
                MetricNames.SLOW_QUERIES_TOTAL, MetricNames.SLOW_QUERIES_UPTIME,
                (total, uptimeMs) -> Math.max(0.0, ratio(total, uptimeMs / 60_000.0)));

        return derived;
    }

    private static boolean isQueryCacheEnabled(Map<String, MetricSample> samples) {
        MetricSample type = samples.get(MetricNames.QUERY_CACHE_TYPE);
        if (type == null) {
            return false;
        }
        String mode = type.getValue().asText().trim().toUpperCase(Locale.ROOT);
        if ("OFF".equals(mode) || "0".equals(mode) || "UNAVAILABLE".equals(mode)) {
            return false;
        }
        MetricSample size = samples.get(MetricNames.QUERY_CACHE_SIZE_BYTES);
        return size != null && size.getValue().asNumber().orElse(0.0) > 0.0;
    }

    @FunctionalInterface
    private interface BinaryIndicator {
        double apply(double first, double second);
    }

    private static void addIfPresent(List<MetricSample> out, Map<String, MetricSample> samples,
                                     String derivedName, String firstName, String secondName,
                                     BinaryIndicator indicator) {
        if (samples.containsKey(derivedName)) {
            return;
        }
        MetricSample first = samples.get(firstName);
        MetricSample second = samples.get(secondName);
        if (first == null || second == null) {
            return;
        }
        OptionalDouble a = first.getValue().asNumber();
        OptionalDouble b = second.getValue().asNumber();
        if (a.isEmpty() || b.isEmpty()) {
            return;
        }
        Instant timestamp = first.getTimestamp().isAfter(second.getTimestamp())
                ? first.getTimestamp() : second.getTimestamp();
        out.add(MetricSample.builder()
                .collector(first.getCollector())
                .name(derivedName)
                .value(MetricValue.number(indicator.apply(a.getAsDouble(), b.getAsDouble())))
                .timestamp(timestamp)
                .build());
    }
}
