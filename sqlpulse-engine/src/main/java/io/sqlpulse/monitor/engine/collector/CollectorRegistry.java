package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.engine.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Known collectors keyed by check type
 */
public class CollectorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CollectorRegistry.class);

    private final Map<CheckType, MetricsCollector> collectors = new EnumMap<>(CheckType.class);

    public CollectorRegistry(Collection<? extends MetricsCollector> collectors) {
        for (MetricsCollector collector : collectors) {
            MetricsCollector previous = this.collectors.put(collector.checkType(), collector);
            if (previous != null) {
                logger.warn("Collector {} replaces {} for check {}",
                        collector.getClass().getSimpleName(), previous.getClass().getSimpleName(), collector.checkType());
            }
        }
    }

    /**
     * Registry with one collector per check type, configured from the monitor settings
     */
    public static CollectorRegistry createDefault(MonitorConfig config, HostProbe hostProbe, Clock clock) {
        List<MetricsCollector> collectors = new ArrayList<>();
        for (CheckType type : CheckType.values()) {
            collectors.add(create(type, config, hostProbe, clock));
        }
        return new CollectorRegistry(collectors);
    }

    static MetricsCollector create(CheckType type, MonitorConfig config, HostProbe hostProbe, Clock clock) {
        switch (type) {
            case SYSTEM_RESOURCES:
                return new SystemResourcesCollector(hostProbe, config.getDiskPath(), clock);
            case CONNECTIONS:
                return new ConnectionStatsCollector(clock);
            case INNODB:
                return new InnoDbMetricsCollector(clock);
            case QUERY_CACHE:
                return new QueryCacheMetricsCollector(clock);
            case SLOW_QUERIES:
                return new SlowQueryMetricsCollector(clock);
            case PERFORMANCE_SCHEMA:
                return new PerformanceSchemaCollector(clock);
            case TABLE_STATISTICS:
                return new TableStatisticsCollector(config.getTableLimit(), clock);
            default:
                throw new IllegalArgumentException("No collector for check " + type);
        }
    }

    public Optional<MetricsCollector> get(CheckType type) {
        return Optional.ofNullable(collectors.get(type));
    }

    /**
     * Collectors for the given checks in check order. Checks without a registered collector are skipped.
     */
    public List<MetricsCollector> forChecks(Set<CheckType> checks) {
        List<MetricsCollector> selected = new ArrayList<>();
        for (CheckType type : CheckType.values()) {
            if (!checks.contains(type)) {
                continue;
            }
            MetricsCollector collector = collectors.get(type);
            if (collector == null) {
                logger.warn("No collector registered for check {}, skipping", type.getKey());
            } else {
                selected.add(collector);
            }
        }
        return selected;
    }
}
