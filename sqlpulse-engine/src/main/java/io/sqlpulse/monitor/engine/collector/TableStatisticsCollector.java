package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.MetricNames;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-table sizes and index layout from information_schema. Scans at most {@code tableLimit}
 * tables, largest first.
 */
public class TableStatisticsCollector implements MetricsCollector {
    private static final Logger logger = LoggerFactory.getLogger(TableStatisticsCollector.class);

    static final long LARGE_TABLE_BYTES = 1024L * 1024L * 1024L;
    static final double FRAGMENTATION_RATIO = 0.20;

    private static final String SYSTEM_SCHEMAS = "('information_schema', 'mysql', 'performance_schema', 'sys')";

    static final String TABLES_QUERY =
            "SELECT table_schema, table_name, engine, table_rows, data_length, index_length, data_free "
                    + "FROM information_schema.tables "
                    + "WHERE table_schema NOT IN " + SYSTEM_SCHEMAS + " AND table_type = 'BASE TABLE' "
                    + "ORDER BY data_length + index_length DESC LIMIT ";
    static final String INDEXES_QUERY =
            "SELECT table_schema, table_name, index_name, seq_in_index, column_name, cardinality "
                    + "FROM information_schema.statistics "
                    + "WHERE table_schema NOT IN " + SYSTEM_SCHEMAS + " "
                    + "ORDER BY table_schema, table_name, index_name, seq_in_index";

    private final int tableLimit;
    private final Clock clock;

    public TableStatisticsCollector(int tableLimit, Clock clock) {
        this.tableLimit = Math.max(1, tableLimit);
        this.clock = clock;
    }

    @Override
    public String name() {
        return CheckType.TABLE_STATISTICS.getKey();
    }

    @Override
    public CheckType checkType() {
        return CheckType.TABLE_STATISTICS;
    }

    @Override
    public List<MetricSample> collect(Session session) throws QueryException {
        SampleRecorder recorder = new SampleRecorder(name(), clock);

        List<Map<String, Object>> tables = session.execute(TABLES_QUERY + tableLimit);
        Map<String, List<IndexDefinition>> indexesByTable = readIndexes(session.execute(INDEXES_QUERY));

        List<String> withoutIndex = new ArrayList<>();
        List<String> large = new ArrayList<>();
        List<String> fragmented = new ArrayList<>();
        Set<String> scanned = new HashSet<>();

        for (Map<String, Object> row : tables) {
            String table = StatusRows.text(row, "table_schema") + "." + StatusRows.text(row, "table_name");
            scanned.add(table);
            double rows = StatusRows.numberOrZero(row, "table_rows");
            double data = StatusRows.numberOrZero(row, "data_length");
            double index = StatusRows.numberOrZero(row, "index_length");
            double free = StatusRows.numberOrZero(row, "data_free");

            String prefix = MetricNames.TABLES_PREFIX + table + ".";
            recorder.number(prefix + "rows", rows)
                    .number(prefix + "data_bytes", data)
                    .number(prefix + "index_bytes", index)
                    .number(prefix + "free_bytes", free)
                    .text(prefix + "engine", StatusRows.text(row, "engine"));

            if (!indexesByTable.containsKey(table)) {
                withoutIndex.add(table);
            }
            if (data > LARGE_TABLE_BYTES) {
                large.add(table);
            }
            if (data > 0 && free > data * FRAGMENTATION_RATIO) {
                fragmented.add(table);
            }
        }

        recorder.number(MetricNames.TABLES_COUNT, tables.size())
                .number(MetricNames.TABLES_WITHOUT_INDEX_COUNT, withoutIndex.size())
                .text(MetricNames.TABLES_WITHOUT_INDEX_LIST, String.join(",", withoutIndex))
                .number(MetricNames.TABLES_LARGE_COUNT, large.size())
                .text(MetricNames.TABLES_LARGE_LIST, String.join(",", large))
                .number(MetricNames.TABLES_FRAGMENTED_COUNT, fragmented.size())
                .text(MetricNames.TABLES_FRAGMENTED_LIST, String.join(",", fragmented));

        int indexCount = 0;
        int zeroCardinality = 0;
        Set<String> redundant = new TreeSet<>();
        for (Map.Entry<String, List<IndexDefinition>> entry : indexesByTable.entrySet()) {
            if (!scanned.contains(entry.getKey())) {
                continue;
            }
            List<IndexDefinition> indexes = entry.getValue();
            indexCount += indexes.size();
            for (IndexDefinition index : indexes) {
                if (index.firstColumnCardinality != null && index.firstColumnCardinality == 0) {
                    zeroCardinality++;
                }
            }
            for (String name : findRedundant(indexes)) {
                redundant.add(entry.getKey() + "." + name);
            }
        }

        recorder.number(MetricNames.INDEXES_COUNT, indexCount)
                .number(MetricNames.INDEXES_ZERO_CARDINALITY_COUNT, zeroCardinality)
                .number(MetricNames.INDEXES_REDUNDANT_COUNT, redundant.size())
                .text(MetricNames.INDEXES_REDUNDANT_LIST, String.join(",", redundant));

        logger.debug("Scanned {} tables and {} indexes", tables.size(), indexCount);
        return recorder.samples();
    }

    private static Map<String, List<IndexDefinition>> readIndexes(List<Map<String, Object>> rows) {
        Map<String, Map<String, IndexDefinition>> byTable = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            String table = StatusRows.text(row, "table_schema") + "." + StatusRows.text(row, "table_name");
            String indexName = StatusRows.text(row, "index_name");
            IndexDefinition index = byTable
                    .computeIfAbsent(table, k -> new LinkedHashMap<>())
                    .computeIfAbsent(indexName, IndexDefinition::new);
            if (index.columns.isEmpty()) {
                Object cardinality = row.get("cardinality");
                index.firstColumnCardinality = cardinality == null
                        ? null : (long) StatusRows.parseNumber(cardinality).orElse(0.0);
            }
            index.columns.add(StatusRows.text(row, "column_name").toLowerCase(java.util.Locale.ROOT));
        }

        Map<String, List<IndexDefinition>> result = new LinkedHashMap<>();
        byTable.forEach((table, indexes) -> result.put(table, new ArrayList<>(indexes.values())));
        return result;
    }

    /**
     * An index is redundant when its column list is a left prefix of another index on the same table.
     * Of two identical indexes the one whose name sorts last is reported. PRIMARY is never reported.
     */
    static List<String> findRedundant(List<IndexDefinition> indexes) {
        List<String> redundant = new ArrayList<>();
        for (IndexDefinition candidate : indexes) {
            if ("PRIMARY".equalsIgnoreCase(candidate.name)) {
                continue;
            }
            for (IndexDefinition other : indexes) {
                if (other == candidate || !isLeftPrefix(candidate.columns, other.columns)) {
                    continue;
                }
                boolean identical = candidate.columns.size() == other.columns.size();
                if (!identical
                        || "PRIMARY".equalsIgnoreCase(other.name)
                        || candidate.name.compareTo(other.name) > 0) {
                    redundant.add(candidate.name);
                    break;
                }
            }
        }
        return redundant;
    }

    private static boolean isLeftPrefix(List<String> prefix, List<String> columns) {
        return prefix.size() <= columns.size() && columns.subList(0, prefix.size()).equals(prefix);
    }

    static final class IndexDefinition {
        final String name;
        final List<String> columns = new ArrayList<>();
        Long firstColumnCardinality;

        IndexDefinition(String name) {
            this.name = name;
        }
    }
}
