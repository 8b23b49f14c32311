package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.sqlpulse.monitor.engine.collector.StatusRowFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TableStatisticsCollectorTest {

    private static final long GIB = 1024L * 1024L * 1024L;

    @Test
    void shouldClassifyTables() throws QueryException {
        // Given
        Session session = mock(Session.class);
        when(session.execute(TableStatisticsCollector.TABLES_QUERY + 500)).thenReturn(List.of(
                table("shop", "orders", 2 * GIB, 0),
                table("shop", "audit_log", 1000, 500),
                table("shop", "customers", 1000, 10)));
        when(session.execute(TableStatisticsCollector.INDEXES_QUERY)).thenReturn(List.of(
                index("shop", "orders", "PRIMARY", 1, "id", 1000),
                index("shop", "customers", "PRIMARY", 1, "id", 50),
                index("shop", "customers", "idx_email", 1, "email", 0)));

        // When
        Map<String, MetricSample> samples = byName(
                new TableStatisticsCollector(500, Clock.systemUTC()).collect(session));

        // Then
        assertThat(number(samples, "tables.count")).isEqualTo(3.0);
        assertThat(number(samples, "tables.large_count")).isEqualTo(1.0);
        assertThat(samples.get("tables.large_list").getValue().asText()).isEqualTo("shop.orders");
        assertThat(number(samples, "tables.without_index_count")).isEqualTo(1.0);
        assertThat(samples.get("tables.without_index_list").getValue().asText()).isEqualTo("shop.audit_log");
        assertThat(number(samples, "tables.fragmented_count")).isEqualTo(1.0);
        assertThat(samples.get("tables.fragmented_list").getValue().asText()).isEqualTo("shop.audit_log");
        assertThat(number(samples, "indexes.count")).isEqualTo(3.0);
        assertThat(number(samples, "indexes.zero_cardinality_count")).isEqualTo(1.0);
        assertThat(samples.get("tables.shop.orders.engine").getValue().asText()).isEqualTo("InnoDB");
    }

    @Test
    void shouldReportLeftPrefixIndexAsRedundant() {
        // Given
        List<TableStatisticsCollector.IndexDefinition> indexes = new ArrayList<>();
        indexes.add(definition("PRIMARY", "id"));
        indexes.add(definition("idx_customer", "customer_id"));
        indexes.add(definition("idx_customer_date", "customer_id", "created_at"));
        indexes.add(definition("idx_date", "created_at"));

        // When
        List<String> redundant = TableStatisticsCollector.findRedundant(indexes);

        // Then
        assertThat(redundant).containsExactly("idx_customer");
    }

    @Test
    void shouldReportOnlyOneOfTwoIdenticalIndexes() {
        // Given
        List<TableStatisticsCollector.IndexDefinition> indexes = List.of(
                definition("idx_a", "email"),
                definition("idx_b", "email"));

        // When
        List<String> redundant = TableStatisticsCollector.findRedundant(indexes);

        // Then
        assertThat(redundant).containsExactly("idx_b");
    }

    @Test
    void shouldNeverReportPrimaryKey() {
        // Given
        List<TableStatisticsCollector.IndexDefinition> indexes = List.of(
                definition("PRIMARY", "id"),
                definition("idx_id_name", "id", "name"),
                definition("idx_id", "id"));

        // When
        List<String> redundant = TableStatisticsCollector.findRedundant(indexes);

        // Then
        assertThat(redundant).containsExactly("idx_id");
    }

    private static Map<String, Object> table(String schema, String name, long data, long free) {
        return row("table_schema", schema, "table_name", name, "engine", "InnoDB",
                "table_rows", 100L, "data_length", data, "index_length", 0L, "data_free", free);
    }

    private static Map<String, Object> index(String schema, String table, String index, int seq, String column,
                                             long cardinality) {
        return row("table_schema", schema, "table_name", table, "index_name", index,
                "seq_in_index", seq, "column_name", column, "cardinality", cardinality);
    }

    private static TableStatisticsCollector.IndexDefinition definition(String name, String... columns) {
        TableStatisticsCollector.IndexDefinition definition = new TableStatisticsCollector.IndexDefinition(name);
        definition.columns.addAll(List.of(columns));
        return definition;
    }

    private static double number(Map<String, MetricSample> samples, String name) {
        return samples.get(name).getValue().asNumber().getAsDouble();
    }

    private static Map<String, MetricSample> byName(List<MetricSample> samples) {
        return samples.stream().collect(Collectors.toMap(MetricSample::getName, Function.identity()));
    }
}
