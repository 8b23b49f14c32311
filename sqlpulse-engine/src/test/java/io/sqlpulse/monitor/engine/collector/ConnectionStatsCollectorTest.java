package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.sqlpulse.monitor.engine.collector.StatusRowFixtures.row;
import static io.sqlpulse.monitor.engine.collector.StatusRowFixtures.variables;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConnectionStatsCollectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private Session session;
    private ConnectionStatsCollector collector;

    @BeforeEach
    void setUp() throws QueryException {
        session = mock(Session.class);
        collector = new ConnectionStatsCollector(Clock.fixed(NOW, ZoneOffset.UTC));

        when(session.execute(ConnectionStatsCollector.VERSION_QUERY))
                .thenReturn(List.of(row("version", "8.0.36")));
        when(session.execute(ConnectionStatsCollector.STATUS_QUERY)).thenReturn(variables(
                "Uptime", "7200",
                "Threads_connected", "95",
                "Threads_running", "4",
                "Max_used_connections", "98",
                "Aborted_connects", "3",
                "Aborted_clients", "1"));
        when(session.execute(ConnectionStatsCollector.MAX_CONNECTIONS_QUERY))
                .thenReturn(variables("max_connections", "100"));
        when(session.execute(ConnectionStatsCollector.PROCESSLIST_QUERY)).thenReturn(List.of(
                row("Id", 1, "Command", "Sleep"),
                row("Id", 2, "Command", "Query"),
                row("Id", 3, "Command", "Sleep")));
    }

    @Test
    void shouldCollectConnectionMetrics() throws QueryException {
        // When
        Map<String, MetricSample> samples = byName(collector.collect(session));

        // Then
        assertThat(samples.get("server.version").getValue().asText()).isEqualTo("8.0.36");
        assertThat(samples.get("server.uptime").getValue().asDuration()).isEqualTo(Duration.ofHours(2));
        assertThat(samples.get("connections.current").getValue().asNumber()).hasValue(95.0);
        assertThat(samples.get("connections.max").getValue().asNumber()).hasValue(100.0);
        assertThat(samples.get("connections.max_used").getValue().asNumber()).hasValue(98.0);
        assertThat(samples.get("connections.sleeping").getValue().asNumber()).hasValue(2.0);
    }

    @Test
    void shouldAttributeSamplesToCollectorWithCaptureTime() throws QueryException {
        // When
        List<MetricSample> samples = collector.collect(session);

        // Then
        assertThat(samples).isNotEmpty();
        assertThat(samples).allSatisfy(sample -> {
            assertThat(sample.getCollector()).isEqualTo("connections");
            assertThat(sample.getTimestamp()).isEqualTo(NOW);
        });
    }

    @Test
    void shouldPropagateQueryFailure() throws QueryException {
        // Given
        when(session.execute(ConnectionStatsCollector.PROCESSLIST_QUERY))
                .thenThrow(new QueryException("Access denied; you need the PROCESS privilege",
                        ConnectionStatsCollector.PROCESSLIST_QUERY));

        // When & Then
        assertThatThrownBy(() -> collector.collect(session))
                .isInstanceOf(QueryException.class)
                .hasMessageContaining("PROCESS privilege");
    }

    private static Map<String, MetricSample> byName(List<MetricSample> samples) {
        return samples.stream().collect(Collectors.toMap(MetricSample::getName, Function.identity()));
    }
}
