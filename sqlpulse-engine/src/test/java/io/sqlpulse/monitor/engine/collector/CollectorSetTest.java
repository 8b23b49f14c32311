package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.metrics.MetricValue;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CollectorSetTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void shouldIsolateFailingCollector() throws QueryException {
        // Given
        Session session = mock(Session.class);
        MetricsCollector failing = collector("slow_queries", CheckType.SLOW_QUERIES);
        when(failing.collect(session)).thenThrow(new QueryException("Table 'mysql.slow_log' doesn't exist", "SELECT 1"));
        MetricsCollector healthy = collector("connections", CheckType.CONNECTIONS);
        when(healthy.collect(session)).thenReturn(List.of(
                MetricSample.of("connections", "connections.current", MetricValue.number(5), NOW)));

        // When
        CollectionResult result = new CollectorSet(List.of(failing, healthy), clock).collectAll(session);

        // Then
        assertThat(result.getSamples()).extracting(MetricSample::getName).containsExactly("connections.current");
        assertThat(result.hasFailures()).isTrue();
        assertThat(result.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getCollector()).isEqualTo("slow_queries");
            assertThat(failure.getErrorMessage()).contains("slow_log");
            assertThat(failure.getTimestamp()).isEqualTo(NOW);
        });
    }

    @Test
    void shouldRecordUnexpectedRuntimeFailures() throws QueryException {
        // Given
        Session session = mock(Session.class);
        MetricsCollector broken = collector("innodb", CheckType.INNODB);
        when(broken.collect(session)).thenThrow(new IllegalStateException());

        // When
        CollectionResult result = new CollectorSet(List.of(broken), clock).collectAll(session);

        // Then
        assertThat(result.getSamples()).isEmpty();
        assertThat(result.getFailures()).singleElement()
                .satisfies(failure -> assertThat(failure.getErrorMessage()).isEqualTo("IllegalStateException"));
    }

    @Test
    void shouldReportCaptureWindow() {
        // When
        CollectionResult result = new CollectorSet(List.of(), clock).collectAll(mock(Session.class));

        // Then
        assertThat(result.getStartedAt()).isEqualTo(NOW);
        assertThat(result.getFinishedAt()).isEqualTo(NOW);
        assertThat(result.hasFailures()).isFalse();
    }

    private static MetricsCollector collector(String name, CheckType type) {
        MetricsCollector collector = mock(MetricsCollector.class);
        when(collector.name()).thenReturn(name);
        when(collector.checkType()).thenReturn(type);
        return collector;
    }
}
