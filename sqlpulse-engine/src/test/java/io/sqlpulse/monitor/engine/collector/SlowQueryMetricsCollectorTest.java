package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.metrics.MetricNames;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static io.sqlpulse.monitor.engine.collector.StatusRowFixtures.row;
import static io.sqlpulse.monitor.engine.collector.StatusRowFixtures.variables;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SlowQueryMetricsCollectorTest {

    private final Session session = mock(Session.class);
    private final SlowQueryMetricsCollector collector = new SlowQueryMetricsCollector(Clock.systemUTC());

    @Test
    void shouldKeepFractionsAndLongDurationsOfRecentSlowQueries() throws QueryException {
        // Given
        when(session.execute(SlowQueryMetricsCollector.VARIABLES_QUERY)).thenReturn(variables(
                "slow_query_log", "ON",
                "long_query_time", "2.000000",
                "log_output", "TABLE"));
        when(session.execute(SlowQueryMetricsCollector.STATUS_QUERY)).thenReturn(variables(
                "Slow_queries", "12",
                "Uptime", "3600"));
        when(session.execute(SlowQueryMetricsCollector.RECENT_QUERY)).thenReturn(List.of(
                row("start_time", "2024-05-01 10:00:00", "query_time", "00:00:03.250000", "sql_text", "SELECT 1"),
                row("start_time", "2024-05-01 09:00:00", "query_time", "26:30:00.500000", "sql_text", "SELECT 2")));

        // When
        List<MetricSample> samples = collector.collect(session);

        // Then
        assertThat(samples).filteredOn(s -> s.getName().equals(MetricNames.SLOW_QUERIES_RECENT_COUNT))
                .singleElement()
                .satisfies(s -> assertThat(s.getValue().asNumber()).hasValue(2.0));
        assertThat(samples).filteredOn(s -> s.getName().equals(MetricNames.SLOW_QUERIES_RECENT_MAX_QUERY_TIME))
                .singleElement()
                .satisfies(s -> assertThat(s.getValue().asDuration())
                        .isEqualTo(Duration.ofHours(26).plusMinutes(30).plusMillis(500)));
        assertThat(SlowQueryMetricsCollector.RECENT_QUERY).contains("CAST(query_time AS CHAR)");
    }

    @Test
    void shouldSkipRecentEntriesWhenLogIsWrittenToFile() throws QueryException {
        // Given
        when(session.execute(SlowQueryMetricsCollector.VARIABLES_QUERY)).thenReturn(variables(
                "slow_query_log", "ON",
                "long_query_time", "1",
                "log_output", "FILE"));
        when(session.execute(SlowQueryMetricsCollector.STATUS_QUERY)).thenReturn(variables(
                "Slow_queries", "0",
                "Uptime", "60"));

        // When
        List<MetricSample> samples = collector.collect(session);

        // Then
        assertThat(samples).extracting(MetricSample::getName)
                .contains(MetricNames.SLOW_QUERIES_LOG_ENABLED, MetricNames.SLOW_QUERIES_TOTAL)
                .doesNotContain(MetricNames.SLOW_QUERIES_RECENT_COUNT);
        verify(session, never()).execute(SlowQueryMetricsCollector.RECENT_QUERY);
    }

    @Test
    void shouldParseTimeTextWithFractionsAndHoursPastOneDay() {
        assertThat(StatusRows.parseTime("00:00:01.250000")).isEqualTo(Duration.ofMillis(1250));
        assertThat(StatusRows.parseTime("838:59:59")).isEqualTo(Duration.ofHours(838).plusMinutes(59).plusSeconds(59));
        assertThat(StatusRows.parseTime("0.5")).isEqualTo(Duration.ofMillis(500));
        assertThat(StatusRows.parseTime(null)).isEqualTo(Duration.ZERO);
    }
}
