package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.JdbcSession;
import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static io.sqlpulse.monitor.engine.collector.StatusRowFixtures.variables;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryCacheMetricsCollectorTest {

    private final Session session = mock(Session.class);
    private final QueryCacheMetricsCollector collector = new QueryCacheMetricsCollector(Clock.systemUTC());

    @Test
    void shouldReportUnavailableWhenServerHasNoQueryCache() throws QueryException {
        // Given
        when(session.execute(QueryCacheMetricsCollector.VARIABLES_QUERY)).thenReturn(List.of());

        // When
        List<MetricSample> samples = collector.collect(session);

        // Then
        assertThat(samples).hasSize(1);
        assertThat(samples.get(0).getName()).isEqualTo("query_cache.type");
        assertThat(samples.get(0).getValue().asText()).isEqualTo("UNAVAILABLE");
        verify(session, never()).execute(QueryCacheMetricsCollector.STATUS_QUERY);
    }

    @Test
    void shouldCollectCountersWhenCacheIsPresent() throws QueryException {
        // Given
        when(session.execute(QueryCacheMetricsCollector.VARIABLES_QUERY)).thenReturn(variables(
                "query_cache_type", "ON",
                "query_cache_size", "1048576",
                "query_cache_limit", "1024"));
        when(session.execute(QueryCacheMetricsCollector.STATUS_QUERY)).thenReturn(variables(
                "Qcache_hits", "30",
                "Qcache_inserts", "70",
                "Qcache_lowmem_prunes", "5",
                "Qcache_free_memory", "1000"));

        // When
        List<MetricSample> samples = collector.collect(session);

        // Then
        assertThat(samples).extracting(MetricSample::getName)
                .contains("query_cache.type", "query_cache.size_bytes", "query_cache.hits",
                        "query_cache.inserts", "query_cache.lowmem_prunes", "query_cache.free_memory_bytes");
        assertThat(samples).filteredOn(s -> s.getName().equals("query_cache.hits"))
                .singleElement()
                .satisfies(s -> assertThat(s.getValue().asNumber()).hasValue(30.0));
    }

    @Test
    void shouldIssueOnlyReadOnlyStatements() {
        assertThat(JdbcSession.isReadOnlyStatement(QueryCacheMetricsCollector.VARIABLES_QUERY)).isTrue();
        assertThat(JdbcSession.isReadOnlyStatement(QueryCacheMetricsCollector.STATUS_QUERY)).isTrue();
    }
}
