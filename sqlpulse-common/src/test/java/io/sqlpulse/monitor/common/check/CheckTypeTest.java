package io.sqlpulse.monitor.common.check;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CheckTypeTest {

    @Test
    void shouldResolveKeysAndAliases() {
        // When
        Set<CheckType> checks = CheckType.fromNames(List.of("resources", "queries", "performance", "tables", "connections"));

        // Then
        assertThat(checks).containsExactly(
                CheckType.SYSTEM_RESOURCES,
                CheckType.CONNECTIONS,
                CheckType.QUERY_CACHE,
                CheckType.SLOW_QUERIES,
                CheckType.PERFORMANCE_SCHEMA,
                CheckType.TABLE_STATISTICS);
    }

    @Test
    void shouldIgnoreUnknownAndBlankNames() {
        Set<CheckType> checks = CheckType.fromNames(Arrays.asList("InnoDB", " ", null, "replication", "query-cache"));

        assertThat(checks).containsExactly(CheckType.INNODB, CheckType.QUERY_CACHE);
    }
}
