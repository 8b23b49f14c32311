package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.engine.MonitorConfig;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class CollectorRegistryTest {

    private final CollectorRegistry registry =
            CollectorRegistry.createDefault(MonitorConfig.defaults(), mock(HostProbe.class), Clock.systemUTC());

    @Test
    void shouldProvideOneCollectorPerCheck() {
        for (CheckType type : CheckType.values()) {
            assertThat(registry.get(type)).isPresent();
            assertThat(registry.get(type).get().checkType()).isEqualTo(type);
            assertThat(registry.get(type).get().name()).isEqualTo(type.getKey());
        }
    }

    @Test
    void shouldReturnCollectorsInCheckOrder() {
        // When
        List<MetricsCollector> collectors = registry.forChecks(
                EnumSet.of(CheckType.SLOW_QUERIES, CheckType.SYSTEM_RESOURCES, CheckType.INNODB));

        // Then
        assertThat(collectors).extracting(MetricsCollector::checkType)
                .containsExactly(CheckType.SYSTEM_RESOURCES, CheckType.INNODB, CheckType.SLOW_QUERIES);
    }
}
