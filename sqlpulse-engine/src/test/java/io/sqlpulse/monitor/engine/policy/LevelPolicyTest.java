package io.sqlpulse.monitor.engine.policy;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.check.InspectionLevel;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LevelPolicyTest {

    private final LevelPolicy policy = new LevelPolicy();

    @Test
    void shouldRunConnectionAndResourceChecksAtBasicLevel() {
        // When
        ResolvedChecks resolved = policy.resolve(InspectionLevel.BASIC, Optional.empty(), false);

        // Then
        assertThat(resolved.getChecks()).containsExactlyInAnyOrder(CheckType.SYSTEM_RESOURCES, CheckType.CONNECTIONS);
        assertThat(resolved.getSkipped()).isEmpty();
    }

    @Test
    void shouldNeverSelectFewerChecksAtHigherLevel() {
        // When
        Set<CheckType> basic = policy.resolve(InspectionLevel.BASIC, Optional.empty(), true).getChecks();
        Set<CheckType> advanced = policy.resolve(InspectionLevel.ADVANCED, Optional.empty(), true).getChecks();
        Set<CheckType> expert = policy.resolve(InspectionLevel.EXPERT, Optional.empty(), true).getChecks();

        // Then
        assertThat(advanced).containsAll(basic);
        assertThat(expert).containsAll(advanced);
    }

    @Test
    void shouldSkipTableStatisticsBelowExpertEvenWhenEnabled() {
        // When
        ResolvedChecks resolved = policy.resolve(InspectionLevel.ADVANCED, Optional.empty(), true);

        // Then
        assertThat(resolved.contains(CheckType.TABLE_STATISTICS)).isFalse();
        assertThat(resolved.getSkipped()).containsEntry(CheckType.TABLE_STATISTICS, LevelPolicy.REQUIRES_EXPERT);
    }

    @Test
    void shouldSkipTableStatisticsAtExpertWithoutFlag() {
        // When
        ResolvedChecks resolved = policy.resolve(InspectionLevel.EXPERT, Optional.empty(), false);

        // Then
        assertThat(resolved.contains(CheckType.TABLE_STATISTICS)).isFalse();
        assertThat(resolved.contains(CheckType.PERFORMANCE_SCHEMA)).isTrue();
        assertThat(resolved.getSkipped()).containsEntry(CheckType.TABLE_STATISTICS, LevelPolicy.REQUIRES_FLAG);
    }

    @Test
    void shouldRunTableStatisticsAtExpertWithFlag() {
        // When
        ResolvedChecks resolved = policy.resolve(InspectionLevel.EXPERT, Optional.empty(), true);

        // Then
        assertThat(resolved.getChecks()).isEqualTo(EnumSet.allOf(CheckType.class));
        assertThat(resolved.getSkipped()).isEmpty();
    }

    @Test
    void shouldReplaceDefaultsWithEnabledChecks() {
        // When
        ResolvedChecks resolved = policy.resolve(InspectionLevel.EXPERT,
                Optional.of(EnumSet.of(CheckType.INNODB)), true);

        // Then
        assertThat(resolved.getChecks()).containsExactly(CheckType.INNODB);
        assertThat(resolved.getSkipped()).containsEntry(CheckType.TABLE_STATISTICS, LevelPolicy.NOT_IN_OVERRIDE);
    }
}
