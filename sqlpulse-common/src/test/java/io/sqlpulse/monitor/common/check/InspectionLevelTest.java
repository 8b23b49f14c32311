package io.sqlpulse.monitor.common.check;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InspectionLevelTest {

    @Test
    void defaultChecksShouldGrowWithLevel() {
        assertThat(InspectionLevel.ADVANCED.getDefaultChecks())
                .containsAll(InspectionLevel.BASIC.getDefaultChecks());
        assertThat(InspectionLevel.EXPERT.getDefaultChecks())
                .containsAll(InspectionLevel.ADVANCED.getDefaultChecks());
        assertThat(InspectionLevel.ADVANCED.getDefaultChecks()).doesNotContain(CheckType.TABLE_STATISTICS);
    }

    @Test
    void shouldParseNumbersAndNames() {
        assertThat(InspectionLevel.parse("1")).isEqualTo(InspectionLevel.BASIC);
        assertThat(InspectionLevel.parse("expert")).isEqualTo(InspectionLevel.EXPERT);
        assertThat(InspectionLevel.parse(" Advanced ")).isEqualTo(InspectionLevel.ADVANCED);
    }

    @Test
    void shouldRejectUnknownLevel() {
        assertThatThrownBy(() -> InspectionLevel.parse("4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown inspection level");
        assertThatThrownBy(() -> InspectionLevel.parse(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCompareLevels() {
        assertThat(InspectionLevel.EXPERT.isAtLeast(InspectionLevel.ADVANCED)).isTrue();
        assertThat(InspectionLevel.BASIC.isAtLeast(InspectionLevel.ADVANCED)).isFalse();
        assertThat(InspectionLevel.EXPERT.displayName()).isEqualTo("Expert");
    }
}
