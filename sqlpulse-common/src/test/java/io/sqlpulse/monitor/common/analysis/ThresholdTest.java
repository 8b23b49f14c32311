package io.sqlpulse.monitor.common.analysis;

import io.sqlpulse.monitor.common.metrics.MetricNames;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThresholdTest {

    @Test
    void operatorsShouldCompareStrictlyAndInclusively() {
        assertThat(ThresholdOperator.GREATER_THAN.test(80, 80)).isFalse();
        assertThat(ThresholdOperator.GREATER_OR_EQUAL.test(80, 80)).isTrue();
        assertThat(ThresholdOperator.LESS_THAN.test(0.9, 0.95)).isTrue();
        assertThat(ThresholdOperator.LESS_OR_EQUAL.test(1, 0.95)).isFalse();
    }

    @Test
    void operatorsShouldParseSymbolsAndNames() {
        assertThat(ThresholdOperator.fromSymbol(">")).isEqualTo(ThresholdOperator.GREATER_THAN);
        assertThat(ThresholdOperator.fromSymbol("lte")).isEqualTo(ThresholdOperator.LESS_OR_EQUAL);
        assertThatThrownBy(() -> ThresholdOperator.fromSymbol("=="))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withLimitShouldKeepEverythingElse() {
        Threshold cpu = DefaultThresholds.byName("cpu_usage").orElseThrow();

        Threshold relaxed = cpu.withLimit(95);

        assertThat(relaxed.getLimit()).isEqualTo(95.0);
        assertThat(relaxed.getMetricName()).isEqualTo(MetricNames.HOST_CPU_USAGE_PERCENT);
        assertThat(relaxed.getSeverity()).isEqualTo(cpu.getSeverity());
        assertThat(relaxed.toString()).isEqualTo("cpu_usage{host.cpu.usage_percent > 95 -> WARNING}");
    }

    @Test
    void shouldRejectNonFiniteLimit() {
        assertThatThrownBy(() -> new Threshold("x", "y", ThresholdOperator.GREATER_THAN, Double.NaN, Severity.INFO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void severityShouldAcceptShortWarning() {
        assertThat(Severity.parse("warn")).isEqualTo(Severity.WARNING);
        assertThat(Severity.parse(" critical ")).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void defaultThresholdNamesShouldBeUnique() {
        assertThat(DefaultThresholds.all()).extracting(Threshold::getName).doesNotHaveDuplicates();
        assertThat(DefaultThresholds.byName("nope")).isEmpty();
    }
}
