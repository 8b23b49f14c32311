package io.sqlpulse.monitor.engine;

import io.sqlpulse.monitor.common.analysis.Threshold;
import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.check.InspectionLevel;
import io.sqlpulse.monitor.engine.report.ReportFormat;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitorConfigTest {

    @Test
    void shouldUseDefaultsWhenNoArgsProvided() {
        // When
        MonitorConfig config = MonitorConfig.fromArgs(MonitorConfig.builder(), null);

        // Then
        assertThat(config.getHost()).isEqualTo("localhost");
        assertThat(config.getPort()).isEqualTo(3306);
        assertThat(config.getUser()).isEqualTo("root");
        assertThat(config.getLevel()).isEqualTo(InspectionLevel.ADVANCED);
        assertThat(config.getEnabledChecks()).isEmpty();
        assertThat(config.isTablesEnabled()).isFalse();
        assertThat(config.getRetryAttempts()).isEqualTo(3);
        assertThat(config.isReasoningEnabled()).isFalse();
        assertThat(config.getOutputFormats()).containsExactly(ReportFormat.TEXT, ReportFormat.JSON, ReportFormat.CSV);
        assertThat(config.getJdbcUrl()).isEqualTo("jdbc:mysql://localhost:3306/");
    }

    @Test
    void shouldParseArguments() {
        // Given
        Map<String, String> args = new HashMap<>();
        args.put("host", "db.internal");
        args.put("port", "3307");
        args.put("level", "3");
        args.put("enable-tables", "true");
        args.put("enabled-checks", "resources,queries,replication");
        args.put("formats", "json,csv");
        args.put("threshold.cpu_usage", "65");

        // When
        MonitorConfig config = MonitorConfig.fromArgs(MonitorConfig.builder(), args);

        // Then
        assertThat(config.getHost()).isEqualTo("db.internal");
        assertThat(config.getPort()).isEqualTo(3307);
        assertThat(config.getLevel()).isEqualTo(InspectionLevel.EXPERT);
        assertThat(config.isTablesEnabled()).isTrue();
        assertThat(config.getEnabledChecks()).hasValueSatisfying(checks -> assertThat(checks)
                .containsExactlyInAnyOrder(CheckType.SYSTEM_RESOURCES, CheckType.QUERY_CACHE, CheckType.SLOW_QUERIES));
        assertThat(config.getOutputFormats()).containsExactly(ReportFormat.JSON, ReportFormat.CSV);
        assertThat(config.getThresholds()).filteredOn(t -> t.getName().equals("cpu_usage"))
                .extracting(Threshold::getLimit).containsExactly(65.0);
    }

    @Test
    void shouldKeepDefaultForInvalidNumber() {
        // When
        MonitorConfig config = MonitorConfig.fromArgs(MonitorConfig.builder(), Map.of("port", "not-a-port", "retry-attempts", "0"));

        // Then
        assertThat(config.getPort()).isEqualTo(3306);
        assertThat(config.getRetryAttempts()).isEqualTo(3);
    }

    @Test
    void shouldRejectUnknownLevel() {
        assertThatThrownBy(() -> MonitorConfig.fromArgs(MonitorConfig.builder(), Map.of("level", "paranoid")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldMaskSecretsInToString() {
        // Given
        MonitorConfig config = MonitorConfig.builder()
                .password("s3cret-pass")
                .reasoningApiKey("sk-ant-12345")
                .build();

        // When
        String text = config.toString();

        // Then
        assertThat(text).doesNotContain("s3cret-pass").doesNotContain("sk-ant-12345");
        assertThat(config.isReasoningEnabled()).isTrue();
    }
}
