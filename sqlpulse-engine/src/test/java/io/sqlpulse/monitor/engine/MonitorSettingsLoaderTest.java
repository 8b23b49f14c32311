package io.sqlpulse.monitor.engine;

import io.sqlpulse.monitor.common.analysis.Severity;
import io.sqlpulse.monitor.common.analysis.Threshold;
import io.sqlpulse.monitor.common.analysis.ThresholdOperator;
import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.check.InspectionLevel;
import io.sqlpulse.monitor.engine.report.ReportFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitorSettingsLoaderTest {

    private final MonitorSettingsLoader loader = new MonitorSettingsLoader();

    @Test
    void shouldLoadAllSections() {
        // Given
        String yaml = String.join("\n",
                "mysql:",
                "  host: db.internal",
                "  port: 3307",
                "  user: monitor",
                "  password: secret",
                "monitoring:",
                "  level: expert",
                "  enabled_checks: [resources, connections, tables]",
                "  enable_tables: true",
                "  thresholds:",
                "    cpu_usage: 70",
                "    long_transactions:",
                "      metric: innodb.row_lock.waits",
                "      operator: '>='",
                "      limit: 10",
                "      severity: critical",
                "anthropic:",
                "  api_key: sk-test",
                "  timeout_seconds: 5",
                "  temperature: 3.0",
                "export:",
                "  destination: /tmp/reports",
                "  formats: [txt, json]");

        // When
        MonitorConfig config = load(yaml).build();

        // Then
        assertThat(config.getHost()).isEqualTo("db.internal");
        assertThat(config.getPort()).isEqualTo(3307);
        assertThat(config.getUser()).isEqualTo("monitor");
        assertThat(config.getLevel()).isEqualTo(InspectionLevel.EXPERT);
        assertThat(config.isTablesEnabled()).isTrue();
        assertThat(config.getEnabledChecks()).hasValueSatisfying(checks -> assertThat(checks)
                .containsExactlyInAnyOrder(CheckType.SYSTEM_RESOURCES, CheckType.CONNECTIONS, CheckType.TABLE_STATISTICS));
        assertThat(config.getThresholds()).filteredOn(t -> t.getName().equals("cpu_usage"))
                .extracting(Threshold::getLimit).containsExactly(70.0);
        assertThat(config.getThresholds()).contains(new Threshold("long_transactions", "innodb.row_lock.waits",
                ThresholdOperator.fromSymbol(">="), 10, Severity.CRITICAL));
        assertThat(config.isReasoningEnabled()).isTrue();
        assertThat(config.getReasoningTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getReasoningTemperature()).isEqualTo(0.7);
        assertThat(config.getOutputDirectory()).isEqualTo("/tmp/reports");
        assertThat(config.getOutputFormats()).containsExactly(ReportFormat.TEXT, ReportFormat.JSON);
    }

    @Test
    void shouldLetArgumentsOverrideSettings() {
        // Given
        MonitorConfig.Builder builder = load("mysql:\n  host: from-file\nmonitoring:\n  level: basic\n");

        // When
        MonitorConfig config = MonitorConfig.fromArgs(builder, Map.of("host", "from-args"));

        // Then
        assertThat(config.getHost()).isEqualTo("from-args");
        assertThat(config.getLevel()).isEqualTo(InspectionLevel.BASIC);
    }

    @Test
    void shouldUseDefaultsForEmptySettings() {
        assertThat(load("").build().getLevel()).isEqualTo(InspectionLevel.ADVANCED);
    }

    @Test
    void shouldRejectInvalidYaml() {
        assertThatThrownBy(() -> load("mysql: [unclosed"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldRejectMissingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.yaml")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing.yaml");
    }

    @Test
    void shouldLoadFromFile(@TempDir Path tempDir) throws Exception {
        // Given
        Path file = tempDir.resolve("settings.yaml");
        Files.writeString(file, "mysql:\n  port: 3310\n");

        // When
        MonitorConfig config = loader.load(file).build();

        // Then
        assertThat(config.getPort()).isEqualTo(3310);
    }

    private MonitorConfig.Builder load(String yaml) {
        return loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
