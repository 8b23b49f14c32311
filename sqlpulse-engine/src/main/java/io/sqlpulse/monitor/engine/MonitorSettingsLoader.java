package io.sqlpulse.monitor.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.sqlpulse.monitor.common.analysis.Severity;
import io.sqlpulse.monitor.common.analysis.Threshold;
import io.sqlpulse.monitor.common.analysis.ThresholdOperator;
import io.sqlpulse.monitor.common.check.CheckType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reads a YAML settings file into a {@link MonitorConfig.Builder}.
 *
 * <p>Recognised sections: {@code mysql}, {@code monitoring}, {@code anthropic} and {@code export}.
 * Unknown sections and keys are ignored.
 */
public class MonitorSettingsLoader {
    private static final Logger logger = LoggerFactory.getLogger(MonitorSettingsLoader.class);

    private final ObjectMapper yamlMapper;

    public MonitorSettingsLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public MonitorConfig.Builder load(Path file) {
        if (!Files.isReadable(file)) {
            throw new ConfigurationException("Settings file is not readable: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            MonitorConfig.Builder builder = load(in);
            logger.info("Loaded settings from {}", file);
            return builder;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read settings file " + file + ": " + e.getMessage(), e);
        }
    }

    public MonitorConfig.Builder load(InputStream in) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid settings: " + e.getMessage(), e);
        }

        MonitorConfig.Builder builder = MonitorConfig.builder();
        if (root == null || root.isMissingNode() || root.isNull()) {
            logger.info("Settings are empty, using defaults");
            return builder;
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Settings must be a mapping at the top level");
        }

        applyMysql(root.path("mysql"), builder);
        applyMonitoring(root.path("monitoring"), builder);
        applyAnthropic(root.path("anthropic"), builder);
        applyExport(root.path("export"), builder);
        return builder;
    }

    private void applyMysql(JsonNode mysql, MonitorConfig.Builder builder) {
        text(mysql, "host", builder::host);
        integer(mysql, "port", 1, 65535, builder::port);
        text(mysql, "user", builder::user);
        text(mysql, "password", builder::password);
        text(mysql, "jdbc_url", builder::jdbcUrl);
        integer(mysql, "connection_timeout", 1, Integer.MAX_VALUE, builder::connectionTimeoutSeconds);
        integer(mysql, "retry_attempts", 1, Integer.MAX_VALUE, builder::retryAttempts);
        integer(mysql, "retry_backoff_ms", 0, Integer.MAX_VALUE, builder::retryBackoffMs);
        integer(mysql, "query_timeout", 0, Integer.MAX_VALUE, builder::queryTimeoutSeconds);
    }

    private void applyMonitoring(JsonNode monitoring, MonitorConfig.Builder builder) {
        if (monitoring.hasNonNull("level")) {
            builder.level(MonitorConfig.parseLevel(monitoring.get("level").asText()));
        }
        if (monitoring.has("enabled_checks")) {
            builder.enabledChecks(CheckType.fromNames(stringList(monitoring.get("enabled_checks"))));
        }
        if (monitoring.hasNonNull("enable_tables")) {
            builder.tablesEnabled(monitoring.get("enable_tables").asBoolean(false));
        }
        integer(monitoring, "table_limit", 1, Integer.MAX_VALUE, builder::tableLimit);
        text(monitoring, "disk_path", builder::diskPath);

        JsonNode thresholds = monitoring.path("thresholds");
        Iterator<Map.Entry<String, JsonNode>> fields = thresholds.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            applyThreshold(entry.getKey(), entry.getValue(), builder);
        }
    }

    private void applyThreshold(String name, JsonNode node, MonitorConfig.Builder builder) {
        if (node.isNumber()) {
            builder.thresholdLimit(name, node.asDouble());
            return;
        }
        if (!node.isObject()) {
            logger.warn("Threshold {} must be a number or a mapping, ignoring", name);
            return;
        }
        try {
            String metric = node.path("metric").asText(null);
            if (metric == null || metric.isBlank() || !node.path("limit").isNumber()) {
                logger.warn("Threshold {} needs a metric and a numeric limit, ignoring", name);
                return;
            }
            ThresholdOperator operator = ThresholdOperator.fromSymbol(node.path("operator").asText(">"));
            Severity severity = Severity.parse(node.path("severity").asText("WARNING"));
            builder.threshold(new Threshold(name, metric, operator, node.get("limit").asDouble(), severity));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid threshold {}: {}, ignoring", name, e.getMessage());
        }
    }

    private void applyAnthropic(JsonNode anthropic, MonitorConfig.Builder builder) {
        text(anthropic, "api_key", builder::reasoningApiKey);
        text(anthropic, "model", builder::reasoningModel);
        integer(anthropic, "max_tokens", 1, Integer.MAX_VALUE, builder::reasoningMaxTokens);
        if (anthropic.hasNonNull("temperature")) {
            double temperature = anthropic.get("temperature").asDouble(Double.NaN);
            if (temperature >= 0.0 && temperature <= 1.0) {
                builder.reasoningTemperature(temperature);
            } else {
                logger.warn("Invalid temperature: {}, keeping default", anthropic.get("temperature").asText());
            }
        }
        text(anthropic, "endpoint", builder::reasoningEndpoint);
        integer(anthropic, "timeout_seconds", 1, Integer.MAX_VALUE,
                seconds -> builder.reasoningTimeout(Duration.ofSeconds(seconds)));
        integer(anthropic, "max_request_bytes", 1024, Integer.MAX_VALUE, builder::reasoningMaxRequestBytes);
    }

    private void applyExport(JsonNode export, MonitorConfig.Builder builder) {
        text(export, "destination", builder::outputDirectory);
        if (export.has("formats")) {
            builder.outputFormats(MonitorConfig.parseFormats(stringList(export.get("formats"))));
        }
    }

    private static void text(JsonNode section, String key, Consumer<String> target) {
        JsonNode node = section.path(key);
        if (!node.isMissingNode() && !node.isNull()) {
            target.accept(node.asText());
        }
    }

    private static void integer(JsonNode section, String key, int min, int max, Consumer<Integer> target) {
        JsonNode node = section.path(key);
        if (node.isMissingNode() || node.isNull()) {
            return;
        }
        if (!node.canConvertToInt() && !node.isTextual()) {
            logger.warn("Invalid {}: {}, keeping default", key, node.asText());
            return;
        }
        try {
            int value = node.isTextual() ? Integer.parseInt(node.asText().trim()) : node.asInt();
            if (value < min || value > max) {
                logger.warn("Invalid {}: {}, keeping default", key, value);
                return;
            }
            target.accept(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} format: {}, keeping default", key, node.asText());
        }
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        } else if (node.isTextual()) {
            values.addAll(MonitorConfig.splitList(node.asText()));
        }
        return values;
    }
}
