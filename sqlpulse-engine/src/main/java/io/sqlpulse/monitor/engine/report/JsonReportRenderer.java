package io.sqlpulse.monitor.engine.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.CollectorFailure;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.metrics.MetricValue;
import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.common.report.Report;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering with a fixed field order and ISO-8601 timestamps
 */
public class JsonReportRenderer implements ReportRenderer {

    private final ObjectMapper objectMapper;

    public JsonReportRenderer() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonReportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ReportFormat format() {
        return ReportFormat.JSON;
    }

    @Override
    public String render(Report report) {
        try {
            return objectMapper.writeValueAsString(toTree(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize report", e);
        }
    }

    public ObjectNode toTree(Report report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("timestamp", report.getTimestamp().toString());
        ObjectNode connection = root.putObject("connection");
        connection.put("host", report.getConnection().getHost());
        connection.put("port", report.getConnection().getPort());
        connection.put("user", report.getConnection().getUser());
        root.put("level", report.getLevel().name());
        root.put("degraded", report.isDegraded());

        ObjectNode capture = root.putObject("capture_window");
        capture.put("start", report.getCaptureStart().toString());
        capture.put("end", report.getCaptureEnd().toString());

        ArrayNode checks = root.putArray("checks");
        report.getResolvedChecks().forEach(check -> checks.add(check.getKey()));
        ObjectNode skipped = root.putObject("skipped_checks");
        for (Map.Entry<CheckType, String> entry : report.getSkippedChecks().entrySet()) {
            skipped.put(entry.getKey().getKey(), entry.getValue());
        }

        ObjectNode metrics = root.putObject("metrics");
        for (Map.Entry<String, List<MetricSample>> section : report.getSamplesByCollector().entrySet()) {
            ObjectNode collector = metrics.putObject(section.getKey());
            for (MetricSample sample : section.getValue()) {
                ObjectNode node = collector.putObject(sample.getName());
                putValue(node, sample.getValue());
                node.put("timestamp", sample.getTimestamp().toString());
            }
        }

        ArrayNode failures = root.putArray("failures");
        for (CollectorFailure failure : report.getFailures()) {
            ObjectNode node = failures.addObject();
            node.put("collector", failure.getCollector());
            node.put("error", failure.getErrorMessage());
            node.put("timestamp", failure.getTimestamp().toString());
        }

        ArrayNode findings = root.putArray("findings");
        for (Finding finding : report.getFindings()) {
            ObjectNode node = findings.addObject();
            node.put("key", finding.getKey());
            node.put("metric", finding.getMetricName());
            node.put("threshold", finding.getThresholdName());
            node.put("severity", finding.getSeverity().name());
            node.put("operator", finding.getOperator().getSymbol());
            node.put("value", finding.getValue());
            node.put("limit", finding.getLimit());
            node.put("description", finding.getDescription());
        }

        ObjectNode recommendations = root.putObject("recommendations");
        recommendations.put("mode", report.getRecommendationMode().name());
        report.getFallbackReason().ifPresent(reason -> recommendations.put("fallback_reason", reason));
        ArrayNode items = recommendations.putArray("items");
        for (Recommendation recommendation : report.getRecommendations()) {
            ObjectNode node = items.addObject();
            node.put("id", recommendation.getId());
            node.put("subsystem", recommendation.getSubsystem());
            node.put("priority", recommendation.getPriority().name());
            node.put("advice", recommendation.getAdvice());
            node.put("command", recommendation.getProposedCommand().orElse(null));
            node.put("approval", recommendation.getApprovalState().name());
            node.put("source", recommendation.getSource().name());
            ArrayNode keys = node.putArray("findings");
            recommendation.getFindingKeys().forEach(keys::add);
        }
        return root;
    }

    private static void putValue(ObjectNode node, MetricValue value) {
        node.put("kind", value.getKind().name());
        switch (value.getKind()) {
            case NUMBER:
                node.put("value", value.asNumber().getAsDouble());
                break;
            case DURATION:
                node.put("value", value.asNumber().getAsDouble());
                node.put("unit", "ms");
                break;
            default:
                node.put("value", value.asText());
                break;
        }
    }
}
