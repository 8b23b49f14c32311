package io.sqlpulse.monitor.engine.report;

import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.CollectorFailure;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.common.report.Report;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public class PlainTextReportRenderer implements ReportRenderer {

    private static final String RULE = "=".repeat(72);
    private static final String SUB_RULE = "-".repeat(72);

    @Override
    public ReportFormat format() {
        return ReportFormat.TEXT;
    }

    @Override
    public String render(Report report) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("MySQL Health Report").append('\n');
        sb.append(RULE).append('\n');
        line(sb, "Generated", report.getTimestamp().toString());
        line(sb, "Server", report.getConnection().toString());
        line(sb, "Level", report.getLevel().displayName());
        line(sb, "Capture window", report.getCaptureStart() + " .. " + report.getCaptureEnd());
        line(sb, "Checks", report.getResolvedChecks().stream()
                .map(CheckType::getKey).collect(Collectors.joining(", ")));
        line(sb, "Status", report.isDegraded() ? "DEGRADED" : "COMPLETE");
        for (Map.Entry<CheckType, String> skipped : report.getSkippedChecks().entrySet()) {
            line(sb, "Skipped", skipped.getKey().getKey() + ": " + skipped.getValue());
        }

        for (Map.Entry<String, List<MetricSample>> section : report.getSamplesByCollector().entrySet()) {
            header(sb, "Metrics: " + section.getKey());
            for (MetricSample sample : section.getValue()) {
                sb.append("  ").append(sample.getName()).append(" = ").append(sample.getValue().display()).append('\n');
            }
        }

        if (!report.getFailures().isEmpty()) {
            header(sb, "Collector failures");
            for (CollectorFailure failure : report.getFailures()) {
                sb.append("  ").append(failure.getCollector()).append(": ").append(failure.getErrorMessage()).append('\n');
            }
        }

        header(sb, "Findings (" + report.getFindings().size() + ")");
        if (report.getFindings().isEmpty()) {
            sb.append("  No threshold violations").append('\n');
        }
        for (Finding finding : report.getFindings()) {
            sb.append("  [").append(finding.getSeverity()).append("] ").append(finding.getDescription()).append('\n');
        }

        header(sb, "Recommendations (" + report.getRecommendationMode() + ")");
        report.getFallbackReason().ifPresent(reason -> sb.append("  Fallback reason: ").append(reason).append('\n'));
        if (report.getRecommendations().isEmpty()) {
            sb.append("  None").append('\n');
        }
        for (Recommendation recommendation : report.getRecommendations()) {
            sb.append("  ").append(recommendation.getId())
                    .append(" [").append(recommendation.getPriority()).append("] ")
                    .append(recommendation.getSubsystem())
                    .append(" (").append(recommendation.getSource()).append(")").append('\n');
            sb.append("    ").append(recommendation.getAdvice()).append('\n');
            sb.append("    Command: ").append(recommendation.getProposedCommand().orElse("not-applicable"))
                    .append(" [").append(recommendation.getApprovalState()).append("]").append('\n');
            sb.append("    Findings: ").append(String.join(", ", recommendation.getFindingKeys())).append('\n');
        }
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    private static void header(StringBuilder sb, String title) {
        sb.append('\n').append(title).append('\n').append(SUB_RULE).append('\n');
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append(String.format(Locale.ROOT, "%-15s %s\n", label + ":", value));
    }
}
