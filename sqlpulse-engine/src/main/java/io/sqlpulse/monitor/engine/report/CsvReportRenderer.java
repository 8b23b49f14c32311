package io.sqlpulse.monitor.engine.report;

import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.CollectorFailure;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.metrics.MetricValue;
import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.common.report.Report;

import java.util.List;
import java.util.Map;

/**
 * One record per metric, skipped check, failure, finding and recommendation.
 * Columns: section, collector, name, value, severity, detail.
 */
public class CsvReportRenderer implements ReportRenderer {

    static final String HEADER = "section,collector,name,value,severity,detail";

    @Override
    public ReportFormat format() {
        return ReportFormat.CSV;
    }

    @Override
    public String render(Report report) {
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append("\r\n");
        row(sb, "run", "", "timestamp", report.getTimestamp().toString(), "", report.getConnection().toString());
        row(sb, "run", "", "level", report.getLevel().name(), "", report.isDegraded() ? "degraded" : "complete");
        row(sb, "run", "", "recommendation_mode", report.getRecommendationMode().name(), "",
                report.getFallbackReason().orElse(""));

        for (Map.Entry<CheckType, String> skipped : report.getSkippedChecks().entrySet()) {
            row(sb, "skipped", "", skipped.getKey().getKey(), "", "", skipped.getValue());
        }
        for (Map.Entry<String, List<MetricSample>> section : report.getSamplesByCollector().entrySet()) {
            for (MetricSample sample : section.getValue()) {
                row(sb, "metric", section.getKey(), sample.getName(), sample.getValue().display(), "",
                        sample.getTimestamp().toString());
            }
        }
        for (CollectorFailure failure : report.getFailures()) {
            row(sb, "failure", failure.getCollector(), "", "", "", failure.getErrorMessage());
        }
        for (Finding finding : report.getFindings()) {
            row(sb, "finding", finding.getCollector(), finding.getMetricName(),
                    MetricValue.formatNumber(finding.getValue()), finding.getSeverity().name(), finding.getDescription());
        }
        for (Recommendation recommendation : report.getRecommendations()) {
            row(sb, "recommendation", recommendation.getSubsystem(), recommendation.getId(),
                    recommendation.getProposedCommand().orElse(""), recommendation.getPriority().name(),
                    recommendation.getAdvice() + " [" + recommendation.getApprovalState() + "; "
                            + String.join(" ", recommendation.getFindingKeys()) + "]");
        }
        return sb.toString();
    }

    private static void row(StringBuilder sb, String... fields) {
        for (int i = 0; i < fields.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(fields[i]));
        }
        sb.append("\r\n");
    }

    static String escape(String field) {
        if (field == null) {
            return "";
        }
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
