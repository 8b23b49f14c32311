package io.sqlpulse.monitor.engine.report;

import io.sqlpulse.monitor.common.report.Report;

/**
 * Renders a report to one output format. Implementations only read the report.
 */
public interface ReportRenderer {

    ReportFormat format();

    String render(Report report);

    static ReportRenderer forFormat(ReportFormat format) {
        switch (format) {
            case TEXT:
                return new PlainTextReportRenderer();
            case JSON:
                return new JsonReportRenderer();
            case CSV:
                return new CsvReportRenderer();
            default:
                throw new IllegalArgumentException("Unsupported report format: " + format);
        }
    }
}
