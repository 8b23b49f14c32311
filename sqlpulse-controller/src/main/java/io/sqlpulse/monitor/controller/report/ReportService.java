package io.sqlpulse.monitor.controller.report;

import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.common.report.Report;
import io.sqlpulse.monitor.engine.HealthCheckRunner;
import io.sqlpulse.monitor.engine.connect.ConnectionException;
import io.sqlpulse.monitor.engine.recommendation.RecommendationApprovals;
import io.sqlpulse.monitor.engine.report.ReportFormat;
import io.sqlpulse.monitor.engine.report.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs health checks and keeps the latest report for rendering and approvals
 */
@Service
public class ReportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    private final HealthCheckRunner runner;
    private final AtomicReference<Report> latest = new AtomicReference<>();

    public ReportService(HealthCheckRunner runner) {
        this.runner = runner;
    }

    /**
     * Runs are serialized; each one replaces the latest report
     */
    public synchronized Report runCheck() throws ConnectionException {
        Report report = runner.run();
        latest.set(report);
        logger.info("Stored report {} with {} findings", report.getTimestamp(), report.getFindings().size());
        return report;
    }

    public Optional<Report> latest() {
        return Optional.ofNullable(latest.get());
    }

    public String render(Report report, ReportFormat format) {
        return ReportRenderer.forFormat(format).render(report);
    }

    public Recommendation approve(String id) {
        return RecommendationApprovals.approve(requireLatest(), id);
    }

    public Recommendation reject(String id) {
        return RecommendationApprovals.reject(requireLatest(), id);
    }

    private Report requireLatest() {
        return latest().orElseThrow(() -> new NoSuchElementException("No report has been produced yet"));
    }
}
