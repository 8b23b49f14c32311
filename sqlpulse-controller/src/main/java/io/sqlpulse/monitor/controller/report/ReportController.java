package io.sqlpulse.monitor.controller.report;

import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.common.report.Report;
import io.sqlpulse.monitor.controller.config.ControllerConfig;
import io.sqlpulse.monitor.engine.connect.ConnectionException;
import io.sqlpulse.monitor.engine.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * REST endpoints for triggering runs, reading the latest report and deciding on proposed commands
 */
@RestController
@RequestMapping("/api")
public class ReportController {

    private static final Logger logger = LoggerFactory.getLogger(ReportController.class);

    private final ReportService reportService;
    private final ControllerConfig controllerConfig;

    public ReportController(ReportService reportService, ControllerConfig controllerConfig) {
        this.reportService = reportService;
        this.controllerConfig = controllerConfig;
    }

    @PostMapping(value = "/reports", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> runCheck() {
        try {
            logger.info("Health check requested");
            Report report = reportService.runCheck();
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(reportService.render(report, ReportFormat.JSON));
        } catch (ConnectionException e) {
            logger.error("Health check failed: {}", e.getMessage());
            return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        }
    }

    @GetMapping("/reports/latest")
    public ResponseEntity<String> latest(@RequestParam(value = "format", required = false) String format) {
        ReportFormat reportFormat;
        try {
            reportFormat = ReportFormat.parse(format == null ? controllerConfig.getDefaultFormat() : format);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        Optional<Report> report = reportService.latest();
        if (report.isEmpty()) {
            return error(HttpStatus.NOT_FOUND, "No report has been produced yet");
        }
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(reportFormat.getMediaType()))
                .body(reportService.render(report.get(), reportFormat));
    }

    @PostMapping(value = "/recommendations/{id}/approve", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> approve(@PathVariable("id") String id) {
        try {
            return ResponseEntity.ok(describe(reportService.approve(id)));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping(value = "/recommendations/{id}/reject", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> reject(@PathVariable("id") String id) {
        try {
            return ResponseEntity.ok(describe(reportService.reject(id)));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    private static Map<String, Object> describe(Recommendation recommendation) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", recommendation.getId());
        body.put("subsystem", recommendation.getSubsystem());
        body.put("approval", recommendation.getApprovalState().name());
        body.put("command", recommendation.getProposedCommand().orElse(null));
        body.put("executed", false);
        return body;
    }

    private static ResponseEntity<String> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(message);
    }
}
