package io.sqlpulse.monitor.engine;

import io.sqlpulse.monitor.common.analysis.AnalysisEngine;
import io.sqlpulse.monitor.common.analysis.AnalysisResult;
import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.report.Report;
import io.sqlpulse.monitor.common.report.ReportBuilder;
import io.sqlpulse.monitor.engine.collector.CollectionResult;
import io.sqlpulse.monitor.engine.collector.CollectorRegistry;
import io.sqlpulse.monitor.engine.collector.CollectorSet;
import io.sqlpulse.monitor.engine.collector.OshiHostProbe;
import io.sqlpulse.monitor.engine.connect.ConnectionException;
import io.sqlpulse.monitor.engine.connect.Connector;
import io.sqlpulse.monitor.engine.connect.JdbcConnector;
import io.sqlpulse.monitor.engine.connect.Session;
import io.sqlpulse.monitor.engine.policy.LevelPolicy;
import io.sqlpulse.monitor.engine.policy.ResolvedChecks;
import io.sqlpulse.monitor.engine.recommendation.AnthropicReasoningClient;
import io.sqlpulse.monitor.engine.recommendation.LocalRecommendationEngine;
import io.sqlpulse.monitor.engine.recommendation.LocalRecommendationRules;
import io.sqlpulse.monitor.engine.recommendation.RecommendationOutcome;
import io.sqlpulse.monitor.engine.recommendation.RecommendationPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * One monitoring run: connect, collect the checks the level allows, analyze, recommend and assemble
 * the report. The session is closed on every exit path.
 */
public class HealthCheckRunner {
    private static final Logger logger = LoggerFactory.getLogger(HealthCheckRunner.class);
    private static final Logger eventLogger = LoggerFactory.getLogger("io.sqlpulse.monitor.events");

    private final MonitorConfig config;
    private final Connector connector;
    private final CollectorRegistry registry;
    private final LevelPolicy levelPolicy;
    private final AnalysisEngine analysisEngine;
    private final RecommendationPipeline recommendationPipeline;
    private final Clock clock;

    public HealthCheckRunner(MonitorConfig config, Connector connector, CollectorRegistry registry,
                             LevelPolicy levelPolicy, AnalysisEngine analysisEngine,
                             RecommendationPipeline recommendationPipeline, Clock clock) {
        this.config = config;
        this.connector = connector;
        this.registry = registry;
        this.levelPolicy = levelPolicy;
        this.analysisEngine = analysisEngine;
        this.recommendationPipeline = recommendationPipeline;
        this.clock = clock;
    }

    /**
     * Wires the JDBC connector, the OSHI host probe and, when an API key is configured, the
     * Anthropic reasoning client.
     */
    public static HealthCheckRunner create(MonitorConfig config) {
        Clock clock = Clock.systemUTC();
        LocalRecommendationEngine localEngine = new LocalRecommendationEngine(new LocalRecommendationRules());
        RecommendationPipeline pipeline = config.isReasoningEnabled()
                ? new RecommendationPipeline(localEngine, new AnthropicReasoningClient(config),
                        config.getReasoningTimeout(), config.getReasoningMaxRequestBytes())
                : new RecommendationPipeline(localEngine);
        return new HealthCheckRunner(
                config,
                new JdbcConnector(config),
                CollectorRegistry.createDefault(config, new OshiHostProbe(), clock),
                new LevelPolicy(),
                new AnalysisEngine(),
                pipeline,
                clock);
    }

    /**
     * @throws ConnectionException when no session could be opened; nothing else fails a run
     */
    public Report run() throws ConnectionException {
        ResolvedChecks resolved = levelPolicy.resolve(config.getLevel(), config.getEnabledChecks(), config.isTablesEnabled());
        eventLogger.info("RUN_STARTED|level={}|checks={}", resolved.getLevel(), resolved.getChecks());
        logger.info("Starting {} health check against {}", resolved.getLevel().displayName(), config.connectionIdentity());

        CollectionResult collected;
        try (Session session = connector.connect()) {
            collected = new CollectorSet(registry.forChecks(resolved.getChecks()), clock).collectAll(session);
        }

        AnalysisResult analysis = analysisEngine.analyze(collected.getSamples(), config.getThresholds());
        for (Finding finding : analysis.getFindings()) {
            eventLogger.info("FINDING|metric={}|severity={}|value={}|limit={}",
                    finding.getMetricName(), finding.getSeverity(), finding.getValue(), finding.getLimit());
        }

        List<MetricSample> allSamples = new ArrayList<>(collected.getSamples());
        allSamples.addAll(analysis.getDerivedSamples());

        RecommendationOutcome outcome = recommendationPipeline.recommend(resolved.getLevel(), analysis.getFindings(), allSamples);

        Report report = new ReportBuilder()
                .timestamp(collected.getStartedAt())
                .connection(config.connectionIdentity())
                .level(resolved.getLevel())
                .resolvedChecks(resolved.getChecks())
                .skippedChecks(resolved.getSkipped())
                .addSamples(allSamples)
                .failures(collected.getFailures())
                .findings(analysis.getFindings())
                .recommendations(outcome.getRecommendations(), outcome.getMode(), outcome.getFallbackReason().orElse(null))
                .captureWindow(collected.getStartedAt(), collected.getFinishedAt())
                .build();

        eventLogger.info("RUN_COMPLETED|findings={}|recommendations={}|degraded={}",
                report.getFindings().size(), report.getRecommendations().size(), report.isDegraded());
        if (report.isDegraded()) {
            logger.warn("Health check completed with {} failed collectors", report.getFailures().size());
        } else {
            logger.info("Health check completed: {} findings, {} recommendations",
                    report.getFindings().size(), report.getRecommendations().size());
        }
        return report;
    }

    public void shutdown() {
        recommendationPipeline.shutdown();
    }
}
