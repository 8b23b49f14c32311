package io.sqlpulse.monitor.engine.recommendation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.analysis.Severity;
import io.sqlpulse.monitor.common.check.InspectionLevel;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.common.recommendation.RecommendationSource;
import io.sqlpulse.monitor.common.report.RecommendationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps findings to ranked recommendations. With a reasoning client the findings are first sent to the
 * external service; any failure there falls back to the local rules and never fails the run.
 * The pipeline never approves a command.
 */
public class RecommendationPipeline {
    private static final Logger logger = LoggerFactory.getLogger(RecommendationPipeline.class);
    private static final Logger eventLogger = LoggerFactory.getLogger("io.sqlpulse.monitor.events");

    private final LocalRecommendationEngine localEngine;
    private final ReasoningClient reasoningClient;
    private final Duration timeout;
    private final int maxRequestBytes;
    private final ObjectMapper objectMapper;
    private final ExecutorService executorService;

    /**
     * Local-only pipeline
     */
    public RecommendationPipeline(LocalRecommendationEngine localEngine) {
        this(localEngine, null, Duration.ZERO, 0);
    }

    public RecommendationPipeline(LocalRecommendationEngine localEngine, ReasoningClient reasoningClient,
                                  Duration timeout, int maxRequestBytes) {
        this.localEngine = localEngine;
        this.reasoningClient = reasoningClient;
        this.timeout = timeout;
        this.maxRequestBytes = maxRequestBytes;
        this.objectMapper = new ObjectMapper();
        this.executorService = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "reasoning-client");
            t.setDaemon(true);
            return t;
        });
    }

    public RecommendationOutcome recommend(InspectionLevel level, List<Finding> findings, List<MetricSample> samples) {
        if (findings.isEmpty()) {
            return new RecommendationOutcome(List.of(), RecommendationMode.LOCAL, null);
        }

        Map<String, MetricSample> byName = new LinkedHashMap<>();
        for (MetricSample sample : samples) {
            byName.putIfAbsent(sample.getName(), sample);
        }

        if (reasoningClient == null) {
            return new RecommendationOutcome(rank(localEngine.recommend(findings, byName)), RecommendationMode.LOCAL, null);
        }

        try {
            List<RecommendationDraft> drafts = enriched(level, findings, samples, byName);
            return new RecommendationOutcome(rank(drafts), RecommendationMode.ENRICHED, null);
        } catch (RecommendationServiceException e) {
            logger.warn("Reasoning service unavailable, using local recommendations: {}", e.getMessage());
            eventLogger.info("REASONING_FALLBACK|reason={}", e.getMessage());
            return new RecommendationOutcome(rank(localEngine.recommend(findings, byName)),
                    RecommendationMode.LOCAL_FALLBACK, e.getMessage());
        }
    }

    private List<RecommendationDraft> enriched(InspectionLevel level, List<Finding> findings, List<MetricSample> samples,
                                               Map<String, MetricSample> byName) throws RecommendationServiceException {
        ReasoningRequest request = ReasoningRequest.bounded(level, findings, samples, maxRequestBytes, objectMapper);
        if (request.isTruncated()) {
            logger.debug("Reasoning request truncated to {} samples ({} bytes)", request.getSampleCount(), request.sizeInBytes());
        }

        ReasoningResponse response = callWithTimeout(request);

        Map<String, Finding> findingsByKey = new HashMap<>();
        for (Finding finding : findings) {
            findingsByKey.put(finding.getKey(), finding);
        }

        List<RecommendationDraft> drafts = new ArrayList<>();
        Set<String> covered = new LinkedHashSet<>();
        for (ReasoningResponse.Item item : response.getItems()) {
            List<String> keys = new ArrayList<>();
            for (String key : item.getFindingKeys()) {
                // a finding belongs to the first item that claims it
                if (findingsByKey.containsKey(key) && !keys.contains(key) && !covered.contains(key)) {
                    keys.add(key);
                }
            }
            if (keys.isEmpty()) {
                logger.debug("Dropping reasoning item with no unclaimed known finding: {}", item.getFindingKeys());
                continue;
            }
            Finding first = findingsByKey.get(keys.get(0));
            drafts.add(new RecommendationDraft(
                    localEngine.getRules().subsystemFor(first.getMetricName()),
                    priority(item.getPriority(), keys, findingsByKey),
                    item.getAdvice(),
                    item.getCommand(),
                    keys,
                    RecommendationSource.ENRICHED));
            covered.addAll(keys);
        }

        if (drafts.isEmpty()) {
            throw new RecommendationServiceException("Response contains no recommendation for a known finding");
        }

        List<Finding> uncovered = new ArrayList<>();
        for (Finding finding : findings) {
            if (!covered.contains(finding.getKey())) {
                uncovered.add(finding);
            }
        }
        if (!uncovered.isEmpty()) {
            logger.debug("Completing {} findings the reasoning service did not cover with local rules", uncovered.size());
            drafts.addAll(localEngine.recommend(uncovered, byName));
        }
        return drafts;
    }

    private ReasoningResponse callWithTimeout(ReasoningRequest request) throws RecommendationServiceException {
        CompletableFuture<ReasoningResponse> future = CompletableFuture.supplyAsync(() -> {
            try {
                return reasoningClient.analyze(request);
            } catch (RecommendationServiceException e) {
                throw new CompletionException(e);
            }
        }, executorService);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RecommendationServiceException("Reasoning service timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause() : e.getCause();
            if (cause instanceof RecommendationServiceException) {
                throw (RecommendationServiceException) cause;
            }
            throw new RecommendationServiceException("Reasoning service call failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecommendationServiceException("Interrupted while waiting for the reasoning service", e);
        }
    }

    private static Severity priority(String label, List<String> keys, Map<String, Finding> findingsByKey) {
        switch (label == null ? "" : label.trim().toLowerCase(Locale.ROOT)) {
            case "high":
            case "critical":
                return Severity.CRITICAL;
            case "medium":
            case "warning":
                return Severity.WARNING;
            case "low":
            case "info":
                return Severity.INFO;
            default:
                Severity highest = Severity.INFO;
                for (String key : keys) {
                    Severity severity = findingsByKey.get(key).getSeverity();
                    if (severity.compareTo(highest) > 0) {
                        highest = severity;
                    }
                }
                return highest;
        }
    }

    private static List<Recommendation> rank(List<RecommendationDraft> drafts) {
        List<RecommendationDraft> ordered = new ArrayList<>(drafts);
        ordered.sort(RecommendationDraft.RANK_ORDER);
        List<Recommendation> recommendations = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            recommendations.add(ordered.get(i).toRecommendation(String.format(Locale.ROOT, "REC-%03d", i + 1)));
        }
        return recommendations;
    }

    public void shutdown() {
        executorService.shutdownNow();
    }
}
