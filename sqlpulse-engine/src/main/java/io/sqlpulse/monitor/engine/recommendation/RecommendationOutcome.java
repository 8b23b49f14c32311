package io.sqlpulse.monitor.engine.recommendation;

import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.common.report.RecommendationMode;

import java.util.List;
import java.util.Optional;

/**
 * Ranked recommendations of a run and how they were produced
 */
public final class RecommendationOutcome {
    private final List<Recommendation> recommendations;
    private final RecommendationMode mode;
    private final String fallbackReason;

    public RecommendationOutcome(List<Recommendation> recommendations, RecommendationMode mode, String fallbackReason) {
        this.recommendations = List.copyOf(recommendations);
        this.mode = mode;
        this.fallbackReason = fallbackReason;
    }

    public List<Recommendation> getRecommendations() { return recommendations; }
    public RecommendationMode getMode() { return mode; }
    public Optional<String> getFallbackReason() { return Optional.ofNullable(fallbackReason); }
}
