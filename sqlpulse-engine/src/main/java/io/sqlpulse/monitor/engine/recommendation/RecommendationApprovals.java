package io.sqlpulse.monitor.engine.recommendation;

import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.common.report.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Applies approval decisions to recommendations. Approving records the decision only; commands are
 * never executed.
 */
public final class RecommendationApprovals {
    private static final Logger logger = LoggerFactory.getLogger(RecommendationApprovals.class);

    private RecommendationApprovals() {
    }

    /**
     * Asks the handler about every pending recommendation
     *
     * @return the number of recommendations approved or rejected
     */
    public static int review(List<Recommendation> recommendations, ApprovalHandler handler) {
        int decided = 0;
        for (Recommendation recommendation : recommendations) {
            if (!recommendation.isPending()) {
                continue;
            }
            ApprovalHandler.Decision decision = handler.decide(recommendation);
            if (decision == ApprovalHandler.Decision.APPROVE) {
                approve(recommendation);
                decided++;
            } else if (decision == ApprovalHandler.Decision.REJECT) {
                reject(recommendation);
                decided++;
            }
        }
        return decided;
    }

    /**
     * @throws NoSuchElementException when the report has no recommendation with that id
     * @throws IllegalStateException when the recommendation is not pending
     */
    public static Recommendation approve(Report report, String id) {
        Recommendation recommendation = find(report, id);
        approve(recommendation);
        return recommendation;
    }

    /**
     * @throws NoSuchElementException when the report has no recommendation with that id
     * @throws IllegalStateException when the recommendation is not pending
     */
    public static Recommendation reject(Report report, String id) {
        Recommendation recommendation = find(report, id);
        reject(recommendation);
        return recommendation;
    }

    private static Recommendation find(Report report, String id) {
        return report.findRecommendation(id)
                .orElseThrow(() -> new NoSuchElementException("Unknown recommendation: " + id));
    }

    private static void approve(Recommendation recommendation) {
        recommendation.approve();
        logger.info("Recommendation {} approved, run manually: {}",
                recommendation.getId(), recommendation.getProposedCommand().orElse(""));
    }

    private static void reject(Recommendation recommendation) {
        recommendation.reject();
        logger.info("Recommendation {} rejected", recommendation.getId());
    }
}
