package io.sqlpulse.monitor.common.recommendation;

/**
 * Where the advice text of a recommendation came from
 */
public enum RecommendationSource {
    LOCAL,      // static rule table
    ENRICHED    // external reasoning service
}
