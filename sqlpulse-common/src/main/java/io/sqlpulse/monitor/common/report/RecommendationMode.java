package io.sqlpulse.monitor.common.report;

/**
 * How the recommendations of a report were produced
 */
public enum RecommendationMode {
    LOCAL,
    ENRICHED,
    LOCAL_FALLBACK
}
