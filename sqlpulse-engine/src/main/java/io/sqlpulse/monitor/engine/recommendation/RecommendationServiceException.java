package io.sqlpulse.monitor.engine.recommendation;

/**
 * The reasoning service could not deliver usable advice: transport error, bad status, timeout
 * or malformed payload. Triggers the local fallback.
 */
public class RecommendationServiceException extends Exception {

    public RecommendationServiceException(String message) {
        super(message);
    }

    public RecommendationServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
