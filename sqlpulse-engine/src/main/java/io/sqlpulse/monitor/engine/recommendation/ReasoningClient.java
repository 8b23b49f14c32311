package io.sqlpulse.monitor.engine.recommendation;

/**
 * Narrow contract with the external reasoning service
 */
public interface ReasoningClient {

    ReasoningResponse analyze(ReasoningRequest request) throws RecommendationServiceException;
}
