package io.sqlpulse.monitor.engine.recommendation;

import io.sqlpulse.monitor.common.recommendation.Recommendation;

/**
 * External confirmation of proposed commands. Only ever asked about pending recommendations.
 */
public interface ApprovalHandler {

    enum Decision {
        APPROVE,
        REJECT,
        DEFER
    }

    Decision decide(Recommendation recommendation);
}
