package io.sqlpulse.monitor.common.recommendation;

/**
 * Lifecycle of a proposed corrective command
 */
public enum ApprovalState {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected"),
    NOT_APPLICABLE("not-applicable");

    private final String label;

    ApprovalState(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
