package io.sqlpulse.monitor.common.recommendation;

import io.sqlpulse.monitor.common.analysis.Severity;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Advice derived from one or more findings, optionally carrying a corrective command.
 * Everything except the approval state is fixed at creation. A command only leaves
 * {@link ApprovalState#PENDING} through an explicit {@link #approve()} or {@link #reject()}.
 */
public final class Recommendation {
    private final String id;
    private final String subsystem;
    private final Severity priority;
    private final String advice;
    private final String proposedCommand;
    private final List<String> findingKeys;
    private final RecommendationSource source;
    private final AtomicReference<ApprovalState> approvalState;

    private Recommendation(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.subsystem = Objects.requireNonNull(builder.subsystem, "subsystem");
        this.priority = Objects.requireNonNull(builder.priority, "priority");
        this.advice = Objects.requireNonNull(builder.advice, "advice");
        this.proposedCommand = builder.proposedCommand == null || builder.proposedCommand.trim().isEmpty()
                ? null : builder.proposedCommand.trim();
        this.findingKeys = List.copyOf(builder.findingKeys);
        if (findingKeys.isEmpty()) {
            throw new IllegalArgumentException("Recommendation " + id + " must reference at least one finding");
        }
        this.source = Objects.requireNonNull(builder.source, "source");
        this.approvalState = new AtomicReference<>(
                proposedCommand == null ? ApprovalState.NOT_APPLICABLE : ApprovalState.PENDING);
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public String getId() { return id; }
    public String getSubsystem() { return subsystem; }
    public Severity getPriority() { return priority; }
    public String getAdvice() { return advice; }
    public Optional<String> getProposedCommand() { return Optional.ofNullable(proposedCommand); }
    public List<String> getFindingKeys() { return findingKeys; }
    public RecommendationSource getSource() { return source; }
    public ApprovalState getApprovalState() { return approvalState.get(); }

    public boolean isPending() {
        return approvalState.get() == ApprovalState.PENDING;
    }

    /**
     * Marks the proposed command as approved by a human. The command is not executed.
     *
     * @throws IllegalStateException if the recommendation is not pending
     */
    public void approve() {
        transition(ApprovalState.APPROVED);
    }

    /**
     * @throws IllegalStateException if the recommendation is not pending
     */
    public void reject() {
        transition(ApprovalState.REJECTED);
    }

    private void transition(ApprovalState target) {
        if (!approvalState.compareAndSet(ApprovalState.PENDING, target)) {
            throw new IllegalStateException("Recommendation " + id + " is "
                    + approvalState.get().getLabel() + ", only pending commands can be "
                    + target.getLabel());
        }
    }

    public static class Builder {
        private String id;
        private String subsystem;
        private Severity priority = Severity.INFO;
        private String advice;
        private String proposedCommand;
        private List<String> findingKeys = List.of();
        private RecommendationSource source = RecommendationSource.LOCAL;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder subsystem(String subsystem) {
            this.subsystem = subsystem;
            return this;
        }

        public Builder priority(Severity priority) {
            this.priority = priority;
            return this;
        }

        public Builder advice(String advice) {
            this.advice = advice;
            return this;
        }

        public Builder proposedCommand(String proposedCommand) {
            this.proposedCommand = proposedCommand;
            return this;
        }

        public Builder findingKeys(List<String> findingKeys) {
            this.findingKeys = findingKeys;
            return this;
        }

        public Builder source(RecommendationSource source) {
            this.source = source;
            return this;
        }

        public Recommendation build() {
            return new Recommendation(this);
        }
    }

    @Override
    public String toString() {
        return "Recommendation{" +
                "id='" + id + '\'' +
                ", subsystem='" + subsystem + '\'' +
                ", priority=" + priority +
                ", source=" + source +
                ", approvalState=" + approvalState.get().getLabel() +
                ", findings=" + findingKeys +
                '}';
    }
}
