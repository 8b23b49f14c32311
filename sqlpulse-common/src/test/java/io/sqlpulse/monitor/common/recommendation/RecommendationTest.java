package io.sqlpulse.monitor.common.recommendation;

import io.sqlpulse.monitor.common.analysis.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecommendationTest {

    @Test
    void recommendationWithCommandStartsPending() {
        Recommendation recommendation = withCommand("SET GLOBAL max_connections = 200");

        assertThat(recommendation.getApprovalState()).isEqualTo(ApprovalState.PENDING);
        assertThat(recommendation.isPending()).isTrue();
        assertThat(recommendation.getProposedCommand()).hasValue("SET GLOBAL max_connections = 200");
    }

    @Test
    void recommendationWithoutCommandIsNotApplicable() {
        Recommendation recommendation = withCommand("  ");

        assertThat(recommendation.getApprovalState()).isEqualTo(ApprovalState.NOT_APPLICABLE);
        assertThat(recommendation.getProposedCommand()).isEmpty();
        assertThatThrownBy(recommendation::approve).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void approvalIsFinal() {
        // Given
        Recommendation recommendation = withCommand("OPTIMIZE TABLE shop.orders");

        // When
        recommendation.approve();

        // Then
        assertThat(recommendation.getApprovalState()).isEqualTo(ApprovalState.APPROVED);
        assertThatThrownBy(recommendation::reject)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("approved");
        assertThat(recommendation.getApprovalState()).isEqualTo(ApprovalState.APPROVED);
    }

    @Test
    void rejectionIsFinal() {
        Recommendation recommendation = withCommand("OPTIMIZE TABLE shop.orders");

        recommendation.reject();

        assertThat(recommendation.getApprovalState()).isEqualTo(ApprovalState.REJECTED);
        assertThatThrownBy(recommendation::approve).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRequireAtLeastOneFinding() {
        assertThatThrownBy(() -> Recommendation.builder()
                .id("REC-001")
                .subsystem("connections")
                .advice("Raise max_connections")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("REC-001");
    }

    private static Recommendation withCommand(String command) {
        return Recommendation.builder()
                .id("REC-001")
                .subsystem("connections")
                .priority(Severity.WARNING)
                .advice("Connection usage is high")
                .proposedCommand(command)
                .findingKeys(List.of("connections.usage_percent:WARNING"))
                .build();
    }
}
