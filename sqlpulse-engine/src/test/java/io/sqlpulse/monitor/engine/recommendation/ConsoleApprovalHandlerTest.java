package io.sqlpulse.monitor.engine.recommendation;

import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.engine.ReportFixtures;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleApprovalHandlerTest {

    private final Recommendation recommendation = ReportFixtures.degradedReport().getRecommendations().get(0);

    @Test
    void shouldApproveOnYes() {
        // Given
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleApprovalHandler handler = handler("y\n", buffer);

        // When
        ApprovalHandler.Decision decision = handler.decide(recommendation);

        // Then
        assertThat(decision).isEqualTo(ApprovalHandler.Decision.APPROVE);
        assertThat(buffer.toString(StandardCharsets.UTF_8))
                .contains("REC-001")
                .contains("SET GLOBAL max_connections = 150")
                .contains("[y/N]");
    }

    @Test
    void shouldRejectOnAnyOtherAnswer() {
        assertThat(handler("\n", new ByteArrayOutputStream()).decide(recommendation))
                .isEqualTo(ApprovalHandler.Decision.REJECT);
        assertThat(handler("nope\n", new ByteArrayOutputStream()).decide(recommendation))
                .isEqualTo(ApprovalHandler.Decision.REJECT);
    }

    @Test
    void shouldDeferAtEndOfInput() {
        assertThat(handler("", new ByteArrayOutputStream()).decide(recommendation))
                .isEqualTo(ApprovalHandler.Decision.DEFER);
    }

    private static ConsoleApprovalHandler handler(String input, ByteArrayOutputStream output) {
        return new ConsoleApprovalHandler(new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }
}
