package io.sqlpulse.monitor.engine.recommendation;

import io.sqlpulse.monitor.common.recommendation.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Y/N prompt on the terminal. End of input leaves the remaining recommendations pending.
 */
public class ConsoleApprovalHandler implements ApprovalHandler {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleApprovalHandler.class);

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleApprovalHandler(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public Decision decide(Recommendation recommendation) {
        out.println();
        out.println("[" + recommendation.getId() + "] " + recommendation.getPriority() + " " + recommendation.getSubsystem());
        out.println("  " + recommendation.getAdvice());
        out.println("  Proposed command: " + recommendation.getProposedCommand().orElse(""));
        out.print("Approve this command? It will not be executed automatically. [y/N] ");
        out.flush();

        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            logger.warn("Cannot read approval answer: {}", e.getMessage());
            return Decision.DEFER;
        }
        if (answer == null) {
            out.println();
            return Decision.DEFER;
        }

        String normalized = answer.trim().toLowerCase(Locale.ROOT);
        if ("y".equals(normalized) || "yes".equals(normalized)) {
            out.println("Approved. Run it yourself when ready.");
            return Decision.APPROVE;
        }
        out.println("Rejected.");
        return Decision.REJECT;
    }
}
