package io.sqlpulse.monitor.engine.recommendation;

import io.sqlpulse.monitor.common.analysis.Severity;
import io.sqlpulse.monitor.common.recommendation.Recommendation;
import io.sqlpulse.monitor.common.recommendation.RecommendationSource;

import java.util.Comparator;
import java.util.List;

/**
 * A recommendation before ranking has given it an id
 */
final class RecommendationDraft {

    static final Comparator<RecommendationDraft> RANK_ORDER = Comparator
            .comparing(RecommendationDraft::getPriority, Comparator.reverseOrder())
            .thenComparing(RecommendationDraft::getSubsystem);

    private final String subsystem;
    private final Severity priority;
    private final String advice;
    private final String command;
    private final List<String> findingKeys;
    private final RecommendationSource source;

    RecommendationDraft(String subsystem, Severity priority, String advice, String command,
                        List<String> findingKeys, RecommendationSource source) {
        this.subsystem = subsystem;
        this.priority = priority;
        this.advice = advice;
        this.command = command;
        this.findingKeys = List.copyOf(findingKeys);
        this.source = source;
    }

    String getSubsystem() { return subsystem; }
    Severity getPriority() { return priority; }
    String getAdvice() { return advice; }
    String getCommand() { return command; }
    List<String> getFindingKeys() { return findingKeys; }
    RecommendationSource getSource() { return source; }

    Recommendation toRecommendation(String id) {
        return Recommendation.builder()
                .id(id)
                .subsystem(subsystem)
                .priority(priority)
                .advice(advice)
                .proposedCommand(command)
                .findingKeys(findingKeys)
                .source(source)
                .build();
    }
}
