package io.sqlpulse.monitor.engine.recommendation;

import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.analysis.Severity;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.common.recommendation.RecommendationSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns findings into advice using the static rule table. Findings of the same subsystem share one
 * recommendation; every finding ends up in exactly one.
 */
public class LocalRecommendationEngine {

    private final LocalRecommendationRules rules;

    public LocalRecommendationEngine(LocalRecommendationRules rules) {
        this.rules = rules;
    }

    public LocalRecommendationRules getRules() {
        return rules;
    }

    List<RecommendationDraft> recommend(List<Finding> findings, Map<String, MetricSample> samples) {
        Map<String, List<Finding>> clusters = new LinkedHashMap<>();
        for (Finding finding : findings) {
            clusters.computeIfAbsent(rules.subsystemFor(finding.getMetricName()), k -> new ArrayList<>()).add(finding);
        }

        List<RecommendationDraft> drafts = new ArrayList<>();
        for (Map.Entry<String, List<Finding>> cluster : clusters.entrySet()) {
            drafts.add(draft(cluster.getKey(), cluster.getValue(), samples));
        }
        return drafts;
    }

    private RecommendationDraft draft(String subsystem, List<Finding> findings, Map<String, MetricSample> samples) {
        Severity priority = Severity.INFO;
        List<String> advice = new ArrayList<>();
        Set<String> commands = new LinkedHashSet<>();
        List<String> keys = new ArrayList<>();

        for (Finding finding : findings) {
            if (finding.getSeverity().compareTo(priority) > 0) {
                priority = finding.getSeverity();
            }
            keys.add(finding.getKey());
            Optional<LocalRecommendationRules.Rule> rule = rules.ruleFor(finding.getMetricName());
            if (rule.isPresent()) {
                advice.add(rule.get().advice.render(finding, samples));
                rule.get().command.render(samples).ifPresent(commands::add);
            } else {
                advice.add(LocalRecommendationRules.genericAdvice(finding));
            }
        }

        String command = commands.isEmpty() ? null : String.join("; ", commands);
        return new RecommendationDraft(subsystem, priority, String.join(" ", advice), command, keys,
                RecommendationSource.LOCAL);
    }
}
