package com.smurthy.ai.advisor.routing;

import com.smurthy.ai.advisor.config.RoutingConfig;
import com.smurthy.ai.advisor.model.AgentDescriptor;
import com.smurthy.ai.advisor.model.RoutingDecision;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Deterministic keyword scoring over the agents' keyword sets.
 *
 * Keywords match whole words (or whole phrases) in the lower-cased query, so "tva" matches
 * "la TVA ?" but not "activa".
 */
@Component
public class KeywordRuleScorer {

    private final RoutingConfig config;
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public KeywordRuleScorer(RoutingConfig config) {
        this.config = config;
    }

    /**
     * Score every agent with at least one hit, best first. Ties keep the agents' order.
     */
    public List<RuleScore> scoreAll(String query, List<AgentDescriptor> agents) {
        String text = query == null ? "" : query.toLowerCase(Locale.ROOT);

        List<AgentHits> hits = new ArrayList<>();
        for (AgentDescriptor agent : agents) {
            List<String> matched = agent.keywords().stream()
                    .map(k -> k.toLowerCase(Locale.ROOT).strip())
                    .filter(k -> !k.isEmpty())
                    .distinct()
                    .filter(k -> patternFor(k).matcher(text).find())
                    .toList();
            if (!matched.isEmpty()) {
                hits.add(new AgentHits(agent.id(), matched));
            }
        }
        hits.sort(Comparator.comparingInt((AgentHits h) -> h.matched().size()).reversed());

        List<RuleScore> scores = new ArrayList<>(hits.size());
        for (int i = 0; i < hits.size(); i++) {
            AgentHits current = hits.get(i);
            int runnerUp = bestOther(hits, i);
            scores.add(new RuleScore(current.agentId(), current.matched(),
                    confidence(current.matched().size(), runnerUp)));
        }
        scores.sort(Comparator.comparingDouble(RuleScore::confidence).reversed());
        return scores;
    }

    public Optional<RuleScore> best(String query, List<AgentDescriptor> agents) {
        List<RuleScore> scores = scoreAll(query, agents);
        return scores.isEmpty() ? Optional.empty() : Optional.of(scores.get(0));
    }

    /**
     * {@code singleHit + (hits - 1) * extraHit}, reduced when another agent matched too.
     */
    double confidence(int hits, int runnerUpHits) {
        if (hits <= 0) {
            return 0.0;
        }
        double raw = config.singleHitConfidence() + (hits - 1) * config.extraHitBonus();
        if (runnerUpHits > 0) {
            double share = Math.min(1.0, (double) runnerUpHits / hits);
            raw *= 1.0 - config.ambiguityPenalty() * share;
        }
        return RoutingDecision.clamp(raw);
    }

    private static int bestOther(List<AgentHits> sorted, int index) {
        for (int i = 0; i < sorted.size(); i++) {
            if (i != index) {
                return sorted.get(i).matched().size();
            }
        }
        return 0;
    }

    private Pattern patternFor(String keyword) {
        return patterns.computeIfAbsent(keyword, k ->
                Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(k) + "(?![\\p{L}\\p{N}])"));
    }

    private record AgentHits(String agentId, List<String> matched) {
    }
}
