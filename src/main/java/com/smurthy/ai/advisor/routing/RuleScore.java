package com.smurthy.ai.advisor.routing;

import java.util.List;

/**
 * Keyword evidence for one agent.
 *
 * @param agentId         agent the keywords belong to
 * @param matchedKeywords keywords found in the query, in declaration order
 * @param confidence      normalised rule confidence in [0, 1]
 */
public record RuleScore(String agentId, List<String> matchedKeywords, double confidence) {

    public int hits() {
        return matchedKeywords.size();
    }
}
