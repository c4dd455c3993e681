package com.smurthy.ai.advisor.model;

import java.util.Optional;

/**
 * Outcome of intent routing for one query.
 *
 * @param targetAgent agent id, empty only when {@code method == NONE}
 * @param confidence  fused confidence in [0, 1]
 * @param method      evidence that produced the decision
 * @param rationale   human-readable explanation, for logs and the answer envelope
 */
public record RoutingDecision(
        Optional<String> targetAgent,
        double confidence,
        RoutingMethod method,
        String rationale
) {
    public RoutingDecision {
        if (targetAgent.isEmpty() != (method == RoutingMethod.NONE)) {
            throw new IllegalArgumentException("targetAgent must be empty exactly when method is NONE");
        }
        confidence = clamp(confidence);
    }

    public static RoutingDecision routed(String agentId, double confidence, RoutingMethod method, String rationale) {
        return new RoutingDecision(Optional.of(agentId), confidence, method, rationale);
    }

    public static RoutingDecision none(String rationale) {
        return new RoutingDecision(Optional.empty(), 0.0, RoutingMethod.NONE, rationale);
    }

    public boolean isRouted() {
        return method != RoutingMethod.NONE;
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
