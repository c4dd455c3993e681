package com.smurthy.ai.advisor.routing;

import com.smurthy.ai.advisor.model.RoutingDecision;

import java.util.Optional;

/**
 * Result of one LLM classification attempt. Only {@link Status#CLASSIFIED} carries an agent.
 */
public record ClassificationOutcome(Status status, Optional<String> agentId, double confidence, String reason) {

    public enum Status {
        /** A known agent id with a confidence. */
        CLASSIFIED,
        /** The model answered "none". */
        ABSTAINED,
        /** Output unparseable, off-schema, or naming an unknown agent. */
        REJECTED,
        /** The generation call itself failed. */
        FAILED
    }

    public ClassificationOutcome {
        confidence = RoutingDecision.clamp(confidence);
        reason = reason == null ? "" : reason;
    }

    public static ClassificationOutcome classified(String agentId, double confidence, String reason) {
        return new ClassificationOutcome(Status.CLASSIFIED, Optional.of(agentId), confidence, reason);
    }

    public static ClassificationOutcome abstained(String reason) {
        return new ClassificationOutcome(Status.ABSTAINED, Optional.empty(), 0.0, reason);
    }

    public static ClassificationOutcome rejected(String reason) {
        return new ClassificationOutcome(Status.REJECTED, Optional.empty(), 0.0, reason);
    }

    public static ClassificationOutcome failed(String reason) {
        return new ClassificationOutcome(Status.FAILED, Optional.empty(), 0.0, reason);
    }

    public boolean hasCandidate() {
        return status == Status.CLASSIFIED;
    }
}
