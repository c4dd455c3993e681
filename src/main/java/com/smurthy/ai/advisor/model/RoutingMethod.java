package com.smurthy.ai.advisor.model;

/**
 * Which evidence produced a routing decision.
 */
public enum RoutingMethod {
    /** Keyword rules alone. */
    RULES,
    /** The LLM classifier alone. */
    LLM,
    /** Rules and classifier agreed on the same agent. */
    FUSED,
    /** No usable evidence; the query is not understood. */
    NONE
}
