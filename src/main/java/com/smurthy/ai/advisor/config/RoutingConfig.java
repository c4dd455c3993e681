package com.smurthy.ai.advisor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Intent routing thresholds and rule weights.
 *
 * A single keyword hit scores {@code singleHitConfidence}; each further hit adds
 * {@code extraHitBonus}. When another agent also matched, the score is reduced by
 * {@code ambiguityPenalty} scaled by the runner-up's share of hits.
 */
@ConfigurationProperties(prefix = "app.routing")
public record RoutingConfig(
        @DefaultValue("0.8") double goodThreshold,
        @DefaultValue("0.8") double singleHitConfidence,
        @DefaultValue("0.1") double extraHitBonus,
        @DefaultValue("0.5") double ambiguityPenalty,
        @DefaultValue("0.0") double classifierTemperature,
        @DefaultValue("256") int classifierMaxTokens
) {
}
