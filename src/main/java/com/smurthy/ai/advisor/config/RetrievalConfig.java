package com.smurthy.ai.advisor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Retrieval and context-assembly tuning. These are empirical values, kept configurable.
 */
@ConfigurationProperties(prefix = "app.retrieval")
public record RetrievalConfig(
        @DefaultValue("3") int topK,
        @DefaultValue("0.3") double minScore,
        @DefaultValue("3") int titleRepeat,
        @DefaultValue("1000") int bodyPrefixChars,
        @DefaultValue("3000") int maxContextChars,
        @DefaultValue("800") int docBodyChars,
        @DefaultValue("400") int docBodyFallbackChars,
        @DefaultValue("0.7") double sentenceCutRatio
) {
}
