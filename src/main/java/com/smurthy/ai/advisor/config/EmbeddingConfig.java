package com.smurthy.ai.advisor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for embedding input normalisation.
 * Texts longer than {@code longTextThreshold} keep only their head and tail, so head and tail
 * together must fit within the threshold.
 */
@ConfigurationProperties(prefix = "app.embedding")
public record EmbeddingConfig(
        @DefaultValue("5000") int longTextThreshold,
        @DefaultValue("2000") int headChars,
        @DefaultValue("2000") int tailChars
) {
    public EmbeddingConfig {
        if (longTextThreshold <= 0) {
            throw new IllegalArgumentException("app.embedding.long-text-threshold must be positive but was "
                    + longTextThreshold);
        }
        if (headChars < 0 || tailChars < 0) {
            throw new IllegalArgumentException("app.embedding.head-chars and tail-chars must not be negative");
        }
        if (headChars + tailChars > longTextThreshold) {
            throw new IllegalArgumentException("app.embedding.head-chars (" + headChars + ") + tail-chars ("
                    + tailChars + ") must not exceed long-text-threshold (" + longTextThreshold + ")");
        }
    }
}
