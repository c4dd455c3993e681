package com.smurthy.ai.advisor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Where the responder corpus lives and how long a loaded snapshot stays fresh.
 *
 * After a failed fetch the store is not asked again for {@code retryAfterFailure}.
 * Leave {@code endpoint} empty for AWS S3; set it for a local S3-compatible store.
 */
@ConfigurationProperties(prefix = "app.corpus")
public record CorpusConfig(
        @DefaultValue("advisor-corpus") String bucket,
        @DefaultValue("documents_fiscaux/") String prefix,
        @DefaultValue("1h") Duration ttl,
        @DefaultValue("1m") Duration retryAfterFailure,
        @DefaultValue("eu-west-3") String region,
        String endpoint
) {
}
