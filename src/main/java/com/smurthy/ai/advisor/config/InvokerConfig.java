package com.smurthy.ai.advisor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Outbound agent call settings. Retries apply to transport failures only;
 * delay before retry n is {@code baseDelay * 2^(n-1)}, capped at {@code maxDelay}.
 */
@ConfigurationProperties(prefix = "app.invoker")
public record InvokerConfig(
        @DefaultValue("750ms") Duration baseDelay,
        @DefaultValue("10s") Duration maxDelay,
        @DefaultValue("3") int maxRetries,
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("45s") Duration readTimeout,
        String authToken
) {
}
