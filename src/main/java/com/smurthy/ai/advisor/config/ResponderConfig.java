package com.smurthy.ai.advisor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Answer generation settings of the corpus-grounded responder.
 *
 * @param temperature sampling temperature of the answer prompt
 * @param maxTokens   cap on generated tokens
 * @param maxSources  number of ranked documents cited in the answer
 */
@ConfigurationProperties(prefix = "app.responder")
public record ResponderConfig(
        @DefaultValue("0.3") double temperature,
        @DefaultValue("2048") int maxTokens,
        @DefaultValue("3") int maxSources
) {
}
