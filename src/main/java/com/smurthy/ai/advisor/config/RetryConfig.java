package com.smurthy.ai.advisor.config;

import com.smurthy.ai.advisor.exceptions.TransportException;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;

/**
 * Retry policy for outbound agent calls.
 *
 * Not registered as a bean: Spring AI backs off its own {@code RetryTemplate} as soon as the
 * context holds one, and the model clients must keep theirs.
 */
public final class RetryConfig {

    private RetryConfig() {
    }

    /**
     * Retries {@link TransportException} only; one first attempt plus {@code maxRetries} retries,
     * waiting {@code baseDelay * 2^(n-1)} (capped at {@code maxDelay}) before retry n. A pause never
     * outlasts the request deadline stored in the retry context by the caller.
     */
    public static RetryTemplate agentRetryTemplate(InvokerConfig invokerConfig) {
        RetryTemplate retryTemplate = new RetryTemplate();

        retryTemplate.setBackOffPolicy(new DeadlineAwareBackOffPolicy(
                invokerConfig.baseDelay().toMillis(), 2, invokerConfig.maxDelay().toMillis()));

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(invokerConfig.maxRetries() + 1,
                Map.of(TransportException.class, true));
        retryTemplate.setRetryPolicy(retryPolicy);

        return retryTemplate;
    }
}
