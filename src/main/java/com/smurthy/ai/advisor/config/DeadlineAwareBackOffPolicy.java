package com.smurthy.ai.advisor.config;

import com.smurthy.ai.advisor.orchestration.RequestDeadline;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Exponential backoff whose every pause is cut short at the request deadline.
 *
 * The deadline is read from the {@link RetryContext} attribute {@link #DEADLINE_ATTRIBUTE}; without
 * it the policy behaves like a plain capped exponential backoff.
 */
public class DeadlineAwareBackOffPolicy implements BackOffPolicy {

    public static final String DEADLINE_ATTRIBUTE = "advisor.request-deadline";

    private final long initialInterval;
    private final double multiplier;
    private final long maxInterval;
    private final Sleeper sleeper;

    public DeadlineAwareBackOffPolicy(long initialInterval, double multiplier, long maxInterval) {
        this(initialInterval, multiplier, maxInterval, new ThreadWaitSleeper());
    }

    DeadlineAwareBackOffPolicy(long initialInterval, double multiplier, long maxInterval, Sleeper sleeper) {
        if (initialInterval < 0 || maxInterval < 0 || multiplier < 1.0) {
            throw new IllegalArgumentException("intervals must not be negative and multiplier must be at least 1");
        }
        this.initialInterval = initialInterval;
        this.multiplier = multiplier;
        this.maxInterval = maxInterval;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new DeadlineBackOffContext(context, Math.min(initialInterval, maxInterval));
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        DeadlineBackOffContext context = (DeadlineBackOffContext) backOffContext;
        long pause = context.nextInterval;
        context.nextInterval = Math.min((long) (pause * multiplier), maxInterval);

        if (context.retryContext.getAttribute(DEADLINE_ATTRIBUTE) instanceof RequestDeadline deadline) {
            pause = Math.min(pause, deadline.remaining().toMillis());
        }
        try {
            sleeper.sleep(pause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted during agent call backoff", e);
        }
    }

    private static final class DeadlineBackOffContext implements BackOffContext {

        private final RetryContext retryContext;
        private long nextInterval;

        private DeadlineBackOffContext(RetryContext retryContext, long firstInterval) {
            this.retryContext = retryContext;
            this.nextInterval = firstInterval;
        }
    }
}
