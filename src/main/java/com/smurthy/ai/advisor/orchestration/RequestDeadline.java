package com.smurthy.ai.advisor.orchestration;

import com.smurthy.ai.advisor.exceptions.RequestTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Time budget of one inbound request.
 */
public final class RequestDeadline {

    private final Clock clock;
    private final Instant expiresAt;
    private final Duration budget;

    private RequestDeadline(Clock clock, Duration budget) {
        this.clock = clock;
        this.budget = budget;
        this.expiresAt = clock.instant().plus(budget);
    }

    public static RequestDeadline startingNow(Clock clock, Duration budget) {
        return new RequestDeadline(clock, budget);
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * @throws RequestTimeoutException once the budget is spent
     */
    public void check() {
        if (isExpired()) {
            throw new RequestTimeoutException(budget);
        }
    }
}
