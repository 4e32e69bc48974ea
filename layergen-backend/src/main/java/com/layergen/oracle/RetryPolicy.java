package com.layergen.oracle;

import java.time.Duration;

/**
 * Exponential backoff: the delay doubles after every failed attempt, capped at {@code maxBackoff}.
 *
 * @param maxAttempts total attempts including the first one
 * @param initialBackoff delay before the second attempt
 * @param maxBackoff upper bound for any delay
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
    }

    /**
     * Delay to wait after {@code failedAttempt} failed (1-based).
     */
    public Duration delayAfter(int failedAttempt) {
        Duration delay = initialBackoff;
        for (int i = 1; i < failedAttempt; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(maxBackoff) >= 0) {
                return maxBackoff;
            }
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    /**
     * Delay after a rate-limit response, honouring the oracle's hint within {@code maxBackoff}.
     */
    public Duration delayAfter(int failedAttempt, Duration retryAfter) {
        Duration delay = delayAfter(failedAttempt);
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            delay = retryAfter.compareTo(maxBackoff) > 0 ? maxBackoff : retryAfter;
        }
        return delay;
    }
}
