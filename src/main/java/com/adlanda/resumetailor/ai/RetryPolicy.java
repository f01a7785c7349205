package com.adlanda.resumetailor.ai;

import java.time.Duration;

/**
 * Retry budget and exponential backoff for AI backend calls.
 *
 * @param maxRetries  Retries after the first attempt; total attempts are {@code maxRetries + 1}
 * @param backoffUnit Delay before the first retry; each later retry doubles it
 */
public record RetryPolicy(int maxRetries, Duration backoffUnit) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1));

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (backoffUnit == null || backoffUnit.isNegative()) {
            throw new IllegalArgumentException("backoffUnit must be zero or positive");
        }
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Delay before retry number {@code attempt} (1-based): {@code 2^(attempt-1)} units.
     */
    public Duration delayBefore(int attempt) {
        if (attempt < 1) {
            return Duration.ZERO;
        }
        return backoffUnit.multipliedBy(1L << Math.min(attempt - 1, 30));
    }
}
