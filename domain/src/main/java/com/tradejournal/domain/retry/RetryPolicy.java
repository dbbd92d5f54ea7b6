package com.tradejournal.domain.retry;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Bounded exponential backoff: {@code maxAttempts} tries in total, waiting
 * {@code baseDelay * multiplier^(n-1)} after the n-th failure.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;

    private RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be a positive duration");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, was " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay, double multiplier) {
        return new RetryPolicy(maxAttempts, baseDelay, multiplier);
    }

    /**
     * Wait applied after the given failed attempt (1-based).
     */
    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based, was " + attempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis(Math.round(millis));
    }

    /**
     * Sum of all waits when every attempt fails.
     */
    public Duration totalBackoff() {
        Duration total = Duration.ZERO;
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            total = total.plus(delayAfterAttempt(attempt));
        }
        return total;
    }
}
