package com.starscape.rapidvariant.features.uploadvariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

import java.time.Duration;

/**
 * Exponential backoff: attempt {@code n} (0-based) waits {@code baseDelay * 2^n} before the next try.
 * {@code maxRetries} counts retries, so a call is attempted at most {@code maxRetries + 1} times.
 */
public record RetryPolicy(
    int maxRetries,
    Duration baseDelay
) implements ValueObject {
    
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(1000);
    
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("Base delay cannot be negative");
        }
    }
    
    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY);
    }
    
    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO);
    }
    
    public Duration delayFor(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt, 30));
    }
}
