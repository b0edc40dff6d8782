package com.starscape.rapidvariant.features.uploadvariants.app;

import com.starscape.rapidvariant.common.concurrent.CancellationToken;
import com.starscape.rapidvariant.common.exception.AbortedException;
import com.starscape.rapidvariant.features.uploadvariants.domain.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs a call with exponential backoff between attempts.
 */
@Component
public class RetryExecutor {
    
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);
    
    /**
     * Waits out a backoff delay. Implementations may return early once {@code token} is cancelled.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration, CancellationToken token) throws InterruptedException;
    }
    
    private final Sleeper sleeper;
    
    public RetryExecutor() {
        this((duration, token) -> token.await(duration));
    }
    
    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }
    
    /**
     * Invoke {@code call} until it succeeds, the policy is exhausted, or {@code shouldRetry} rejects
     * the failure. Aborts are never retried, and a cancelled token stops further attempts.
     *
     * @throws RuntimeException the last failure once no further attempt is made
     */
    public <T> T execute(String label, Supplier<T> call, RetryPolicy policy,
                         Predicate<Throwable> shouldRetry, CancellationToken token) {
        for (int attempt = 0; ; attempt++) {
            if (attempt > 0) {
                token.throwIfCancelled("before retry " + attempt + " of " + label);
            }
            try {
                return call.get();
            } catch (AbortedException e) {
                throw e;
            } catch (RuntimeException e) {
                if (attempt >= policy.maxRetries() || !shouldRetry.test(e)) {
                    throw e;
                }
                Duration delay = policy.delayFor(attempt);
                log.warn("Retry attempt {}/{} for {} after {}ms: {}",
                    attempt + 1, policy.maxRetries(), label, delay.toMillis(), e.getMessage());
                backOff(delay, label, token);
            }
        }
    }
    
    private void backOff(Duration delay, String label, CancellationToken token) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay, token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AbortedException("Interrupted while backing off " + label);
        }
    }
}
