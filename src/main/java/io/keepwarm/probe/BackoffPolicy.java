package io.keepwarm.probe;

import lombok.Getter;

import java.time.Duration;

/**
 * Bounded exponential backoff: the wait after the n-th failed attempt is
 * {@code min(baseDelay * 2^(n-1), maxDelay)}.
 */
@Getter
public class BackoffPolicy {
    
    // 2^30 already exceeds any sane cap, keeps the shift from overflowing
    private static final int MAX_SHIFT = 30;
    
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    
    public BackoffPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }
    
    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration delayAfterAttempt(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1");
        }
        int shift = Math.min(failedAttempt - 1, MAX_SHIFT);
        long millis;
        try {
            millis = Math.multiplyExact(baseDelay.toMillis(), 1L << shift);
        } catch (ArithmeticException e) {
            return maxDelay;
        }
        Duration delay = Duration.ofMillis(millis);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
    
    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }
}
