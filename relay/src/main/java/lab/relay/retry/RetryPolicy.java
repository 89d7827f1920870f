package lab.relay.retry;

import java.time.Duration;

/**
 * Attempt budget and delay schedule for {@link RetryExecutor}.
 * The default schedule waits {@code baseDelay} between every pair of attempts; exponential growth is opt-in.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        BackoffMode backoff,
        Duration maxDelay
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (backoff == null) {
            backoff = BackoffMode.FIXED;
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            maxDelay = baseDelay;
        }
    }

    public static RetryPolicy fixed(int maxAttempts, Duration baseDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, BackoffMode.FIXED, baseDelay);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, BackoffMode.EXPONENTIAL, maxDelay);
    }

    // Delay to wait after the given (1-based) failed attempt before starting the next one.
    public Duration delayAfter(int attempt) {
        if (backoff == BackoffMode.FIXED || attempt <= 1) {
            return baseDelay;
        }
        int shift = Math.min(attempt - 1, 30);
        long millis;
        try {
            millis = Math.multiplyExact(baseDelay.toMillis(), 1L << shift);
        } catch (ArithmeticException e) {
            return maxDelay;
        }
        Duration grown = Duration.ofMillis(millis);
        return grown.compareTo(maxDelay) > 0 ? maxDelay : grown;
    }
}
