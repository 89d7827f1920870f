package lab.relay.retry;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a fallible operation until it succeeds, fails with a non-transient error, or the attempt budget runs out.
 * <p>
 * Non-transient errors propagate unchanged after a single invocation and never consume the remaining budget.
 * Transient errors are absorbed until the last attempt, after which a {@link RetryExhaustedException} wrapping the
 * last error is thrown. Idempotency of the operation is the caller's concern.
 */
@Slf4j
public class RetryExecutor {

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(Sleeper.THREAD);
    }

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T> T execute(Supplier<T> operation, RetryPolicy policy, ErrorClassifier classifier) {
        return execute(operation, policy, classifier, AttemptListener.NONE);
    }

    public <T> T execute(Supplier<T> operation, RetryPolicy policy, ErrorClassifier classifier, AttemptListener listener) {
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            listener.beforeAttempt(attempt);
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!classifier.isTransient(e)) {
                    log.info("event=retry.non_transient attempt={} error={}", attempt, e.getMessage());
                    throw e;
                }
                lastError = e;
                if (attempt == policy.maxAttempts()) {
                    break;
                }
                Duration delay = policy.delayAfter(attempt);
                log.info(
                        "event=retry.transient attempt={} maxAttempts={} delayMs={} error={}",
                        attempt,
                        policy.maxAttempts(),
                        delay.toMillis(),
                        e.getMessage()
                );
                pause(delay);
            }
        }
        log.warn("event=retry.exhausted attempts={} error={}", policy.maxAttempts(), lastError.getMessage());
        throw new RetryExhaustedException(policy.maxAttempts(), lastError);
    }

    private void pause(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry", e);
        }
    }
}
