package lab.relay.retry;

import lombok.Getter;

@Getter
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("operation failed after " + attempts + " attempts: " + (lastError != null ? lastError.getMessage() : "unknown error"), lastError);
        this.attempts = attempts;
    }
}
