package lab.relay.retry;

public enum BackoffMode {
    FIXED,
    EXPONENTIAL
}
