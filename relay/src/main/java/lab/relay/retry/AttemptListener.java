package lab.relay.retry;

@FunctionalInterface
public interface AttemptListener {

    AttemptListener NONE = attempt -> { };

    // Called right before the given (1-based) attempt is invoked.
    void beforeAttempt(int attempt);
}
