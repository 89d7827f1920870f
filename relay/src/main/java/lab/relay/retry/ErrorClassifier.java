package lab.relay.retry;

@FunctionalInterface
public interface ErrorClassifier {

    /**
     * @return true when the failure is likely to succeed on a later attempt (network timeout, nonce contention).
     */
    boolean isTransient(Throwable error);
}
