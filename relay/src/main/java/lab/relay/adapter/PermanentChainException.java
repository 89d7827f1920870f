package lab.relay.adapter;

public class PermanentChainException extends RuntimeException {

    public PermanentChainException(String message) {
        super(message);
    }

    public PermanentChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
