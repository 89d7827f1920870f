package lab.relay.adapter;

public class TransientChainException extends RuntimeException {

    public TransientChainException(String message) {
        super(message);
    }

    public TransientChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
