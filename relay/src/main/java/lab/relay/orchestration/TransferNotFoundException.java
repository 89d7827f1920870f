package lab.relay.orchestration;

import java.util.UUID;

public class TransferNotFoundException extends RuntimeException {

    public TransferNotFoundException(UUID id) {
        super("transfer not found: " + id);
    }
}
