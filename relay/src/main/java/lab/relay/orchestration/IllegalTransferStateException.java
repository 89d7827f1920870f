package lab.relay.orchestration;

import lab.relay.domain.transfer.TransferState;
import lombok.Getter;

import java.util.UUID;

@Getter
public class IllegalTransferStateException extends RuntimeException {

    private final UUID transferId;
    private final TransferState currentState;

    public IllegalTransferStateException(UUID transferId, TransferState currentState, String action) {
        super("cannot " + action + " transfer " + transferId + " in state " + currentState);
        this.transferId = transferId;
        this.currentState = currentState;
    }
}
