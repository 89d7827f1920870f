package lab.relay.orchestration;

import lab.relay.domain.transfer.PayloadKind;
import lab.relay.domain.transfer.TransferRequest;
import lab.relay.domain.transfer.TransferState;
import org.web3j.utils.Numeric;

import java.time.Instant;
import java.util.UUID;

public record TransferStatusResponse(
        UUID id,
        String sourceIdentity,
        String destinationIdentity,
        String destinationChain,
        PayloadKind payloadKind,
        String payloadHex,
        long maxFeeWei,
        TransferState state,
        boolean terminal,
        int attempts,
        String lastError,
        String txHandle,
        Instant createdAt,
        Instant updatedAt
) {
    public static TransferStatusResponse from(TransferRequest r) {
        return new TransferStatusResponse(
                r.getId(),
                r.getSourceIdentity(),
                r.getDestinationIdentity(),
                r.getDestinationChain(),
                r.getPayloadKind(),
                Numeric.toHexString(r.getPayload()),
                r.getMaxFeeWei(),
                r.getState(),
                r.getState().isTerminal(),
                r.getAttempts(),
                r.getLastError(),
                r.getTxHandle(),
                r.getCreatedAt(),
                r.getUpdatedAt()
        );
    }
}
