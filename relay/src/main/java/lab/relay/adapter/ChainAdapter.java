package lab.relay.adapter;

import java.util.Optional;
import java.util.UUID;

public interface ChainAdapter {

    /**
     * Submit a relay transaction towards the destination chain.
     *
     * @throws TransientChainException when the failure is worth retrying (timeouts, nonce contention)
     * @throws PermanentChainException when the chain rejected the request for good
     */
    SubmitResult submit(SubmitCommand command);

    Optional<Receipt> findReceipt(String txHandle);

    default boolean supportsReceiptPolling() {
        return false;
    }

    record SubmitCommand(
            UUID transferId,
            String destinationChain,
            int destinationEndpointId,
            String to,
            byte[] payload,
            long maxFeeWei
    ) {}

    record SubmitResult(
            String txHandle,
            boolean accepted
    ) {}

    record Receipt(
            String txHandle,
            boolean success,
            long blockNumber
    ) {}
}
