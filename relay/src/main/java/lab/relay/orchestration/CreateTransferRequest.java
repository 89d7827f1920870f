package lab.relay.orchestration;

import lab.relay.domain.transfer.PayloadKind;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

/**
 * Body of {@code POST /transfers}. MESSAGE transfers carry {@code message}; ASSET transfers carry {@code tokenId}
 * and are encoded with {@code sourceIdentity} as owner. {@code requestId} is optional and generated when absent.
 */
public record CreateTransferRequest(
        UUID requestId,
        String sourceIdentity,
        String destinationIdentity,
        String destinationChain,
        PayloadKind payloadKind,
        String message,
        BigInteger tokenId,
        BigDecimal maxFee
) {}
