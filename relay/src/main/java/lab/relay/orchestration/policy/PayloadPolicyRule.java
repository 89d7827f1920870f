package lab.relay.orchestration.policy;

import lab.relay.orchestration.CreateTransferRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.web3j.crypto.WalletUtils;

import java.nio.charset.StandardCharsets;

@Component
@Order(50)
public class PayloadPolicyRule implements PolicyRule {

    private final int maxMessageBytes;

    public PayloadPolicyRule(@Value("${relay.policy.max-message-bytes:4096}") int maxMessageBytes) {
        this.maxMessageBytes = maxMessageBytes;
    }

    @Override
    public PolicyDecision evaluate(CreateTransferRequest req) {
        return switch (req.payloadKind()) {
            case MESSAGE -> evaluateMessage(req.message());
            case ASSET -> evaluateAsset(req);
        };
    }

    private PolicyDecision evaluateMessage(String message) {
        if (message == null || message.isEmpty()) {
            return PolicyDecision.reject("INVALID_PAYLOAD: message is required");
        }
        int size = message.getBytes(StandardCharsets.UTF_8).length;
        if (size > maxMessageBytes) {
            return PolicyDecision.reject("INVALID_PAYLOAD: message exceeds " + maxMessageBytes + " bytes");
        }
        return PolicyDecision.allow();
    }

    // Asset payloads encode the sender as owner, so it must be an address too.
    private PolicyDecision evaluateAsset(CreateTransferRequest req) {
        if (req.tokenId() == null || req.tokenId().signum() <= 0) {
            return PolicyDecision.reject("INVALID_PAYLOAD: tokenId must be positive");
        }
        if (req.tokenId().bitLength() > 256) {
            return PolicyDecision.reject("INVALID_PAYLOAD: tokenId exceeds uint256");
        }
        String owner = req.sourceIdentity().trim();
        if (!owner.startsWith("0x") || !WalletUtils.isValidAddress(owner)) {
            return PolicyDecision.reject("INVALID_PAYLOAD: asset owner must be an address, got " + req.sourceIdentity());
        }
        return PolicyDecision.allow();
    }
}
