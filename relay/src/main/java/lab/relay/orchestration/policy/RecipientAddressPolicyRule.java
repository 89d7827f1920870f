package lab.relay.orchestration.policy;

import lab.relay.orchestration.CreateTransferRequest;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.web3j.crypto.WalletUtils;

@Component
@Order(20)
public class RecipientAddressPolicyRule implements PolicyRule {

    @Override
    public PolicyDecision evaluate(CreateTransferRequest req) {
        String to = req.destinationIdentity().trim();
        if (!to.startsWith("0x") || !WalletUtils.isValidAddress(to)) {
            return PolicyDecision.reject("INVALID_RECIPIENT: " + req.destinationIdentity());
        }
        return PolicyDecision.allow();
    }
}
