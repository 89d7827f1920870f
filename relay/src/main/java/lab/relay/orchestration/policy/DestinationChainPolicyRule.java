package lab.relay.orchestration.policy;

import lab.relay.adapter.DestinationChains;
import lab.relay.orchestration.CreateTransferRequest;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(30)
public class DestinationChainPolicyRule implements PolicyRule {

    private final DestinationChains destinationChains;

    public DestinationChainPolicyRule(DestinationChains destinationChains) {
        this.destinationChains = destinationChains;
    }

    @Override
    public PolicyDecision evaluate(CreateTransferRequest req) {
        if (!destinationChains.isAllowed(req.destinationChain())) {
            return PolicyDecision.reject("UNSUPPORTED_DESTINATION_CHAIN: " + req.destinationChain()
                    + ", allowed=" + destinationChains.names());
        }
        return PolicyDecision.allow();
    }
}
