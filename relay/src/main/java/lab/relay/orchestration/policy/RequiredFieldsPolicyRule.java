package lab.relay.orchestration.policy;

import lab.relay.orchestration.CreateTransferRequest;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class RequiredFieldsPolicyRule implements PolicyRule {

    @Override
    public PolicyDecision evaluate(CreateTransferRequest req) {
        if (req == null) {
            return PolicyDecision.reject("MISSING_FIELD: body");
        }
        if (isBlank(req.sourceIdentity())) {
            return PolicyDecision.reject("MISSING_FIELD: sourceIdentity");
        }
        if (isBlank(req.destinationIdentity())) {
            return PolicyDecision.reject("MISSING_FIELD: destinationIdentity");
        }
        if (isBlank(req.destinationChain())) {
            return PolicyDecision.reject("MISSING_FIELD: destinationChain");
        }
        if (req.payloadKind() == null) {
            return PolicyDecision.reject("MISSING_FIELD: payloadKind");
        }
        if (req.maxFee() == null) {
            return PolicyDecision.reject("MISSING_FIELD: maxFee");
        }
        return PolicyDecision.allow();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
