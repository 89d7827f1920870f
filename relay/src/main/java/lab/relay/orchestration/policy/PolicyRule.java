package lab.relay.orchestration.policy;

import lab.relay.orchestration.CreateTransferRequest;

public interface PolicyRule {
    PolicyDecision evaluate(CreateTransferRequest req);
}
