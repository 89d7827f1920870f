package lab.relay.orchestration.policy;

import lab.relay.orchestration.CreateTransferRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
public class PolicyEngine {

    private final List<PolicyRule> rules;

    // Rules arrive sorted by @Order; the first rejection wins.
    public PolicyEngine(List<PolicyRule> rules) {
        this.rules = List.copyOf(rules);
        log.info("event=policy.loaded rules={}", this.rules.stream().map(r -> r.getClass().getSimpleName()).toList());
    }

    public PolicyDecision evaluate(CreateTransferRequest req) {
        for (PolicyRule rule : rules) {
            PolicyDecision decision = rule.evaluate(req);
            if (!decision.allowed()) {
                PolicyDecision rejected = decision.attributedTo(rule.getClass().getSimpleName());
                log.info("event=policy.rejected rule={} reason={}", rejected.rule(), rejected.reason());
                return rejected;
            }
        }
        return PolicyDecision.allow();
    }
}
