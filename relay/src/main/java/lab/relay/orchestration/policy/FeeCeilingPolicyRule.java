package lab.relay.orchestration.policy;

import lab.relay.orchestration.CreateTransferRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@Order(40)
public class FeeCeilingPolicyRule implements PolicyRule {

    private final BigDecimal maxFeeEth;

    public FeeCeilingPolicyRule(@Value("${relay.policy.max-fee:0.05}") BigDecimal maxFeeEth) {
        this.maxFeeEth = maxFeeEth;
    }

    @Override
    public PolicyDecision evaluate(CreateTransferRequest req) {
        BigDecimal fee = req.maxFee();
        if (fee.signum() <= 0) {
            return PolicyDecision.reject("INVALID_FEE: must be positive, requested=" + fee);
        }
        if (fee.stripTrailingZeros().scale() > 18) {
            return PolicyDecision.reject("INVALID_FEE: at most 18 fractional digits, requested=" + fee);
        }
        if (fee.compareTo(maxFeeEth) > 0) {
            return PolicyDecision.reject("FEE_CEILING_EXCEEDED: max=" + maxFeeEth + ", requested=" + fee);
        }
        return PolicyDecision.allow();
    }
}
