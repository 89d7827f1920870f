package lab.relay.orchestration.policy;

import lab.relay.orchestration.CreateTransferRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Component
@Order(60)
public class RecipientWhitelistPolicyRule implements PolicyRule {

    private final Set<String> whitelist;

    public RecipientWhitelistPolicyRule(@Value("${relay.policy.whitelist-recipients:}") String whitelistRecipients) {
        this.whitelist = Arrays.stream(whitelistRecipients.split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    @Override
    public PolicyDecision evaluate(CreateTransferRequest req) {
        if (!whitelist.isEmpty() && !whitelist.contains(req.destinationIdentity().trim().toLowerCase(Locale.ROOT))) {
            return PolicyDecision.reject("RECIPIENT_NOT_WHITELISTED: " + req.destinationIdentity());
        }
        return PolicyDecision.allow();
    }
}
