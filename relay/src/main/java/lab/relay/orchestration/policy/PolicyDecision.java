package lab.relay.orchestration.policy;

/**
 * Outcome of one policy check. {@code rule} names the rule that rejected, and is null for an allowed request.
 */
public record PolicyDecision(
        boolean allowed,
        String reason,
        String rule
) {
    private static final PolicyDecision ALLOWED = new PolicyDecision(true, "ALLOWED", null);

    public static PolicyDecision allow() {
        return ALLOWED;
    }

    public static PolicyDecision reject(String reason) {
        return new PolicyDecision(false, reason, null);
    }

    PolicyDecision attributedTo(String ruleName) {
        return allowed ? this : new PolicyDecision(false, reason, ruleName);
    }
}
