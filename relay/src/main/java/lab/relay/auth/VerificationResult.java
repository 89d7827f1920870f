package lab.relay.auth;

public record VerificationResult(
        boolean authorized,
        String identity,
        String reason
) {
    public static VerificationResult authorized(String identity) {
        return new VerificationResult(true, identity, "AUTHORIZED");
    }

    public static VerificationResult rejected(String identity, String reason) {
        return new VerificationResult(false, identity, reason);
    }
}
