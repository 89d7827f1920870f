package lab.relay.auth;

import lombok.extern.slf4j.Slf4j;

import java.security.SignatureException;
import java.time.Instant;

/**
 * Authorizes a signed message by recovering its signer and checking the signer's role.
 * <p>
 * Untrusted input never raises: unrecoverable signatures, failing role lookups and signers without the role all
 * come back as {@link VerificationResult#rejected}. Callers treat a rejection as final and do not retry it.
 */
@Slf4j
public class SignatureAuthorizationVerifier {

    private final SignatureRecovery signatureRecovery;
    private final RoleRegistry roleRegistry;

    public SignatureAuthorizationVerifier(SignatureRecovery signatureRecovery, RoleRegistry roleRegistry) {
        this.signatureRecovery = signatureRecovery;
        this.roleRegistry = roleRegistry;
    }

    public VerificationResult verifyAuthorized(byte[] message, byte[] signature, String requiredRole) {
        String identity;
        try {
            identity = signatureRecovery.recover(message, signature);
        } catch (SignatureException | RuntimeException e) {
            log.warn("event=auth.recovery_failed role={} error={}", requiredRole, e.getMessage());
            return VerificationResult.rejected(null, "SIGNATURE_UNRECOVERABLE: " + e.getMessage());
        }

        boolean member;
        try {
            member = roleRegistry.hasRole(identity, requiredRole);
        } catch (RuntimeException e) {
            log.warn("event=auth.role_lookup_failed identity={} role={} error={}", identity, requiredRole, e.getMessage());
            return VerificationResult.rejected(identity, "ROLE_LOOKUP_FAILED: " + e.getMessage());
        }

        if (!member) {
            log.warn("event=auth.rejected identity={} role={}", identity, requiredRole);
            return VerificationResult.rejected(identity, "MISSING_ROLE: " + requiredRole);
        }
        log.debug("event=auth.authorized identity={} role={}", identity, requiredRole);
        return VerificationResult.authorized(identity);
    }

    public int evictExpiredRoleLookups(Instant now) {
        return roleRegistry.evictExpired(now);
    }
}
