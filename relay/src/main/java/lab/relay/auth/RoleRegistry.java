package lab.relay.auth;

import java.time.Instant;

/**
 * Read-only view of which identities currently hold a chain role.
 */
public interface RoleRegistry {

    boolean hasRole(String identity, String role);

    // Drops lookups cached past their lifetime; returns how many were dropped.
    default int evictExpired(Instant now) {
        return 0;
    }
}
