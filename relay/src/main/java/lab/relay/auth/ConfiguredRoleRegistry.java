package lab.relay.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(prefix = "relay.auth", name = "registry", havingValue = "configured", matchIfMissing = true)
@Slf4j
public class ConfiguredRoleRegistry implements RoleRegistry {

    private final Map<String, Set<String>> membersByRole;

    public ConfiguredRoleRegistry(RoleMembershipProperties properties) {
        Map<String, Set<String>> members = new HashMap<>();
        properties.getRoles().forEach((role, identities) -> members.put(
                normalizeRole(role),
                identities.stream()
                        .map(String::trim)
                        .filter(s -> !s.isBlank())
                        .map(ConfiguredRoleRegistry::normalizeIdentity)
                        .collect(Collectors.toUnmodifiableSet())
        ));
        this.membersByRole = Collections.unmodifiableMap(members);
        log.info("event=role_registry.configured roles={}", membersByRole.keySet());
    }

    @Override
    public boolean hasRole(String identity, String role) {
        if (identity == null || role == null) {
            return false;
        }
        return membersByRole.getOrDefault(normalizeRole(role), Set.of()).contains(normalizeIdentity(identity));
    }

    private static String normalizeRole(String role) {
        return role.trim().toUpperCase(Locale.ROOT);
    }

    // EVM addresses compare case-insensitively; checksum casing is presentation only.
    private static String normalizeIdentity(String identity) {
        return identity.trim().toLowerCase(Locale.ROOT);
    }
}
