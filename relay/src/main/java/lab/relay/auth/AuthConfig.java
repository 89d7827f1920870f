package lab.relay.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class AuthConfig {

    @Bean
    public SignatureAuthorizationVerifier signatureAuthorizationVerifier(
            SignatureRecovery signatureRecovery,
            RoleRegistry roleRegistry,
            RoleMembershipProperties properties,
            Clock clock) {
        RoleRegistry registry = roleRegistry;
        Duration ttl = properties.getRoleCacheTtl();
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            log.info("event=auth.role_cache.enabled ttl={} maxEntries={}", ttl, properties.getRoleCacheMaxEntries());
            registry = new CachingRoleRegistry(roleRegistry, ttl, properties.getRoleCacheMaxEntries(), clock);
        }
        return new SignatureAuthorizationVerifier(signatureRecovery, registry);
    }
}
