package lab.relay.auth;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "relay.auth")
public class RoleMembershipProperties {

    /**
     * Registry backing role lookups: "configured" (this file) or "contract" (AccessControl hasRole calls).
     */
    private String registry = "configured";

    /**
     * Role name to member identities, used by the configured registry.
     */
    private Map<String, List<String>> roles = new LinkedHashMap<>();

    /**
     * AccessControl contract queried by the contract registry.
     */
    private String roleContract;

    /**
     * How long a role lookup may be reused. Zero disables caching.
     */
    private Duration roleCacheTtl = Duration.ZERO;

    /**
     * Upper bound on cached role lookups. Lookups beyond it go to the registry uncached until entries expire.
     */
    private int roleCacheMaxEntries = 10_000;
}
