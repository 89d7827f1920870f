package lab.relay.auth;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reuses positive and negative role lookups for a fixed TTL. Only installed when a TTL is configured.
 * Failed lookups are never cached, and at most {@code maxEntries} lookups are held at once.
 */
@Slf4j
public class CachingRoleRegistry implements RoleRegistry {

    private final RoleRegistry delegate;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final ConcurrentHashMap<String, CachedLookup> cache = new ConcurrentHashMap<>();

    public CachingRoleRegistry(RoleRegistry delegate, Duration ttl, int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.delegate = delegate;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @Override
    public boolean hasRole(String identity, String role) {
        String key = role.toUpperCase(Locale.ROOT) + "|" + identity.toLowerCase(Locale.ROOT);
        Instant now = clock.instant();
        CachedLookup cached = cache.get(key);
        if (cached != null && now.isBefore(cached.expiresAt())) {
            return cached.member();
        }
        boolean member = delegate.hasRole(identity, role);
        if (cached == null && cache.size() >= maxEntries && evictExpired(now) == 0) {
            log.debug("event=auth.role_cache.full size={} identity={}", cache.size(), identity);
            return member;
        }
        cache.put(key, new CachedLookup(member, now.plus(ttl)));
        return member;
    }

    @Override
    public int evictExpired(Instant now) {
        int before = cache.size();
        cache.values().removeIf(lookup -> !now.isBefore(lookup.expiresAt()));
        return Math.max(0, before - cache.size());
    }

    public int size() {
        return cache.size();
    }

    public void invalidateAll() {
        cache.clear();
    }

    private record CachedLookup(boolean member, Instant expiresAt) {}
}
