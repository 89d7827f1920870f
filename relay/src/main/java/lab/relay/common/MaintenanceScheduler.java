package lab.relay.common;

import lab.relay.auth.SignatureAuthorizationVerifier;
import lab.relay.event.EventDedupSet;
import lab.relay.ratelimit.SlidingWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

// Keeps the in-memory limiter windows, dedup set and role cache from growing with idle keys.
@Component
@Slf4j
public class MaintenanceScheduler {

    private final SlidingWindowRateLimiter transferRateLimiter;
    private final SlidingWindowRateLimiter apiRateLimiter;
    private final EventDedupSet eventDedupSet;
    private final SignatureAuthorizationVerifier signatureAuthorizationVerifier;
    private final Clock clock;

    public MaintenanceScheduler(
            @Qualifier("transferRateLimiter") SlidingWindowRateLimiter transferRateLimiter,
            @Qualifier("apiRateLimiter") SlidingWindowRateLimiter apiRateLimiter,
            EventDedupSet eventDedupSet,
            SignatureAuthorizationVerifier signatureAuthorizationVerifier,
            Clock clock) {
        this.transferRateLimiter = transferRateLimiter;
        this.apiRateLimiter = apiRateLimiter;
        this.eventDedupSet = eventDedupSet;
        this.signatureAuthorizationVerifier = signatureAuthorizationVerifier;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${relay.maintenance.interval-ms:60000}", initialDelayString = "${relay.maintenance.interval-ms:60000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int transferWindows = transferRateLimiter.evictExpired(now);
        int apiWindows = apiRateLimiter.evictExpired(now);
        int dedupEntries = eventDedupSet.evictExpired(now);
        int roleLookups = signatureAuthorizationVerifier.evictExpiredRoleLookups(now);
        log.debug(
                "event=maintenance.evicted transferWindows={} apiWindows={} dedupEntries={} dedupSize={} roleLookups={}",
                transferWindows,
                apiWindows,
                dedupEntries,
                eventDedupSet.size(),
                roleLookups
        );
    }
}
