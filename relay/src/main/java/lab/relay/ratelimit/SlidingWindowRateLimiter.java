package lab.relay.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-identity sliding-window admission control.
 * <p>
 * Each identity owns a deque of admission timestamps inside the trailing window. The check-then-append for one
 * identity runs inside {@link ConcurrentHashMap#compute}, and every other read or prune of a window goes through
 * {@link ConcurrentHashMap#computeIfPresent}: a deque is only touched while its map entry is held, and different
 * identities never wait on a shared lock. A rejected call leaves the window untouched.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    private final String name;
    private final int maxRequestsPerWindow;
    private final Duration windowDuration;
    private final Clock clock;
    private final ConcurrentHashMap<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(String name, int maxRequestsPerWindow, Duration windowDuration, Clock clock) {
        if (maxRequestsPerWindow < 1) {
            throw new IllegalArgumentException("maxRequestsPerWindow must be >= 1");
        }
        if (windowDuration == null || windowDuration.isZero() || windowDuration.isNegative()) {
            throw new IllegalArgumentException("windowDuration must be positive");
        }
        this.name = name;
        this.maxRequestsPerWindow = maxRequestsPerWindow;
        this.windowDuration = windowDuration;
        this.clock = clock;
    }

    public boolean admit(String identity) {
        return admit(identity, clock.instant());
    }

    public boolean admit(String identity, Instant now) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity is required");
        }
        AtomicBoolean admitted = new AtomicBoolean(false);
        windows.compute(identity, (key, existing) -> {
            Deque<Instant> timestamps = existing != null ? existing : new ArrayDeque<>();
            prune(timestamps, now);
            if (timestamps.size() < maxRequestsPerWindow) {
                timestamps.addLast(now);
                admitted.set(true);
            }
            return timestamps.isEmpty() ? null : timestamps;
        });
        if (!admitted.get()) {
            log.info("event=rate_limit.rejected limiter={} identity={} max={} window={}", name, identity, maxRequestsPerWindow, windowDuration);
        }
        return admitted.get();
    }

    // Number of admissions still counted for the identity at the given instant.
    public int currentCount(String identity, Instant now) {
        AtomicInteger count = new AtomicInteger();
        windows.computeIfPresent(identity, (key, timestamps) -> {
            count.set((int) timestamps.stream().filter(t -> isInside(t, now)).count());
            return timestamps;
        });
        return count.get();
    }

    // Drop windows whose every timestamp has rolled out, so idle identities do not accumulate.
    public int evictExpired(Instant now) {
        int before = windows.size();
        for (String identity : windows.keySet()) {
            windows.computeIfPresent(identity, (key, timestamps) -> {
                prune(timestamps, now);
                return timestamps.isEmpty() ? null : timestamps;
            });
        }
        int evicted = Math.max(0, before - windows.size());
        if (evicted > 0) {
            log.debug("event=rate_limit.evicted limiter={} count={}", name, evicted);
        }
        return evicted;
    }

    public String getName() {
        return name;
    }

    public int getMaxRequestsPerWindow() {
        return maxRequestsPerWindow;
    }

    public Duration getWindowDuration() {
        return windowDuration;
    }

    // Callers hold the identity's map entry through compute or computeIfPresent.
    private void prune(Deque<Instant> timestamps, Instant now) {
        while (!timestamps.isEmpty() && !isInside(timestamps.peekFirst(), now)) {
            timestamps.pollFirst();
        }
    }

    private boolean isInside(Instant timestamp, Instant now) {
        return Duration.between(timestamp, now).compareTo(windowDuration) < 0;
    }
}
