package lab.relay.ratelimit;

import lab.relay.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter("test", 5, Duration.ofSeconds(60), clock);

    @Test
    void sixthCallInsideWindowIsRejected() {
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.admit("0xA")).isTrue();
            clock.advance(Duration.ofSeconds(1));
        }
        assertThat(limiter.admit("0xA")).isFalse();
        assertThat(limiter.currentCount("0xA", clock.instant())).isEqualTo(5);
    }

    @Test
    void rejectionDoesNotExtendTheWindow() {
        for (int i = 0; i < 5; i++) {
            limiter.admit("0xA", T0);
        }
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.admit("0xA", T0.plusSeconds(30))).isFalse();
        }
        assertThat(limiter.admit("0xA", T0.plusSeconds(60))).isTrue();
    }

    @Test
    void windowRollsSoEntriesExactlyOneWindowOldNoLongerCount() {
        limiter.admit("0xA", T0);
        for (int i = 1; i < 5; i++) {
            limiter.admit("0xA", T0.plusSeconds(10));
        }
        assertThat(limiter.admit("0xA", T0.plusSeconds(59))).isFalse();
        assertThat(limiter.admit("0xA", T0.plusSeconds(60))).isTrue();
        assertThat(limiter.admit("0xA", T0.plusSeconds(60))).isFalse();
    }

    @Test
    void identitiesAreIndependent() {
        for (int i = 0; i < 5; i++) {
            limiter.admit("0xA", T0);
        }
        assertThat(limiter.admit("0xA", T0)).isFalse();
        assertThat(limiter.admit("0xB", T0)).isTrue();
    }

    @Test
    void concurrentCallsForOneIdentityNeverExceedTheBudget() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                calls.add(() -> limiter.admit("0xA", T0));
            }
            int admitted = 0;
            for (Future<Boolean> f : pool.invokeAll(calls)) {
                if (f.get()) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(5);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void countingWhileAdmittingTheSameIdentityIsSafe() throws Exception {
        SlidingWindowRateLimiter busy = new SlidingWindowRateLimiter("busy", 50, Duration.ofMillis(20), clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Integer>> calls = new ArrayList<>();
            for (int i = 0; i < 2000; i++) {
                Instant at = T0.plusMillis(i);
                if (i % 2 == 0) {
                    calls.add(() -> busy.admit("0xA", at) ? 1 : 0);
                } else {
                    calls.add(() -> busy.currentCount("0xA", at));
                }
            }
            for (Future<Integer> f : pool.invokeAll(calls)) {
                assertThat(f.get()).isBetween(0, 50);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void evictExpiredDropsIdleIdentities() {
        limiter.admit("0xA", T0);
        limiter.admit("0xB", T0.plusSeconds(30));

        assertThat(limiter.evictExpired(T0.plusSeconds(61))).isEqualTo(1);
        assertThat(limiter.currentCount("0xA", T0.plusSeconds(61))).isZero();
        assertThat(limiter.currentCount("0xB", T0.plusSeconds(61))).isEqualTo(1);
    }

    @Test
    void rejectsBlankIdentityAndBadConfiguration() {
        assertThatThrownBy(() -> limiter.admit(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SlidingWindowRateLimiter("x", 0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SlidingWindowRateLimiter("x", 1, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
