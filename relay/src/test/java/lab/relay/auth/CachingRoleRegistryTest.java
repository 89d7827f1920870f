package lab.relay.auth;

import lab.relay.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class CachingRoleRegistryTest {

    private final RoleRegistry delegate = mock(RoleRegistry.class);
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final CachingRoleRegistry registry = new CachingRoleRegistry(delegate, Duration.ofMinutes(5), 100, clock);

    @Test
    void reusesLookupWithinTtlIgnoringAddressCase() {
        when(delegate.hasRole("0xAbC", "ADMIN")).thenReturn(true);

        assertThat(registry.hasRole("0xAbC", "ADMIN")).isTrue();
        assertThat(registry.hasRole("0xabc", "admin")).isTrue();

        verify(delegate, times(1)).hasRole(anyString(), anyString());
    }

    @Test
    void refreshesAfterTtl() {
        when(delegate.hasRole("0xabc", "ADMIN")).thenReturn(true, false);

        assertThat(registry.hasRole("0xabc", "ADMIN")).isTrue();
        clock.advance(Duration.ofMinutes(5));
        assertThat(registry.hasRole("0xabc", "ADMIN")).isFalse();
    }

    @Test
    void failedLookupsAreNotCached() {
        when(delegate.hasRole("0xabc", "ADMIN")).thenThrow(new IllegalStateException("rpc down")).thenReturn(true);

        assertThatThrownBy(() -> registry.hasRole("0xabc", "ADMIN")).isInstanceOf(IllegalStateException.class);
        assertThat(registry.hasRole("0xabc", "ADMIN")).isTrue();
    }

    @Test
    void invalidateAllForcesFreshLookup() {
        when(delegate.hasRole("0xabc", "ADMIN")).thenReturn(true, false);

        registry.hasRole("0xabc", "ADMIN");
        registry.invalidateAll();

        assertThat(registry.hasRole("0xabc", "ADMIN")).isFalse();
    }

    @Test
    void evictExpiredDropsStaleLookups() {
        when(delegate.hasRole(anyString(), eq("ADMIN"))).thenReturn(false);
        registry.hasRole("0x01", "ADMIN");
        clock.advance(Duration.ofMinutes(3));
        registry.hasRole("0x02", "ADMIN");

        clock.advance(Duration.ofMinutes(2));

        assertThat(registry.evictExpired(clock.instant())).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
        clock.advance(Duration.ofMinutes(3));
        assertThat(registry.evictExpired(clock.instant())).isEqualTo(1);
        assertThat(registry.size()).isZero();
    }

    @Test
    void cacheStaysBoundedUnderManyDistinctSigners() {
        CachingRoleRegistry small = new CachingRoleRegistry(delegate, Duration.ofMinutes(5), 3, clock);
        when(delegate.hasRole(anyString(), eq("ADMIN"))).thenReturn(false);

        for (int i = 0; i < 50; i++) {
            assertThat(small.hasRole("0xforged" + i, "ADMIN")).isFalse();
        }
        assertThat(small.size()).isEqualTo(3);

        clock.advance(Duration.ofMinutes(5));
        small.hasRole("0xlater", "ADMIN");
        assertThat(small.size()).isEqualTo(1);
    }
}
