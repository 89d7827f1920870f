package lab.relay.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class RateLimitConfig {

    // Strict limiter for chain-initiating calls, keyed by the transfer's source identity.
    @Bean
    public SlidingWindowRateLimiter transferRateLimiter(
            @Value("${relay.rate-limit.transfer.max-requests:5}") int maxRequests,
            @Value("${relay.rate-limit.transfer.window:60s}") Duration window,
            Clock clock) {
        return new SlidingWindowRateLimiter("transfer", maxRequests, window, clock);
    }

    // Looser limiter applied to every HTTP route, keyed by client address.
    @Bean
    public SlidingWindowRateLimiter apiRateLimiter(
            @Value("${relay.rate-limit.api.max-requests:100}") int maxRequests,
            @Value("${relay.rate-limit.api.window:15m}") Duration window,
            Clock clock) {
        return new SlidingWindowRateLimiter("api", maxRequests, window, clock);
    }
}
