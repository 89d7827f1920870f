package lab.relay.retry;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RetryConfig {

    @Bean
    public RetryExecutor retryExecutor() {
        return new RetryExecutor(Sleeper.THREAD);
    }

    // Chain submission policy: three attempts one second apart unless exponential backoff is opted into.
    @Bean
    public RetryPolicy submissionRetryPolicy(
            @Value("${relay.retry.max-attempts:3}") int maxAttempts,
            @Value("${relay.retry.base-delay:1s}") Duration baseDelay,
            @Value("${relay.retry.backoff:FIXED}") BackoffMode backoff,
            @Value("${relay.retry.max-delay:30s}") Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, backoff, maxDelay);
    }
}
