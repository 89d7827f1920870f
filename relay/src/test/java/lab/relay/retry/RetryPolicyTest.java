package lab.relay.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void fixedPolicyWaitsBaseDelayEveryTime() {
        RetryPolicy policy = RetryPolicy.fixed(5, Duration.ofSeconds(1));

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayAfter(4)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void exponentialPolicyDoublesUpToTheCap() {
        RetryPolicy policy = RetryPolicy.exponential(10, Duration.ofSeconds(1), Duration.ofSeconds(10));

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayAfter(5)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delayAfter(60)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void missingBackoffDefaultsToFixed() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(2), null, null);

        assertThat(policy.backoff()).isEqualTo(BackoffMode.FIXED);
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void rejectsEmptyBudget() {
        assertThatThrownBy(() -> RetryPolicy.fixed(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
