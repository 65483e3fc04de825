package io.github.umputun.beacon;

import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.errors.CancelledError;
import io.github.umputun.beacon.errors.ConnectionError;
import io.github.umputun.beacon.errors.DecodingError;
import io.github.umputun.beacon.errors.ForbiddenError;
import io.github.umputun.beacon.errors.HttpStatusError;
import io.github.umputun.beacon.errors.UnauthorizedError;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectPolicyTest {

    @Test
    void exponentialDoublesUpToCap() {
        ReconnectPolicy policy = ReconnectPolicy.builder(ReconnectPolicy.Kind.EXPONENTIAL)
                .random(() -> 0.5)
                .build();

        assertThat(policy.nextDelay(0)).isEqualTo(Duration.ofMillis(2500));
        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofMillis(4500));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofMillis(8500));
        assertThat(policy.nextDelay(7)).isEqualTo(Duration.ofMillis(150500));
        assertThat(policy.nextDelay(1000)).isEqualTo(Duration.ofMillis(150500));
    }

    @Test
    void largeBaseDelaySaturatesAtCap() {
        Duration base = Duration.ofMillis(Long.MAX_VALUE / 4);
        Duration cap = Duration.ofMillis(Long.MAX_VALUE / 2);
        ReconnectPolicy policy = ReconnectPolicy.builder(ReconnectPolicy.Kind.EXPONENTIAL)
                .baseDelay(base)
                .maxDelay(cap)
                .jitter(Duration.ZERO)
                .build();

        assertThat(policy.nextDelay(0)).isEqualTo(base);
        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofMillis(base.toMillis() * 2));
        for (int attempt = 2; attempt < 40; attempt++) {
            assertThat(policy.nextDelay(attempt)).isEqualTo(cap);
        }
    }

    @Test
    void linearKeepsBaseDelay() {
        ReconnectPolicy policy = ReconnectPolicy.builder(ReconnectPolicy.Kind.LINEAR)
                .random(() -> 0.5)
                .build();

        assertThat(policy.nextDelay(0)).isEqualTo(Duration.ofMillis(2500));
        assertThat(policy.nextDelay(5)).isEqualTo(Duration.ofMillis(2500));
    }

    @Test
    void jitterStaysInRange() {
        ReconnectPolicy policy = ReconnectPolicy.linear();
        for (int i = 0; i < 50; i++) {
            assertThat(policy.nextDelay(i)).isBetween(Duration.ofSeconds(2), Duration.ofSeconds(3));
        }
    }

    @Test
    void noneNeverRetries() {
        ReconnectPolicy policy = ReconnectPolicy.none();

        assertThat(policy.shouldRetry(new ConnectionError("down"))).isFalse();
        assertThat(policy.canRetry(0)).isFalse();
        assertThat(policy.nextDelay(0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void retryLimit() {
        ReconnectPolicy policy = ReconnectPolicy.exponential();

        assertThat(policy.getRetryLimit()).isEqualTo(6);
        assertThat(policy.canRetry(0)).isTrue();
        assertThat(policy.canRetry(5)).isTrue();
        assertThat(policy.canRetry(6)).isFalse();
    }

    @Test
    void classifiesFailures() {
        ReconnectPolicy policy = ReconnectPolicy.exponential();

        assertThat(policy.shouldRetry(new ConnectionError("refused"))).isTrue();
        assertThat(policy.shouldRetry(new HttpStatusError(500, ""))).isTrue();
        assertThat(policy.shouldRetry(new HttpStatusError(503, ""))).isTrue();
        assertThat(policy.shouldRetry(new HttpStatusError(429, ""))).isTrue();

        assertThat(policy.shouldRetry(new HttpStatusError(400, ""))).isFalse();
        assertThat(policy.shouldRetry(new HttpStatusError(414, ""))).isFalse();
        assertThat(policy.shouldRetry(new UnauthorizedError())).isFalse();
        assertThat(policy.shouldRetry(new ForbiddenError("chat", ""))).isFalse();
        assertThat(policy.shouldRetry(new DecodingError("bad json"))).isFalse();
        assertThat(policy.shouldRetry(new CancelledError("cancelled", null))).isFalse();
        assertThat(policy.shouldRetry(new BeaconException("other"))).isFalse();
    }

    @Test
    void builderValidation() {
        assertThatThrownBy(() -> ReconnectPolicy.builder(ReconnectPolicy.Kind.LINEAR)
                .baseDelay(Duration.ofSeconds(10))
                .maxDelay(Duration.ofSeconds(5))
                .build())
                .isInstanceOf(BeaconException.class)
                .hasMessageContaining("maxDelay");

        assertThatThrownBy(() -> ReconnectPolicy.builder(ReconnectPolicy.Kind.LINEAR).jitter(Duration.ofMillis(-1)))
                .isInstanceOf(BeaconException.class);
        assertThatThrownBy(() -> ReconnectPolicy.builder(ReconnectPolicy.Kind.LINEAR).retryLimit(-1))
                .isInstanceOf(BeaconException.class);
        assertThatThrownBy(() -> ReconnectPolicy.builder(null))
                .isInstanceOf(NullPointerException.class);
    }
}
