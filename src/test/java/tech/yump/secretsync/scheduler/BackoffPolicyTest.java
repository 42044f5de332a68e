package tech.yump.secretsync.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(5), Duration.ofMinutes(5));

    @Test
    @DisplayName("delayFor: Doubles per failure up to the ceiling")
    void delayFor_doublesUpToCeiling() {
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofSeconds(40));
        assertThat(policy.delayFor(7)).isEqualTo(Duration.ofMinutes(5));
        assertThat(policy.delayFor(10_000)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Constructor: Should reject a non-positive base or a ceiling below the base")
    void constructor_validates() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(10), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
