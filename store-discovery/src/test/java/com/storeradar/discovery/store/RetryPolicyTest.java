package com.storeradar.discovery.store;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(Duration.ofHours(1), Duration.ofHours(24), 5);

    @Test
    void delayGrowsLinearlyUpToCeiling() {
        assertThat(policy.delayFor(0)).isEqualTo(Duration.ofHours(1));
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofHours(1));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofHours(3));
        assertThat(policy.delayFor(30)).isEqualTo(Duration.ofHours(24));
    }

    @Test
    void nextRetryAtAddsDelay() {
        Instant now = Instant.parse("2024-05-01T00:00:00Z");
        assertThat(policy.nextRetryAt(now, 2)).isEqualTo(Instant.parse("2024-05-01T02:00:00Z"));
    }

    @Test
    void exhaustedOnlyPastMaxRetries() {
        assertThat(policy.isExhausted(5)).isFalse();
        assertThat(policy.isExhausted(6)).isTrue();
    }
}
