package com.umitunal.jobqueue.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    @DisplayName("Should double the delay per failure up to the cap")
    void testExponential() {
        // Given
        BackoffPolicy policy = BackoffPolicy.exponential();

        // Then
        assertThat(policy.retryInterval(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.retryInterval(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.retryInterval(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.retryInterval(5)).isEqualTo(Duration.ofMillis(1600));
        assertThat(policy.retryInterval(30)).isEqualTo(Duration.ofMinutes(15));
        assertThat(policy.retryInterval(Long.MAX_VALUE)).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    @DisplayName("Should honor custom bounds")
    void testCustomBounds() {
        BackoffPolicy policy = BackoffPolicy.exponential(Duration.ofSeconds(2), Duration.ofSeconds(5));

        assertThat(policy.retryInterval(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.retryInterval(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.retryInterval(3)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should reject inverted or negative bounds")
    void testInvalidBounds() {
        assertThatThrownBy(() -> BackoffPolicy.exponential(Duration.ofSeconds(5), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffPolicy.fixed(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
