package com.retrykit.core.config;

import com.retrykit.core.backoff.BackoffPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryConfigTest {

    @Test
    void defaultsAreValid() {
        RetryConfig cfg = RetryConfig.defaults();
        cfg.validate();

        assertThat(cfg.getMaxAttempts()).isEqualTo(5);
        assertThat(cfg.getInitialDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(cfg.getMultiplier()).isEqualTo(2.0);
        assertThat(cfg.getMaxDelay()).isEqualTo(Duration.ofMinutes(5));
        assertThat(cfg.getTickInterval()).isEqualTo(Duration.ofMillis(10));
    }

    @Test
    void toBackoffPolicyCopiesTiming() {
        BackoffPolicy p = RetryConfig.defaults()
                .setInitialDelayMs(200)
                .setMultiplier(3.0)
                .setMaxDelayMs(5_000)
                .toBackoffPolicy();

        assertThat(p.getInitialDelay()).isEqualTo(Duration.ofMillis(200));
        assertThat(p.getMultiplier()).isEqualTo(3.0);
        assertThat(p.getMaxDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(p.ceiling(3)).isEqualTo(Duration.ofMillis(1_800));
    }

    @Test
    void validateRejectsNonPositiveAttempts() {
        RetryConfig cfg = RetryConfig.defaults().setMaxAttempts(0);
        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAttempts must be >= 1");
    }

    @Test
    void validateRejectsNegativeDelaysAndZeroTick() {
        assertThatThrownBy(RetryConfig.defaults().setInitialDelayMs(-1)::validate)
                .hasMessageContaining("initialDelay");
        assertThatThrownBy(RetryConfig.defaults().setMaxDelayMs(-1)::validate)
                .hasMessageContaining("maxDelay");
        assertThatThrownBy(RetryConfig.defaults().setTickIntervalMs(0)::validate)
                .hasMessageContaining("tickInterval");
        assertThatThrownBy(RetryConfig.defaults().setMultiplier(Double.POSITIVE_INFINITY)::validate)
                .hasMessageContaining("multiplier");
    }

    @Test
    void validateRequiresDurations() {
        assertThatThrownBy(RetryConfig.defaults().setMaxDelay(null)::validate)
                .isInstanceOf(NullPointerException.class);
    }
}
