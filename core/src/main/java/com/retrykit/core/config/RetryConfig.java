package com.retrykit.core.config;

import com.retrykit.core.api.IRetryExecutor;
import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.retry.InterruptibleSleep;

import java.time.Duration;
import java.util.Objects;

/**
 * 재시도 설정 (retry.yml 매핑 대상). 순수 설정 보관용.
 * 실제 정책 객체는 {@link #toBackoffPolicy()}로 호출마다 새로 만든다.
 */
public final class RetryConfig {

    private int maxAttempts = IRetryExecutor.DEFAULT_MAX_ATTEMPTS;
    private Duration initialDelay = BackoffPolicy.DEFAULT_INITIAL_DELAY;
    private double multiplier = BackoffPolicy.DEFAULT_MULTIPLIER;
    private Duration maxDelay = BackoffPolicy.DEFAULT_MAX_DELAY;
    private Duration tickInterval = InterruptibleSleep.DEFAULT_TICK; // 취소 확인 주기

    public static RetryConfig defaults() { return new RetryConfig(); }

    // ---------- getters ----------
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getInitialDelay() { return initialDelay; }
    public double getMultiplier() { return multiplier; }
    public Duration getMaxDelay() { return maxDelay; }
    public Duration getTickInterval() { return tickInterval; }

    // ---------- fluent setters ----------
    public RetryConfig setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; return this; }
    public RetryConfig setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; return this; }
    public RetryConfig setMultiplier(double multiplier) { this.multiplier = multiplier; return this; }
    public RetryConfig setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; return this; }
    public RetryConfig setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; return this; }

    public RetryConfig setInitialDelayMs(long ms) { return setInitialDelay(Duration.ofMillis(ms)); }
    public RetryConfig setMaxDelayMs(long ms) { return setMaxDelay(Duration.ofMillis(ms)); }
    public RetryConfig setTickIntervalMs(long ms) { return setTickInterval(Duration.ofMillis(ms)); }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(tickInterval, "tickInterval");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay must be >= 0");
        if (maxDelay.isNegative()) throw new IllegalArgumentException("maxDelay must be >= 0");
        if (Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be finite");
        }
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be > 0");
        }
    }

    public BackoffPolicy toBackoffPolicy() {
        return new BackoffPolicy(initialDelay, multiplier, maxDelay);
    }

    @Override public String toString() {
        return "RetryConfig{maxAttempts=" + maxAttempts
                + ", initialDelay=" + initialDelay.toMillis() + "ms"
                + ", multiplier=" + multiplier
                + ", maxDelay=" + maxDelay.toMillis() + "ms"
                + ", tickInterval=" + tickInterval.toMillis() + "ms}";
    }
}
