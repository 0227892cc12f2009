package com.retrykit.core.backoff;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * 지수 백오프 + Full Jitter 정책.
 * <p>
 * attempt N(1부터)의 상한(ceiling)은 initialDelay에 multiplier를 N-1번 곱한 값이며,
 * 곱할 때마다 maxDelay로 잘라낸다. 실제 지연은 [0, ceiling] 균등 분포.
 * 예) 기본값: 1s → 2s → 4s → 8s → 16s ... 최대 5분
 * </p>
 * 난수 생성기는 정책 인스턴스가 소유하며 호출마다 상태가 전진한다.
 * 한 번에 하나의 재시도 시퀀스에서만 쓰는 것을 전제로 한다.
 */
public final class BackoffPolicy {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(5);

    private final long initialDelayMs;
    private final double multiplier;
    private final long maxDelayMs;

    private final Random random; // guarded by itself

    public BackoffPolicy() {
        this(DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY);
    }

    public BackoffPolicy(Duration initialDelay, double multiplier, Duration maxDelay) {
        this(initialDelay, multiplier, maxDelay, new Random(new SecureRandom().nextLong()));
    }

    /** 테스트용: 시드 고정 난수 주입 */
    public BackoffPolicy(Duration initialDelay, double multiplier, Duration maxDelay, Random random) {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay must be >= 0: " + initialDelay);
        if (maxDelay.isNegative()) throw new IllegalArgumentException("maxDelay must be >= 0: " + maxDelay);
        if (Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be finite: " + multiplier);
        }
        this.initialDelayMs = toMillisSaturated(initialDelay);
        this.multiplier = multiplier;
        this.maxDelayMs = toMillisSaturated(maxDelay);
        this.random = Objects.requireNonNull(random, "random");
    }

    public Duration getInitialDelay() { return Duration.ofMillis(initialDelayMs); }
    public double getMultiplier() { return multiplier; }
    public Duration getMaxDelay() { return Duration.ofMillis(maxDelayMs); }

    /**
     * attempt에 대한 지터 적용 전 상한.
     * 단계마다 maxDelay로 캡을 씌우므로 중간 오버플로가 상한을 넘지 않는다.
     */
    public Duration ceiling(int attempt) {
        return Duration.ofMillis(ceilingMillis(attempt));
    }

    /**
     * attempt(1부터)에 대한 무작위 지연. 결과는 [0, ceiling(attempt)] 범위이며 0일 수 있다.
     * 1 미만의 attempt는 1로 취급.
     */
    public Duration getDelay(int attempt) {
        long ceiling = ceilingMillis(attempt);
        if (ceiling == 0) return Duration.ZERO;
        long jittered;
        synchronized (random) {
            jittered = (ceiling == Long.MAX_VALUE)
                    ? (random.nextLong() & Long.MAX_VALUE)
                    : random.nextLong(ceiling + 1); // 상한 포함
        }
        return Duration.ofMillis(jittered);
    }

    private long ceilingMillis(int attempt) {
        // 누적값은 double로 유지, 반환 시 한 번만 절삭 (소수 배수가 정체되지 않도록)
        double max = maxDelayMs;
        double current = Math.min(initialDelayMs, maxDelayMs);
        for (int i = 0; i < attempt - 1; i++) {
            if (current == 0) break;
            double next = Math.max(0.0, Math.min(current * multiplier, max));
            // 상한 도달 또는 multiplier == 1.0 → 더 곱해도 변하지 않음
            if (next == current) break;
            current = next;
        }
        // (long) 캐스트는 Long.MAX_VALUE에서 포화
        return (long) current;
    }

    private static long toMillisSaturated(Duration d) {
        try {
            return d.toMillis();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    @Override public String toString() {
        return "BackoffPolicy{initialDelay=" + initialDelayMs + "ms, multiplier=" + multiplier
                + ", maxDelay=" + maxDelayMs + "ms}";
    }
}
