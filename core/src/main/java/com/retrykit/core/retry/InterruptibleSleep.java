package com.retrykit.core.retry;

import com.retrykit.core.cancel.CancellationToken;
import com.retrykit.core.util.Sleeper;

import java.time.Duration;
import java.util.Objects;

/**
 * 취소 가능한 대기.
 * 토큰이 소스와 연결되지 않았으면 전체 시간을 한 번에 잔다.
 * 연결되어 있으면 tick 단위로 쪼개 자면서 매 tick 전에 취소 플래그를 확인한다
 * (취소 지연은 대략 tick 1회 이내).
 */
public final class InterruptibleSleep {

    public static final Duration DEFAULT_TICK = Duration.ofMillis(10);

    private final Sleeper sleeper;
    private final Duration tick;

    public InterruptibleSleep(Sleeper sleeper) {
        this(sleeper, DEFAULT_TICK);
    }

    public InterruptibleSleep(Sleeper sleeper, Duration tick) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        Objects.requireNonNull(tick, "tick");
        if (tick.isZero() || tick.isNegative()) throw new IllegalArgumentException("tick must be > 0: " + tick);
        this.tick = tick;
    }

    public Duration getTick() { return tick; }

    /**
     * @return 대기 중 취소가 관측되면 true
     * @throws InterruptedException 대기 스레드가 인터럽트된 경우
     */
    public boolean sleep(Duration duration, CancellationToken token) throws InterruptedException {
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(token, "token");

        if (!token.isStopPossible()) {
            if (!duration.isNegative() && !duration.isZero()) sleeper.sleep(duration);
            return false;
        }

        Duration remaining = duration;
        while (!remaining.isNegative() && !remaining.isZero() && !token.isStopRequested()) {
            Duration step = remaining.compareTo(tick) < 0 ? remaining : tick;
            sleeper.sleep(step);
            remaining = remaining.minus(step);
        }
        return token.isStopRequested();
    }
}
