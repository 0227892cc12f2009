package com.retrykit.core.retry;

import com.retrykit.core.api.RetryListener;
import com.retrykit.core.model.RetryResult;

import java.time.Duration;
import java.util.Objects;

/** 재시도 횟수/예약된 백오프 합계를 집계하는 얇은 데코레이터. (per-call 사용 권장) */
public final class CountingRetryListener implements RetryListener {
    private final RetryListener delegate;
    private int retryableResults = 0;
    private int retryableExceptions = 0;
    private int backoffs = 0;
    private Duration totalBackoff = Duration.ZERO;

    public CountingRetryListener() { this(RetryListener.NOOP); }

    public CountingRetryListener(RetryListener delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override public void onRetryableResult(int attempt, Object result) {
        retryableResults++;
        delegate.onRetryableResult(attempt, result);
    }

    @Override public void onRetryableException(int attempt, Exception error) {
        retryableExceptions++;
        delegate.onRetryableException(attempt, error);
    }

    @Override public void onBackoff(int retry, Duration delay) {
        backoffs++;
        totalBackoff = totalBackoff.plus(delay);
        delegate.onBackoff(retry, delay);
    }

    @Override public void onFinished(RetryResult<?> result) {
        delegate.onFinished(result);
    }

    public int getRetryableResults() { return retryableResults; }
    public int getRetryableExceptions() { return retryableExceptions; }
    /** 실제 시작된 백오프(대기) 횟수 */
    public int getBackoffCount() { return backoffs; }
    /** 예약된 지연 합계(취소로 잘린 대기도 전체 값으로 계산) */
    public Duration getTotalBackoff() { return totalBackoff; }
}
