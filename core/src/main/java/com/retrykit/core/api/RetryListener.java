package com.retrykit.core.api;

import com.retrykit.core.model.RetryResult;

import java.time.Duration;

/** 재시도 진행 관찰자. 모든 콜백은 run()을 호출한 스레드에서 순서대로 불린다. */
public interface RetryListener {

    RetryListener NOOP = new RetryListener() {};

    /** attempt(1부터)가 재시도 대상 결과를 돌려줬을 때 */
    default void onRetryableResult(int attempt, Object result) {}

    /** attempt(1부터)가 재시도 대상 예외를 던졌을 때 */
    default void onRetryableException(int attempt, Exception error) {}

    /** 다음 시도 전 대기 시작 직전. retry는 1부터. */
    default void onBackoff(int retry, Duration delay) {}

    default void onFinished(RetryResult<?> result) {}
}
