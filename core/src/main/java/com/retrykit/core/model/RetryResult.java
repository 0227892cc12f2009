package com.retrykit.core.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * 재시도 최종 결과. 성공 값 또는 {@link RetryFailure} 중 정확히 하나를 가진다.
 * 성공 값은 null일 수 있다(operation이 null을 돌려주고 수락된 경우).
 */
public final class RetryResult<T> {
    private final T value;
    private final RetryFailure failure;
    private final int attempts;

    private RetryResult(T value, RetryFailure failure, int attempts) {
        this.value = value;
        this.failure = failure;
        this.attempts = attempts;
    }

    public static <T> RetryResult<T> success(T value, int attempts) {
        return new RetryResult<>(value, null, attempts);
    }

    public static <T> RetryResult<T> failure(RetryFailure failure) {
        Objects.requireNonNull(failure, "failure");
        return new RetryResult<>(null, failure, failure.getAttempts());
    }

    public boolean isSuccess() { return failure == null; }
    public boolean isFailure() { return failure != null; }

    /** operation 호출 횟수 */
    public int attempts() { return attempts; }

    public T getValue() {
        if (failure != null) throw new IllegalStateException("no value: " + failure.getMessage());
        return value;
    }

    public RetryFailure getFailure() {
        if (failure == null) throw new NoSuchElementException("result is a success");
        return failure;
    }

    public T orElse(T other) {
        return failure == null ? value : other;
    }

    public T getOrThrow() {
        if (failure != null) throw new RetryFailedException(failure);
        return value;
    }

    public <R> RetryResult<R> map(Function<? super T, ? extends R> fn) {
        Objects.requireNonNull(fn, "fn");
        if (failure != null) return new RetryResult<>(null, failure, attempts);
        return new RetryResult<>(fn.apply(value), null, attempts);
    }

    @Override public String toString() {
        return failure == null
                ? "RetryResult.success(" + value + ", attempts=" + attempts + ")"
                : "RetryResult.failure(" + failure + ")";
    }
}
