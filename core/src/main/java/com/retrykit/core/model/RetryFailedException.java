package com.retrykit.core.model;

import java.util.Objects;

/** {@link RetryResult#getOrThrow()}를 선택한 호출자용 비검사 예외 */
public class RetryFailedException extends RuntimeException {
    private final RetryFailure failure;

    public RetryFailedException(RetryFailure failure) {
        super(Objects.requireNonNull(failure, "failure").getMessage(), failure.getCause().orElse(null));
        this.failure = failure;
    }

    public RetryFailure getFailure() { return failure; }
}
