package com.retrykit.core.api;

import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.cancel.CancellationToken;
import com.retrykit.core.model.RetryResult;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 재시도 실행 최소 계약.
 * resultPredicate / exceptionPredicate 모두 true = 재시도, false = 즉시 종료(수락 또는 종결 오류).
 * 실패는 예외가 아니라 {@link RetryResult}로 돌려준다.
 */
public interface IRetryExecutor {

    int DEFAULT_MAX_ATTEMPTS = 5;

    <T> RetryResult<T> run(Callable<? extends T> operation,
                           Predicate<? super T> resultPredicate,
                           Predicate<? super Exception> exceptionPredicate,
                           int maxAttempts,
                           BackoffPolicy backoffPolicy,
                           CancellationToken cancellationToken);

    default <T> RetryResult<T> run(Callable<? extends T> operation,
                                   Predicate<? super T> resultPredicate,
                                   Predicate<? super Exception> exceptionPredicate,
                                   int maxAttempts,
                                   BackoffPolicy backoffPolicy) {
        return run(operation, resultPredicate, exceptionPredicate, maxAttempts, backoffPolicy, CancellationToken.none());
    }

    default <T> RetryResult<T> run(Callable<? extends T> operation,
                                   Predicate<? super T> resultPredicate,
                                   Predicate<? super Exception> exceptionPredicate,
                                   int maxAttempts) {
        return run(operation, resultPredicate, exceptionPredicate, maxAttempts, new BackoffPolicy());
    }

    default <T> RetryResult<T> run(Callable<? extends T> operation,
                                   Predicate<? super T> resultPredicate,
                                   Predicate<? super Exception> exceptionPredicate) {
        return run(operation, resultPredicate, exceptionPredicate, DEFAULT_MAX_ATTEMPTS);
    }
}
