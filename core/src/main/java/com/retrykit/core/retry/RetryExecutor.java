package com.retrykit.core.retry;

import com.retrykit.core.api.IRetryExecutor;
import com.retrykit.core.api.RetryListener;
import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.cancel.CancellationToken;
import com.retrykit.core.config.RetryConfig;
import com.retrykit.core.model.RetryFailure;
import com.retrykit.core.model.RetryResult;
import com.retrykit.core.util.DefaultSleeper;
import com.retrykit.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 동기식 재시도 실행기.
 * <ul>
 *   <li>호출 스레드에서 operation/predicate를 순서대로 실행 (병렬 시도 없음)</li>
 *   <li>시도 사이에 {@link BackoffPolicy} 지연만큼 취소 가능 대기</li>
 *   <li>종결 오류/소진/취소는 {@link RetryResult} 실패 값으로 반환</li>
 * </ul>
 * 실행기 자체는 호출 간 상태가 없다. 같은 인스턴스를 여러 스레드에서 써도 되지만
 * BackoffPolicy는 시퀀스마다 따로 두는 것을 권장.
 */
public final class RetryExecutor implements IRetryExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

    private final InterruptibleSleep sleep;
    private final RetryListener listener;

    /** 기본: Thread.sleep, 10ms tick, 리스너 없음 */
    public RetryExecutor() {
        this(DefaultSleeper.INSTANCE);
    }

    /** 테스트/주입용 */
    public RetryExecutor(Sleeper sleeper) {
        this(sleeper, InterruptibleSleep.DEFAULT_TICK, RetryListener.NOOP);
    }

    public RetryExecutor(Sleeper sleeper, Duration tick, RetryListener listener) {
        this.sleep = new InterruptibleSleep(sleeper, tick);
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /** 설정의 tick 간격을 쓰는 실행기 */
    public static RetryExecutor fromConfig(RetryConfig config, RetryListener listener) {
        Objects.requireNonNull(config, "config").validate();
        return new RetryExecutor(DefaultSleeper.INSTANCE, config.getTickInterval(), listener);
    }

    /** RetryConfig의 maxAttempts와 새 BackoffPolicy로 실행 */
    public <T> RetryResult<T> run(Callable<? extends T> operation,
                                  Predicate<? super T> resultPredicate,
                                  Predicate<? super Exception> exceptionPredicate,
                                  RetryConfig config,
                                  CancellationToken cancellationToken) {
        Objects.requireNonNull(config, "config").validate();
        return run(operation, resultPredicate, exceptionPredicate,
                config.getMaxAttempts(), config.toBackoffPolicy(), cancellationToken);
    }

    @Override
    public <T> RetryResult<T> run(Callable<? extends T> operation,
                                  Predicate<? super T> resultPredicate,
                                  Predicate<? super Exception> exceptionPredicate,
                                  int maxAttempts,
                                  BackoffPolicy backoffPolicy,
                                  CancellationToken cancellationToken) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(resultPredicate, "resultPredicate");
        Objects.requireNonNull(exceptionPredicate, "exceptionPredicate");
        Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        Objects.requireNonNull(cancellationToken, "cancellationToken");

        RetryResult<T> result = loop(operation, resultPredicate, exceptionPredicate,
                maxAttempts, backoffPolicy, cancellationToken);
        if (result.isFailure()) {
            LOG.debug("retry finished: {}", result.getFailure());
        }
        listener.onFinished(result);
        return result;
    }

    private <T> RetryResult<T> loop(Callable<? extends T> operation,
                                    Predicate<? super T> resultPredicate,
                                    Predicate<? super Exception> exceptionPredicate,
                                    int maxAttempts,
                                    BackoffPolicy backoffPolicy,
                                    CancellationToken token) {
        int attempts = 0;
        for (int i = 0; i < maxAttempts; i++) {
            if (i > 0) {
                Duration delay = backoffPolicy.getDelay(i);
                LOG.debug("backoff before attempt {}/{}: {}ms", i + 1, maxAttempts, delay.toMillis());
                listener.onBackoff(i, delay);
                try {
                    if (sleep.sleep(delay, token)) {
                        return RetryResult.failure(RetryFailure.cancelled(attempts));
                    }
                } catch (InterruptedException ie) {
                    // 인터럽트는 취소로 취급, 플래그 복원
                    Thread.currentThread().interrupt();
                    LOG.debug("backoff interrupted before attempt {}", i + 1);
                    return RetryResult.failure(RetryFailure.cancelled(attempts));
                }
            }

            attempts++;
            T value;
            try {
                value = operation.call();
            } catch (Exception e) {
                boolean interrupted = e instanceof InterruptedException;
                if (interrupted) Thread.currentThread().interrupt(); // 플래그 복원
                // predicate 자체가 던진 예외는 분류하지 않고 그대로 전파
                if (!exceptionPredicate.test(e)) {
                    return RetryResult.failure(RetryFailure.terminal(e, attempts));
                }
                if (interrupted) {
                    // 재시도 대상이라도 인터럽트된 스레드에서는 더 시도하지 않음
                    LOG.debug("attempt {}/{} interrupted, stopping", attempts, maxAttempts);
                    return RetryResult.failure(RetryFailure.cancelled(attempts));
                }
                LOG.debug("attempt {}/{} failed with retryable exception: {}", attempts, maxAttempts, e.toString());
                listener.onRetryableException(attempts, e);
                continue;
            }

            if (!resultPredicate.test(value)) {
                return RetryResult.success(value, attempts);
            }
            LOG.debug("attempt {}/{} returned retryable result", attempts, maxAttempts);
            listener.onRetryableResult(attempts, value);
        }
        return RetryResult.failure(RetryFailure.exhausted(maxAttempts, attempts));
    }
}
