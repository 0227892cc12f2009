package com.retrykit.core.model;

import java.util.Objects;
import java.util.Optional;

/** 재시도 실패 기술자: 종류 + 사람이 읽을 메시지 (+ 종결 예외 원인) */
public final class RetryFailure {

    public enum Kind { CANCELLED, TERMINAL_ERROR, ATTEMPTS_EXHAUSTED }

    static final String CANCELLED_MESSAGE = "Retry operation was cancelled during backoff.";

    private final Kind kind;
    private final String message;
    private final int attempts;
    private final Exception cause;

    private RetryFailure(Kind kind, String message, int attempts, Exception cause) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.attempts = attempts;
        this.cause = cause;
    }

    public static RetryFailure cancelled(int attempts) {
        return new RetryFailure(Kind.CANCELLED, CANCELLED_MESSAGE, attempts, null);
    }

    public static RetryFailure terminal(Exception cause, int attempts) {
        Objects.requireNonNull(cause, "cause");
        return new RetryFailure(Kind.TERMINAL_ERROR,
                "Retry failed with exception: " + describe(cause), attempts, cause);
    }

    /** 메시지에는 실제 시도 수가 아니라 설정된 maxAttempts를 쓴다. */
    public static RetryFailure exhausted(int maxAttempts, int attempts) {
        return new RetryFailure(Kind.ATTEMPTS_EXHAUSTED,
                "Retry failed after " + maxAttempts + " attempts.", attempts, null);
    }

    /** 예외 설명: 메시지가 없으면 toString() */
    static String describe(Exception e) {
        String m = e.getMessage();
        return m != null ? m : e.toString();
    }

    public Kind getKind() { return kind; }
    public String getMessage() { return message; }
    /** 실제로 수행된 operation 호출 수 */
    public int getAttempts() { return attempts; }
    public Optional<Exception> getCause() { return Optional.ofNullable(cause); }

    @Override public String toString() {
        return "RetryFailure{" + kind + ", attempts=" + attempts + ", message='" + message + "'}";
    }
}
