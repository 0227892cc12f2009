package com.retrykit.core.cancel;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 협조적 취소 신호(읽기 전용).
 * - {@link #none()}: 소스와 연결되지 않은 토큰, 절대 취소되지 않음
 * - {@link CancellationSource#token()}: 소스 플래그를 관찰
 */
public final class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken(null);

    private final AtomicBoolean flag; // null이면 미연결

    CancellationToken(AtomicBoolean flag) {
        this.flag = flag;
    }

    public static CancellationToken none() { return NONE; }

    /** 소스와 연결되어 있으면 true */
    public boolean isStopPossible() { return flag != null; }

    /** 현재 취소 요청 여부 */
    public boolean isStopRequested() { return flag != null && flag.get(); }

    @Override public String toString() {
        if (flag == null) return "CancellationToken[none]";
        return "CancellationToken[stopRequested=" + flag.get() + "]";
    }
}
