package com.retrykit.core.cancel;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 취소 요청의 유일한 작성자(writer).
 * 여러 스레드의 여러 토큰이 같은 플래그를 읽기만 한다.
 */
public final class CancellationSource {
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /** 연결된 모든 토큰에 취소를 알린다. 여러 번 호출해도 무해. */
    public void requestStop() {
        stopped.set(true);
    }

    public boolean isStopRequested() {
        return stopped.get();
    }

    /** 이 소스를 관찰하는 토큰 발급 */
    public CancellationToken token() {
        return new CancellationToken(stopped);
    }
}
