package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.protection.TimeoutPolicy;

import java.util.concurrent.Callable;

/**
 * Timeout Policy NoOp 구현.
 *
 * <p>마감 시간을 적용하지 않고 호출 스레드에서 함수를 직접 실행합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpTimeoutPolicy implements TimeoutPolicy {

    @Override
    public <T> T execute(Callable<T> call, long timeoutMs, String operation) throws Exception {
        return call.call();
    }
}
