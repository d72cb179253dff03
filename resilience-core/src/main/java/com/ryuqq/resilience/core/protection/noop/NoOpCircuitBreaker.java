package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;
import com.ryuqq.resilience.core.protection.CircuitPermit;

import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * Circuit Breaker가 비활성화된 경우 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>execute(): 타임아웃 없이 함수를 직접 호출</li>
 *   <li>tryAcquire(): 항상 일반 토큰으로 허용</li>
 *   <li>recordSuccess() / recordFailure() / releasePermission(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>reset(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;
    private final Instant createdAt = Instant.now();

    public NoOpCircuitBreaker(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public <T> T execute(Callable<T> call) throws Exception {
        return call.call();
    }

    @Override
    public CircuitPermit tryAcquire() {
        return CircuitPermit.STANDARD;
    }

    @Override
    public void recordSuccess(CircuitPermit permit) {
        // NoOp
    }

    @Override
    public void recordFailure(CircuitPermit permit, Throwable throwable) {
        // NoOp
    }

    @Override
    public void releasePermission(CircuitPermit permit) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(CircuitBreakerState.CLOSED, 0, 0, 0, null, createdAt);
    }

    @Override
    public void reset() {
        // NoOp
    }
}
