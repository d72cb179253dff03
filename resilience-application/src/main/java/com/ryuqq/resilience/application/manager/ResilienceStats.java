package com.ryuqq.resilience.application.manager;

import com.ryuqq.resilience.core.protection.BulkheadStats;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;

import java.time.Instant;

/**
 * ResilienceManager 통합 통계.
 *
 * <p>Circuit Breaker 통계 {state, failures, successes, rejections, lastStateChange}와
 * Bulkhead 통계 {activeCount, queueLength}의 합집합입니다.
 * 비활성화된 계층의 통계는 null입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param name 매니저 이름
 * @param circuitBreaker Circuit Breaker 통계 (비활성화 시 null)
 * @param bulkhead Bulkhead 통계 (비활성화 시 null)
 */
public record ResilienceStats(
    String name,
    CircuitBreakerStats circuitBreaker,
    BulkheadStats bulkhead
) {

    /**
     * Circuit Breaker 상태 (비활성화 시 CLOSED).
     */
    public CircuitBreakerState state() {
        return circuitBreaker == null ? CircuitBreakerState.CLOSED : circuitBreaker.state();
    }

    public int failures() {
        return circuitBreaker == null ? 0 : circuitBreaker.failures();
    }

    public long successes() {
        return circuitBreaker == null ? 0 : circuitBreaker.successes();
    }

    public long rejections() {
        return circuitBreaker == null ? 0 : circuitBreaker.rejections();
    }

    /**
     * 마지막 상태 변경 시각 (Circuit Breaker 비활성화 시 null).
     */
    public Instant lastStateChange() {
        return circuitBreaker == null ? null : circuitBreaker.lastStateChange();
    }

    public int activeCount() {
        return bulkhead == null ? 0 : bulkhead.activeCount();
    }

    public int queueLength() {
        return bulkhead == null ? 0 : bulkhead.queueLength();
    }
}
