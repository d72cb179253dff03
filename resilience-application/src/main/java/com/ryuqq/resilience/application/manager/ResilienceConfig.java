package com.ryuqq.resilience.application.manager;

import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;

/**
 * ResilienceManager 설정 (불변 record).
 *
 * <p>이름이 붙은 매니저 하나가 사용할 Circuit Breaker, Bulkhead 설정과 각 계층의 활성화 여부입니다.
 * 설정 로딩은 이 계층의 책임이 아니며, 완전히 해석된 값을 받습니다.</p>
 *
 * <p>타임아웃(timeoutMs)은 Circuit Breaker 설정에 속합니다. Circuit Breaker를 비활성화하면
 * 타임아웃도 적용되지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param circuitBreaker Circuit Breaker 설정
 * @param bulkhead Bulkhead 설정
 * @param circuitBreakerEnabled Circuit Breaker(및 타임아웃) 활성화 여부 (기본 true)
 * @param bulkheadEnabled Bulkhead 활성화 여부 (기본 true)
 */
public record ResilienceConfig(
    CircuitBreakerConfig circuitBreaker,
    BulkheadConfig bulkhead,
    boolean circuitBreakerEnabled,
    boolean bulkheadEnabled
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본 CircuitBreakerConfig, STANDARD 등급 BulkheadConfig, 두 계층 모두 활성화</p>
     */
    public ResilienceConfig() {
        this(new CircuitBreakerConfig(), new BulkheadConfig(), true, true);
    }

    /**
     * 두 계층을 모두 활성화한 설정 생성자.
     *
     * @param circuitBreaker Circuit Breaker 설정
     * @param bulkhead Bulkhead 설정
     */
    public ResilienceConfig(CircuitBreakerConfig circuitBreaker, BulkheadConfig bulkhead) {
        this(circuitBreaker, bulkhead, true, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 설정이 null인 경우
     */
    public ResilienceConfig {
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker config cannot be null");
        }
        if (bulkhead == null) {
            throw new IllegalArgumentException("bulkhead config cannot be null");
        }
    }

    public ResilienceConfig withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new ResilienceConfig(circuitBreaker, bulkhead, circuitBreakerEnabled, bulkheadEnabled);
    }

    public ResilienceConfig withBulkhead(BulkheadConfig bulkhead) {
        return new ResilienceConfig(circuitBreaker, bulkhead, circuitBreakerEnabled, bulkheadEnabled);
    }

    public ResilienceConfig withCircuitBreakerEnabled(boolean circuitBreakerEnabled) {
        return new ResilienceConfig(circuitBreaker, bulkhead, circuitBreakerEnabled, bulkheadEnabled);
    }

    public ResilienceConfig withBulkheadEnabled(boolean bulkheadEnabled) {
        return new ResilienceConfig(circuitBreaker, bulkhead, circuitBreakerEnabled, bulkheadEnabled);
    }
}
