package com.ryuqq.resilience.application.manager;

import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;

/**
 * 보호 컴포넌트 생성 SPI.
 *
 * <p>application 계층은 Protection SPI 구현체를 직접 알지 못합니다.
 * 어댑터 모듈이 이 인터페이스를 구현하여 실제 Circuit Breaker, Bulkhead, Timeout Policy를 제공합니다.</p>
 *
 * <p><strong>아키텍처 위치:</strong></p>
 * <pre>
 * adapter-local (LocalResilienceComponentFactory)
 *   ↓ implements
 * application (ResilienceComponentFactory)
 *   ↓ depends on
 * core (CircuitBreaker, Bulkhead, TimeoutPolicy)
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ResilienceComponentFactory {

    /**
     * 이름이 붙은 Circuit Breaker 생성.
     *
     * @param name 이름
     * @param config 설정
     * @return 새 Circuit Breaker (CLOSED 상태)
     */
    CircuitBreaker createCircuitBreaker(String name, CircuitBreakerConfig config);

    /**
     * 이름이 붙은 Bulkhead 생성.
     *
     * @param name 이름
     * @param config 설정
     * @return 새 Bulkhead
     */
    Bulkhead createBulkhead(String name, BulkheadConfig config);

    /**
     * 보호 대상 함수에 적용할 Timeout Policy 조회.
     *
     * @return Timeout Policy (상태가 없으므로 공유 가능)
     */
    TimeoutPolicy timeoutPolicy();

    /**
     * 팩토리가 소유한 스레드 등 리소스 해제.
     */
    default void shutdown() {}
}
