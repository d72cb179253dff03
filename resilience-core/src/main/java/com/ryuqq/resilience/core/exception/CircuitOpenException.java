package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker가 호출을 fail-fast로 거부했을 때 발생하는 예외.
 *
 * <p>이 예외가 관측되면 다음이 보장됩니다:</p>
 * <ul>
 *   <li>보호 대상 함수는 호출되지 않음</li>
 *   <li>새로운 실패로 분류되지 않음 (OPEN 구간을 연장하지 않음)</li>
 *   <li>Bulkhead 슬롯을 소비하지 않음</li>
 * </ul>
 *
 * <p>이 계층은 재시도하지 않습니다. 재시도, 캐시 폴백, 오류 노출은 호출자가 결정합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CircuitOpenException extends ResilienceException {

    private final String name;
    private final CircuitBreakerState state;

    /**
     * 생성자.
     *
     * @param name Circuit Breaker 이름
     * @param state 거부 시점 상태 (OPEN 또는 HALF_OPEN)
     */
    public CircuitOpenException(String name, CircuitBreakerState state) {
        super("Circuit breaker '" + name + "' is " + state);
        this.name = name;
        this.state = state;
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerState getState() {
        return state;
    }
}
