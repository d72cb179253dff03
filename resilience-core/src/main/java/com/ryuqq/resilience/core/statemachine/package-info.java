/**
 * Circuit Breaker 상태 머신 규칙.
 *
 * <p>{@link com.ryuqq.resilience.core.protection.CircuitBreakerState}의 허용 전이를
 * {@link com.ryuqq.resilience.core.statemachine.CircuitTransition}이 검증합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.statemachine;
