/**
 * 보호 계층 예외 분류.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.exception.OperationTimeoutException} - 마감 시간 초과, 실패로 분류</li>
 *   <li>{@link com.ryuqq.resilience.core.exception.CircuitOpenException} - fail-fast, 함수 미호출, 실패로 분류하지 않음</li>
 *   <li>{@link com.ryuqq.resilience.core.exception.BulkheadRejectedException} - 용량 초과, 함수 미호출, 실패로 분류하지 않음</li>
 * </ul>
 *
 * <p>보호 대상 함수가 던진 예외는 감싸지 않고 그대로 호출자에게 전파되며, 동시에 실패로 분류됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.exception;
