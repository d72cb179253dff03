package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 다운스트림 호출의 실패 횟수를 추적하고,
 * 임계값 초과 시 요청을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (windowMs 내 실패 횟수 ≥ failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (resetTimeoutMs 경과)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 시험 호출 성공 → CLOSED
 *   └─► 시험 호출 실패 → OPEN (타이머 재시작)
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 정상적으로 처리되며, 롤링 윈도우 내 실패 횟수를 추적합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>보호 대상 함수를 호출하지 않고 즉시 {@code CircuitOpenException}으로 실패합니다.
     * resetTimeoutMs가 경과하면 HALF_OPEN 상태로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (시험 호출 1건만 통과).
     *
     * <p>동시에 하나의 시험 호출만 허용하며, 나머지 요청은 거부됩니다.
     * 시험 호출이 성공하면 CLOSED, 실패하면 다시 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN
}
