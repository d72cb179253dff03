package com.ryuqq.resilience.core.statemachine;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 상태 전이 검증.
 *
 * <p>이 클래스는 Circuit Breaker의 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN (윈도우 내 실패 임계값 도달)</li>
 *   <li>OPEN → HALF_OPEN (리셋 타이머 만료)</li>
 *   <li>HALF_OPEN → CLOSED (시험 호출 성공)</li>
 *   <li>HALF_OPEN → OPEN (시험 호출 실패)</li>
 * </ul>
 *
 * <p>관리자 리셋(모든 상태 → CLOSED)은 일반 전이 규칙 밖의 강제 연산이므로
 * {@link #forceClose(CircuitBreakerState)}로 분리되어 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CircuitTransition {

    // Utility class - prevent instantiation
    private CircuitTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case CLOSED -> to == CircuitBreakerState.OPEN;
            case OPEN -> to == CircuitBreakerState.HALF_OPEN;
            case HALF_OPEN -> to == CircuitBreakerState.CLOSED || to == CircuitBreakerState.OPEN;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid circuit transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitBreakerState transition(CircuitBreakerState current, CircuitBreakerState next) {
        validate(current, next);
        return next;
    }

    /**
     * 관리자 리셋 전이.
     *
     * @param current 현재 상태
     * @return 항상 CLOSED
     * @throws IllegalArgumentException current가 null인 경우
     */
    public static CircuitBreakerState forceClose(CircuitBreakerState current) {
        if (current == null) {
            throw new IllegalArgumentException("current state cannot be null");
        }
        return CircuitBreakerState.CLOSED;
    }
}
