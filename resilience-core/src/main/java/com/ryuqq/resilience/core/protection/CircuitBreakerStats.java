package com.ryuqq.resilience.core.protection;

import java.time.Instant;

/**
 * Circuit Breaker 통계 스냅샷.
 *
 * <p>조회 시점의 값이며, 동시 호출로 인해 즉시 달라질 수 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param state 현재 상태
 * @param failures 현재 롤링 윈도우 내 실패 횟수
 * @param successes 누적 성공 횟수
 * @param rejections 누적 거부 횟수 (OPEN 또는 HALF_OPEN 시험 호출 진행 중)
 * @param lastFailureTime 마지막 실패 시각 (없으면 null)
 * @param lastStateChange 마지막 상태 변경 시각
 */
public record CircuitBreakerStats(
    CircuitBreakerState state,
    int failures,
    long successes,
    long rejections,
    Instant lastFailureTime,
    Instant lastStateChange
) {

    public CircuitBreakerStats {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (lastStateChange == null) {
            throw new IllegalArgumentException("lastStateChange cannot be null");
        }
        // lastFailureTime은 null 허용
    }
}
