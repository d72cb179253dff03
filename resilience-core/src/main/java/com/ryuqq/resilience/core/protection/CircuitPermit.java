package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 진입 허용 토큰.
 *
 * <p>{@link CircuitBreaker#tryAcquire()}가 발급하며, 같은 호출의 결과를 기록할 때
 * 그대로 돌려주어야 합니다. HALF_OPEN 시험 호출 슬롯은 이 토큰으로 소유권을 확인합니다.</p>
 *
 * <ul>
 *   <li>trialId == 0: 일반 호출 (CLOSED 상태에서 허용)</li>
 *   <li>trialId &gt; 0: HALF_OPEN 시험 호출</li>
 * </ul>
 *
 * <p>시험 호출이 아닌 토큰은 시험 슬롯을 반환하거나 회로를 닫을 수 없습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param trialId 시험 호출 식별자 (일반 호출은 0)
 */
public record CircuitPermit(long trialId) {

    /**
     * 일반 호출 토큰.
     */
    public static final CircuitPermit STANDARD = new CircuitPermit(0);

    public CircuitPermit {
        if (trialId < 0) {
            throw new IllegalArgumentException("trialId must not be negative (current: " + trialId + ")");
        }
    }

    /**
     * HALF_OPEN 시험 호출 토큰인지 확인.
     *
     * @return 시험 호출이면 true
     */
    public boolean isTrial() {
        return trialId != 0;
    }
}
