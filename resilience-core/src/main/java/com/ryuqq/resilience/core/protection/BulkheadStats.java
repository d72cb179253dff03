package com.ryuqq.resilience.core.protection;

/**
 * Bulkhead 통계 스냅샷.
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param tier 리소스 등급
 * @param activeCount 현재 실행 중인 호출 수
 * @param maxConcurrent 최대 동시 실행 수
 * @param queueLength 현재 대기 중인 호출 수
 * @param maxQueueSize 최대 대기열 크기
 * @param totalExecuted 누적 실행 진입 수
 * @param totalRejected 누적 거부 수
 */
public record BulkheadStats(
    BulkheadTier tier,
    int activeCount,
    int maxConcurrent,
    int queueLength,
    int maxQueueSize,
    long totalExecuted,
    long totalRejected
) {

    /**
     * 실행 중이거나 대기 중인 전체 수요.
     *
     * @return activeCount + queueLength
     */
    public int outstanding() {
        return activeCount + queueLength;
    }
}
