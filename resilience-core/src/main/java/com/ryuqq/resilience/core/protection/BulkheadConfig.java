package com.ryuqq.resilience.core.protection;

/**
 * Bulkhead 설정.
 *
 * <p>Bulkhead의 동작을 제어하는 설정 정보입니다.</p>
 *
 * @param maxConcurrent 최대 동시 실행 수 (예: 10)
 * @param maxQueueSize 최대 대기열 크기 (0이면 대기 없이 즉시 거부)
 * @param tier 리소스 등급
 * @author Resilience Team
 * @since 1.0.0
 */
public record BulkheadConfig(int maxConcurrent, int maxQueueSize, BulkheadTier tier) {

    /**
     * 기본 설정 생성자 (STANDARD 등급 기본값).
     */
    public BulkheadConfig() {
        this(BulkheadTier.STANDARD);
    }

    /**
     * 등급 기본값으로 생성.
     *
     * @param tier 리소스 등급
     */
    public BulkheadConfig(BulkheadTier tier) {
        this(
            tier == null ? 0 : tier.getDefaultMaxConcurrent(),
            tier == null ? 0 : tier.getDefaultMaxQueueSize(),
            tier
        );
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxConcurrent is not positive
     * @throws IllegalArgumentException if maxQueueSize is negative
     * @throws IllegalArgumentException if tier is null
     */
    public BulkheadConfig {
        if (tier == null) {
            throw new IllegalArgumentException("tier cannot be null");
        }
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrent must be positive (current: " + maxConcurrent + ")"
            );
        }
        if (maxQueueSize < 0) {
            throw new IllegalArgumentException(
                "maxQueueSize cannot be negative (current: " + maxQueueSize + ")"
            );
        }
    }

    /**
     * 등급 기본값 설정 생성.
     *
     * @param tier 리소스 등급
     * @return 해당 등급의 기본 설정
     */
    public static BulkheadConfig forTier(BulkheadTier tier) {
        return new BulkheadConfig(tier);
    }

    public BulkheadConfig withMaxConcurrent(int maxConcurrent) {
        return new BulkheadConfig(maxConcurrent, maxQueueSize, tier);
    }

    public BulkheadConfig withMaxQueueSize(int maxQueueSize) {
        return new BulkheadConfig(maxConcurrent, maxQueueSize, tier);
    }
}
