package com.ryuqq.resilience.core.protection;

/**
 * Bulkhead 리소스 등급.
 *
 * <p>호출 지점의 중요도에 따라 기본 동시 실행 수와 대기열 크기를 선택하는 설정 라벨입니다.
 * Bulkhead 자체는 등급 간 우선순위를 적용하지 않으며, 이름이 다른 Bulkhead는 서로 독립적입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum BulkheadTier {

    /** 핵심 경로 (예: 사용자 응답 생성). 가장 넉넉한 용량. */
    CRITICAL(20, 40),

    /** 일반 경로. */
    STANDARD(10, 20),

    /** 생략 가능한 부가 작업 (예: 추천, 분석). 가장 작은 용량. */
    OPTIONAL(4, 4);

    private final int defaultMaxConcurrent;
    private final int defaultMaxQueueSize;

    BulkheadTier(int defaultMaxConcurrent, int defaultMaxQueueSize) {
        this.defaultMaxConcurrent = defaultMaxConcurrent;
        this.defaultMaxQueueSize = defaultMaxQueueSize;
    }

    public int getDefaultMaxConcurrent() {
        return defaultMaxConcurrent;
    }

    public int getDefaultMaxQueueSize() {
        return defaultMaxQueueSize;
    }
}
