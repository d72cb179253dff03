package com.ryuqq.resilience.application.profile;

import com.ryuqq.resilience.application.manager.ResilienceConfig;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadTier;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;

/**
 * 다운스트림 서비스 유형별 기본 보호 설정.
 *
 * <p>유형마다 타임아웃과 회복 대기 시간이 다릅니다.
 * 집계 윈도우는 모든 유형에서 10초입니다.</p>
 *
 * <pre>
 * 유형      실패 임계값  타임아웃  리셋 대기  Bulkhead 등급
 * LLM       5           30s      30s       CRITICAL
 * VECTOR    3           10s      20s       STANDARD
 * DATABASE  3           10s      15s       CRITICAL
 * HTTP      5           10s      30s       STANDARD
 * WEBHOOK   3           5s       60s       OPTIONAL
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum ServiceProfile {

    LLM("llm", 5, 30_000, 30_000, BulkheadTier.CRITICAL),
    VECTOR("vector", 3, 10_000, 20_000, BulkheadTier.STANDARD),
    DATABASE("database", 3, 10_000, 15_000, BulkheadTier.CRITICAL),
    HTTP("http", 5, 10_000, 30_000, BulkheadTier.STANDARD),
    WEBHOOK("webhook", 3, 5_000, 60_000, BulkheadTier.OPTIONAL);

    static final long WINDOW_MS = 10_000;

    private final String type;
    private final int failureThreshold;
    private final long timeoutMs;
    private final long resetTimeoutMs;
    private final BulkheadTier tier;

    ServiceProfile(String type, int failureThreshold, long timeoutMs, long resetTimeoutMs, BulkheadTier tier) {
        this.type = type;
        this.failureThreshold = failureThreshold;
        this.timeoutMs = timeoutMs;
        this.resetTimeoutMs = resetTimeoutMs;
        this.tier = tier;
    }

    public String getType() {
        return type;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public long getResetTimeoutMs() {
        return resetTimeoutMs;
    }

    public BulkheadTier getTier() {
        return tier;
    }

    /**
     * 유형 기본 설정 생성.
     *
     * @return Circuit Breaker와 Bulkhead가 모두 활성화된 설정
     */
    public ResilienceConfig defaultConfig() {
        return new ResilienceConfig(
            new CircuitBreakerConfig(failureThreshold, WINDOW_MS, resetTimeoutMs, timeoutMs),
            BulkheadConfig.forTier(tier)
        );
    }

    /**
     * 레지스트리 키 생성.
     *
     * @param serviceName 서비스 인스턴스 이름 (예: "openai-gpt4")
     * @return {@code "유형:서비스명"}
     * @throws IllegalArgumentException serviceName이 비어 있는 경우
     */
    public String key(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName cannot be null or blank");
        }
        return type + ":" + serviceName;
    }
}
