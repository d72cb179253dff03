package com.ryuqq.resilience.core.exception;

import com.ryuqq.resilience.core.protection.BulkheadTier;

/**
 * Bulkhead가 용량 초과로 호출을 거부했을 때 발생하는 예외.
 *
 * <p>이 예외는 실행 실패가 아니라 <em>의도적인</em> 부하 차단 신호입니다.
 * 거부된 함수는 호출되지 않았으며, Circuit Breaker 실패로 분류되지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class BulkheadRejectedException extends ResilienceException {

    private final String name;
    private final BulkheadTier tier;
    private final String reason;

    /**
     * 생성자.
     *
     * @param name Bulkhead 이름
     * @param tier 리소스 등급
     * @param reason 거부 사유 (예: "Queue full (20/20)")
     */
    public BulkheadRejectedException(String name, BulkheadTier tier, String reason) {
        super("Bulkhead '" + name + "' rejected (" + tier + "): " + reason);
        this.name = name;
        this.tier = tier;
        this.reason = reason;
    }

    public String getName() {
        return name;
    }

    public BulkheadTier getTier() {
        return tier;
    }

    public String getReason() {
        return reason;
    }
}
