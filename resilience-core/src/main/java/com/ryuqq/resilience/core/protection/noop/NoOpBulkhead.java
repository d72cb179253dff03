package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadPermit;
import com.ryuqq.resilience.core.protection.BulkheadStats;
import com.ryuqq.resilience.core.protection.BulkheadTier;

import java.util.concurrent.Callable;

/**
 * Bulkhead NoOp 구현.
 *
 * <p>동시 실행 수 제한을 적용하지 않습니다.
 * Bulkhead가 비활성화된 경우 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>execute(): 함수를 직접 호출</li>
 *   <li>acquire(): 아무것도 반환하지 않는 슬롯</li>
 *   <li>getStats(): 항상 0 카운트</li>
 *   <li>getConfig(): 무제한 설정 반환</li>
 *   <li>clear() / awaitIdle(): 즉시 반환</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpBulkhead implements Bulkhead {

    private static final BulkheadConfig UNLIMITED_CONFIG =
        new BulkheadConfig(Integer.MAX_VALUE, 0, BulkheadTier.STANDARD);

    private final String name;

    public NoOpBulkhead(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public <T> T execute(Callable<T> call) throws Exception {
        return call.call();
    }

    @Override
    public BulkheadPermit acquire() {
        return BulkheadPermit.NOOP;
    }

    @Override
    public BulkheadStats getStats() {
        return new BulkheadStats(UNLIMITED_CONFIG.tier(), 0, UNLIMITED_CONFIG.maxConcurrent(), 0, 0, 0, 0);
    }

    @Override
    public BulkheadConfig getConfig() {
        return UNLIMITED_CONFIG;
    }

    @Override
    public void clear() {
        // NoOp
    }

    @Override
    public boolean awaitIdle(long timeoutMs) {
        return true;
    }
}
