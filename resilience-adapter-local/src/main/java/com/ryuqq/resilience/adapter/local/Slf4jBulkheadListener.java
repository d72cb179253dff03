package com.ryuqq.resilience.adapter.local;

import com.ryuqq.resilience.core.protection.BulkheadListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulkhead 이벤트를 SLF4J로 기록하는 리스너.
 *
 * <p>거부는 WARN, 대기열 추가는 DEBUG, 진입과 반환은 TRACE로 기록합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class Slf4jBulkheadListener implements BulkheadListener {

    private static final Logger log = LoggerFactory.getLogger(Slf4jBulkheadListener.class);

    @Override
    public void onAdmitted(String name, boolean queued) {
        log.trace("Bulkhead {} admitted call (queued={})", name, queued);
    }

    @Override
    public void onQueued(String name, int queueLength) {
        log.debug("Bulkhead {} queued call, queue length {}", name, queueLength);
    }

    @Override
    public void onRejected(String name, String reason) {
        log.warn("Bulkhead {} rejected call: {}", name, reason);
    }

    @Override
    public void onReleased(String name, Throwable error) {
        log.trace("Bulkhead {} released slot (failed={})", name, error != null);
    }
}
