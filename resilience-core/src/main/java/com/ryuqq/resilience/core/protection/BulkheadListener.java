package com.ryuqq.resilience.core.protection;

/**
 * Bulkhead 관측 훅.
 *
 * <p>리스너는 best-effort이며 진입, 거부, 슬롯 반환 동작에 영향을 주지 않습니다.
 * 리스너가 던진 예외는 Bulkhead 구현체가 포착하여 로깅합니다.</p>
 *
 * <p>콜백은 특정 스레드에서 호출된다는 보장이 없으며, 동시 호출 시 순서도 보장되지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface BulkheadListener {

    BulkheadListener NOOP = new BulkheadListener() {
    };

    /**
     * 슬롯을 획득하고 함수 호출 직전에 호출.
     *
     * @param name Bulkhead 이름
     * @param queued 대기열을 거쳐 진입했으면 true
     */
    default void onAdmitted(String name, boolean queued) {}

    /**
     * 호출이 대기열에 추가되었을 때 호출.
     *
     * @param name Bulkhead 이름
     * @param queueLength 추가 후 대기열 길이
     */
    default void onQueued(String name, int queueLength) {}

    /**
     * 용량 초과 또는 대기열 정리로 호출이 거부되었을 때 호출.
     *
     * <p>거부된 함수는 호출되지 않았습니다.</p>
     *
     * @param name Bulkhead 이름
     * @param reason 거부 사유
     */
    default void onRejected(String name, String reason) {}

    /**
     * 진입한 호출이 종료되어 슬롯을 반환했을 때 호출 (진입당 정확히 한 번).
     *
     * @param name Bulkhead 이름
     * @param error 실패로 종료되었으면 예외, 성공이면 null
     */
    default void onReleased(String name, Throwable error) {}
}
