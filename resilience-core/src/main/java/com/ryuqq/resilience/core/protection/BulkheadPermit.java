package com.ryuqq.resilience.core.protection;

/**
 * 획득한 Bulkhead 슬롯.
 *
 * <p>{@link Bulkhead#acquire()}로 얻은 슬롯은 보호 대상 함수가 실제로 끝난 뒤
 * {@link #release(Throwable)}로 정확히 한 번 반환해야 합니다. 호출자가 타임아웃으로 먼저 돌아가더라도
 * 함수가 아직 실행 중이면 슬롯은 반환하지 않습니다.</p>
 *
 * <p>구현체는 중복 반환을 무시해야 합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BulkheadPermit {

    BulkheadPermit NOOP = error -> {
    };

    /**
     * 슬롯 반환.
     *
     * @param error 함수가 실패로 끝났으면 예외, 성공이거나 호출되지 않았으면 null
     */
    void release(Throwable error);
}
