package com.ryuqq.resilience.application.manager;

import com.ryuqq.resilience.core.protection.BulkheadPermit;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bulkhead 슬롯을 함수 종료 시점까지 붙잡는 Callable 래퍼.
 *
 * <p>타임아웃 정책이 함수를 다른 스레드에서 실행하면 호출자는 마감 시간에 먼저 돌아가지만,
 * 인터럽트에 반응하지 않는 함수는 계속 실행됩니다. 슬롯은 호출자가 아니라 함수를 실행한 스레드가
 * 함수 종료 후 반환합니다.</p>
 *
 * <p><strong>단계:</strong></p>
 * <ul>
 *   <li>PENDING → STARTED: 함수 실행 시작. 슬롯은 함수 종료 시 반환</li>
 *   <li>PENDING → ABANDONED: 함수가 시작되기 전에 호출자가 포기 (제출 실패, 시작 전 취소).
 *       호출자가 슬롯을 반환하고 함수는 이후에도 실행되지 않음</li>
 * </ul>
 *
 * @param <T> 결과 타입
 */
final class SlotHoldingCall<T> implements Callable<T> {

    private static final int PENDING = 0;
    private static final int STARTED = 1;
    private static final int ABANDONED = 2;

    private final Callable<T> delegate;
    private final BulkheadPermit slot;
    private final AtomicInteger phase = new AtomicInteger(PENDING);

    SlotHoldingCall(Callable<T> delegate, BulkheadPermit slot) {
        this.delegate = delegate;
        this.slot = slot;
    }

    @Override
    public T call() throws Exception {
        if (!phase.compareAndSet(PENDING, STARTED)) {
            throw new CancellationException("call abandoned before start");
        }

        Throwable error = null;
        try {
            return delegate.call();
        } catch (Exception | Error e) {
            error = e;
            throw e;
        } finally {
            slot.release(error);
        }
    }

    /**
     * 함수가 실행을 시작했는지 확인.
     *
     * @return 시작했으면 true
     */
    boolean wasInvoked() {
        return phase.get() == STARTED;
    }

    /**
     * 아직 시작되지 않은 함수를 포기하고 슬롯 반환.
     *
     * <p>이미 시작된 함수에는 아무 영향이 없습니다.</p>
     *
     * @param cause 포기 사유
     */
    void abandon(Throwable cause) {
        if (phase.compareAndSet(PENDING, ABANDONED)) {
            slot.release(cause);
        }
    }
}
