package com.ryuqq.resilience.adapter.local;

import com.ryuqq.resilience.core.exception.BulkheadRejectedException;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadListener;
import com.ryuqq.resilience.core.protection.BulkheadPermit;
import com.ryuqq.resilience.core.protection.BulkheadStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO 대기열을 가진 Bulkhead 구현.
 *
 * <p><strong>슬롯 인계:</strong> 실행 중인 호출이 끝나면 슬롯을 반환하지 않고
 * 대기열 맨 앞의 호출자에게 직접 넘깁니다. 따라서 나중에 도착한 호출이 대기 중인 호출을
 * 앞지를 수 없고, 대기열이 비어 있지 않으면 항상 activeCount == maxConcurrent입니다.</p>
 *
 * <p><strong>취소:</strong></p>
 * <ul>
 *   <li>대기 중 인터럽트: 대기열에서 제거 후 {@link InterruptedException}</li>
 *   <li>슬롯을 넘겨받은 직후 인터럽트: 슬롯을 다음 대기자에게 다시 넘긴 후 {@link InterruptedException}</li>
 * </ul>
 *
 * <p>대기자마다 별도의 {@link Condition}을 사용하여 슬롯을 받을 호출자만 깨웁니다.</p>
 *
 * <p>{@link #acquire()}로 얻은 슬롯은 다른 스레드에서 반환해도 되며, 두 번째 반환부터는 무시됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class QueueingBulkhead implements Bulkhead {

    private static final Logger log = LoggerFactory.getLogger(QueueingBulkhead.class);

    static final String REASON_CLEARED = "cleared";

    private final String name;
    private final BulkheadConfig config;
    private final BulkheadListener listener;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();

    // lock으로 보호
    private final ArrayDeque<Waiter> queue = new ArrayDeque<>();
    private int activeCount;
    private long totalExecuted;
    private long totalRejected;

    /**
     * 생성자.
     *
     * @param name 이름
     * @param config 설정
     * @param listener 관측 훅 (null이면 NOOP)
     * @throws IllegalArgumentException name 또는 config가 유효하지 않은 경우
     */
    public QueueingBulkhead(String name, BulkheadConfig config, BulkheadListener listener) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.name = name;
        this.config = config;
        this.listener = listener != null ? listener : BulkheadListener.NOOP;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public <T> T execute(Callable<T> call) throws Exception {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }

        BulkheadPermit slot = acquire();

        Throwable error = null;
        try {
            return call.call();
        } catch (Exception | Error e) {
            error = e;
            throw e;
        } finally {
            slot.release(error);
        }
    }

    @Override
    public BulkheadPermit acquire() throws InterruptedException {
        boolean queued = acquireSlot();
        fire(() -> listener.onAdmitted(name, queued));
        return new SlotPermit();
    }

    /**
     * 슬롯 획득.
     *
     * @return 대기열을 거쳐 진입했으면 true
     */
    private boolean acquireSlot() throws InterruptedException {
        Waiter waiter = null;
        String rejectReason = null;
        int queueLength = 0;

        lock.lock();
        try {
            if (activeCount < config.maxConcurrent()) {
                activeCount++;
                totalExecuted++;
                return false;
            }
            if (queue.size() >= config.maxQueueSize()) {
                totalRejected++;
                rejectReason = "max concurrent (" + config.maxConcurrent()
                    + ") and queue (" + config.maxQueueSize() + ") exhausted";
            } else {
                waiter = new Waiter(lock.newCondition());
                queue.addLast(waiter);
                queueLength = queue.size();
            }
        } finally {
            lock.unlock();
        }

        if (rejectReason != null) {
            String reason = rejectReason;
            fire(() -> listener.onRejected(name, reason));
            throw new BulkheadRejectedException(name, config.tier(), reason);
        }

        int length = queueLength;
        fire(() -> listener.onQueued(name, length));
        awaitTurn(waiter);
        return true;
    }

    private void awaitTurn(Waiter waiter) throws InterruptedException {
        lock.lock();
        try {
            while (!waiter.admitted && !waiter.cleared) {
                waiter.ready.await();
            }
        } catch (InterruptedException e) {
            if (waiter.admitted) {
                handOffOrFree();
            } else if (!waiter.cleared) {
                queue.remove(waiter);
                signalIfIdle();
            }
            log.debug("Bulkhead {} waiter interrupted while queued", name);
            throw e;
        } finally {
            lock.unlock();
        }

        if (waiter.cleared) {
            fire(() -> listener.onRejected(name, REASON_CLEARED));
            throw new BulkheadRejectedException(name, config.tier(), REASON_CLEARED);
        }
    }

    private void release() {
        lock.lock();
        try {
            handOffOrFree();
        } finally {
            lock.unlock();
        }
    }

    // lock 보유 상태에서만 호출
    private void handOffOrFree() {
        Waiter next = queue.pollFirst();
        if (next != null) {
            totalExecuted++;
            next.admitted = true;
            next.ready.signal();
        } else {
            activeCount--;
            signalIfIdle();
        }
    }

    // lock 보유 상태에서만 호출
    private void signalIfIdle() {
        if (activeCount == 0 && queue.isEmpty()) {
            idle.signalAll();
        }
    }

    @Override
    public BulkheadStats getStats() {
        lock.lock();
        try {
            return new BulkheadStats(
                config.tier(),
                activeCount,
                config.maxConcurrent(),
                queue.size(),
                config.maxQueueSize(),
                totalExecuted,
                totalRejected
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BulkheadConfig getConfig() {
        return config;
    }

    @Override
    public void clear() {
        int cleared;

        lock.lock();
        try {
            cleared = queue.size();
            for (Waiter waiter : queue) {
                waiter.cleared = true;
                waiter.ready.signal();
            }
            queue.clear();
            totalExecuted = 0;
            totalRejected = 0;
            signalIfIdle();
        } finally {
            lock.unlock();
        }

        log.info("Bulkhead {} cleared: {} queued calls rejected", name, cleared);
    }

    @Override
    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        long remaining = TimeUnit.MILLISECONDS.toNanos(Math.max(0, timeoutMs));

        lock.lock();
        try {
            while (activeCount > 0 || !queue.isEmpty()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void fire(Runnable event) {
        try {
            event.run();
        } catch (RuntimeException e) {
            log.warn("Bulkhead listener failed: name={}", name, e);
        }
    }

    /**
     * 획득한 슬롯 (정확히 한 번 반환).
     */
    private final class SlotPermit implements BulkheadPermit {

        private final AtomicBoolean released = new AtomicBoolean();

        @Override
        public void release(Throwable error) {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            QueueingBulkhead.this.release();
            fire(() -> listener.onReleased(name, error));
        }
    }

    /**
     * 대기열 항목.
     */
    private static final class Waiter {

        private final Condition ready;
        private boolean admitted;
        private boolean cleared;

        private Waiter(Condition ready) {
            this.ready = ready;
        }
    }
}
