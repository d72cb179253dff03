package com.ryuqq.resilience.adapter.local;

import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerListener;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;
import com.ryuqq.resilience.core.protection.CircuitPermit;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import com.ryuqq.resilience.core.statemachine.CircuitTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 프로세스 로컬 Circuit Breaker 구현.
 *
 * <p><strong>상태 머신:</strong></p>
 * <pre>
 *     CLOSED ──(윈도우 내 실패 ≥ failureThreshold)──> OPEN
 *        ^                                           │
 *        │                                  (resetTimeoutMs 타이머)
 *   (시험 호출 성공)                                  │
 *        │                                           v
 *        └─────────────── HALF_OPEN <────────────────┘
 *                            │
 *                     (시험 호출 실패) ──> OPEN (타이머 재시작)
 * </pre>
 *
 * <p><strong>롤링 윈도우:</strong> 직전 실패가 {@code now - windowMs}보다 오래되었으면
 * 실패 카운트를 누적하지 않고 1로 다시 시작합니다. 드문드문 발생하는 실패는 회로를 열지 않습니다.</p>
 *
 * <p><strong>HALF_OPEN 정책:</strong> 한 번에 정확히 하나의 시험 호출만 허용합니다.
 * 시험 호출이 진행 중일 때 들어온 호출은 {@code CircuitOpenException(state=HALF_OPEN)}으로
 * 거부되고 거부 카운트에 포함됩니다. 시험 호출은 고유한 trialId를 가진 {@link CircuitPermit}으로 식별하며,
 * 그 토큰만 시험 슬롯을 반환하거나 회로를 닫거나 다시 열 수 있습니다. OPEN 이전에 허용된 호출이
 * HALF_OPEN 중에 끝나면 카운터만 갱신됩니다.</p>
 *
 * <p><strong>리셋 타이머:</strong></p>
 * <ul>
 *   <li>OPEN 진입 시 resetTimeoutMs 후 한 번 실행되는 작업을 예약</li>
 *   <li>다시 OPEN으로 전이하면 기존 작업을 취소하고 새 작업으로 교체 (중첩 없음)</li>
 *   <li>OPEN 상태에서 들어온 실패는 카운트만 갱신하고 타이머는 건드리지 않음</li>
 *   <li>세대(generation) 값으로 취소에 실패한 이전 타이머의 실행을 무시</li>
 * </ul>
 *
 * <p>모든 상태 변경은 하나의 {@link ReentrantLock} 임계 구역에서 수행되며,
 * 리스너 콜백은 락을 놓은 뒤 호출합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final ScheduledExecutorService scheduler;
    private final TimeoutPolicy timeoutPolicy;
    private final CircuitBreakerListener listener;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // lock으로 보호
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private long successCount;
    private long rejectionCount;
    private Instant lastFailureTime;
    private Instant lastStateChange;
    private long activeTrialId;
    private long trialSequence;
    private ScheduledFuture<?> resetTask;
    private long openGeneration;

    /**
     * 생성자 (시스템 UTC 시계 사용).
     *
     * @param name 이름
     * @param config 설정
     * @param scheduler 리셋 타이머 스케줄러
     * @param timeoutPolicy 호출 타임아웃 정책
     * @param listener 상태 변경 리스너
     */
    public DefaultCircuitBreaker(String name, CircuitBreakerConfig config, ScheduledExecutorService scheduler,
                                 TimeoutPolicy timeoutPolicy, CircuitBreakerListener listener) {
        this(name, config, scheduler, timeoutPolicy, listener, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param name 이름
     * @param config 설정
     * @param scheduler 리셋 타이머 스케줄러
     * @param timeoutPolicy 호출 타임아웃 정책
     * @param listener 상태 변경 리스너 (null이면 NOOP)
     * @param clock 실패 시각 및 롤링 윈도우 계산용 시계
     * @throws IllegalArgumentException 필수 인자가 null이거나 이름이 비어 있는 경우
     */
    public DefaultCircuitBreaker(String name, CircuitBreakerConfig config, ScheduledExecutorService scheduler,
                                 TimeoutPolicy timeoutPolicy, CircuitBreakerListener listener, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (timeoutPolicy == null) {
            throw new IllegalArgumentException("timeoutPolicy cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.scheduler = scheduler;
        this.timeoutPolicy = timeoutPolicy;
        this.listener = listener != null ? listener : CircuitBreakerListener.NOOP;
        this.clock = clock;
        this.lastStateChange = clock.instant();
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

        CircuitPermit permit = tryAcquire();

        boolean classified = false;
        try {
            T result = timeoutPolicy.execute(call, config.timeoutMs(), name);
            recordSuccess(permit);
            classified = true;
            return result;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception | Error e) {
            recordFailure(permit, e);
            classified = true;
            throw e;
        } finally {
            if (!classified) {
                releasePermission(permit);
            }
        }
    }

    @Override
    public CircuitPermit tryAcquire() {
        CircuitPermit permit = CircuitPermit.STANDARD;
        CircuitOpenException rejection = null;

        lock.lock();
        try {
            if (state == CircuitBreakerState.OPEN) {
                rejectionCount++;
                rejection = new CircuitOpenException(name, CircuitBreakerState.OPEN);
            } else if (state == CircuitBreakerState.HALF_OPEN) {
                if (activeTrialId != 0) {
                    rejectionCount++;
                    rejection = new CircuitOpenException(name, CircuitBreakerState.HALF_OPEN);
                } else {
                    activeTrialId = ++trialSequence;
                    permit = new CircuitPermit(activeTrialId);
                }
            }
        } finally {
            lock.unlock();
        }

        if (rejection != null) {
            CircuitBreakerState rejectedIn = rejection.getState();
            fire(() -> listener.onReject(name, rejectedIn));
            throw rejection;
        }
        return permit;
    }

    @Override
    public void recordSuccess(CircuitPermit permit) {
        List<Runnable> events = new ArrayList<>(3);

        lock.lock();
        try {
            successCount++;
            if (state == CircuitBreakerState.HALF_OPEN && ownsTrial(permit)) {
                activeTrialId = 0;
                failureCount = 0;
                moveTo(CircuitBreakerState.CLOSED, events);
                events.add(() -> listener.onClose(name));
            }
        } finally {
            lock.unlock();
        }

        fire(() -> listener.onSuccess(name));
        events.forEach(this::fire);
    }

    @Override
    public void recordFailure(CircuitPermit permit, Throwable throwable) {
        List<Runnable> events = new ArrayList<>(3);

        lock.lock();
        try {
            Instant now = clock.instant();
            if (lastFailureTime != null && lastFailureTime.isBefore(now.minusMillis(config.windowMs()))) {
                failureCount = 1;
            } else {
                failureCount++;
            }
            lastFailureTime = now;

            if (state == CircuitBreakerState.HALF_OPEN && ownsTrial(permit)) {
                activeTrialId = 0;
                open(events);
            } else if (state == CircuitBreakerState.CLOSED && failureCount >= config.failureThreshold()) {
                open(events);
            }
        } finally {
            lock.unlock();
        }

        fire(() -> listener.onFailure(name, throwable));
        events.forEach(this::fire);
    }

    @Override
    public void releasePermission(CircuitPermit permit) {
        lock.lock();
        try {
            if (ownsTrial(permit)) {
                activeTrialId = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerStats getStats() {
        lock.lock();
        try {
            return new CircuitBreakerStats(
                state, failureCount, successCount, rejectionCount, lastFailureTime, lastStateChange);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        List<Runnable> events = new ArrayList<>(3);

        lock.lock();
        try {
            cancelResetTask();
            CircuitBreakerState from = state;
            state = CircuitTransition.forceClose(from);
            failureCount = 0;
            successCount = 0;
            rejectionCount = 0;
            lastFailureTime = null;
            activeTrialId = 0;
            lastStateChange = clock.instant();

            if (from != CircuitBreakerState.CLOSED) {
                events.add(() -> listener.onStateChange(name, from, CircuitBreakerState.CLOSED));
                events.add(() -> listener.onClose(name));
            }
        } finally {
            lock.unlock();
        }

        events.forEach(this::fire);
        fire(() -> listener.onReset(name));
    }

    /**
     * 리셋 타이머 만료 처리 (OPEN → HALF_OPEN).
     *
     * @param generation 타이머를 예약한 시점의 세대
     */
    void onResetTimeout(long generation) {
        List<Runnable> events = new ArrayList<>(2);

        lock.lock();
        try {
            if (state != CircuitBreakerState.OPEN || generation != openGeneration) {
                log.debug("Ignoring stale reset timer: name={}, generation={}", name, generation);
                return;
            }
            resetTask = null;
            activeTrialId = 0;
            moveTo(CircuitBreakerState.HALF_OPEN, events);
            events.add(() -> listener.onHalfOpen(name));
        } finally {
            lock.unlock();
        }

        events.forEach(this::fire);
    }

    // lock 보유 상태에서만 호출
    private boolean ownsTrial(CircuitPermit permit) {
        return permit != null && permit.isTrial() && permit.trialId() == activeTrialId;
    }

    // lock 보유 상태에서만 호출
    private void open(List<Runnable> events) {
        int failures = failureCount;
        moveTo(CircuitBreakerState.OPEN, events);
        events.add(() -> listener.onOpen(name, failures));

        cancelResetTask();
        long generation = ++openGeneration;
        try {
            resetTask = scheduler.schedule(
                () -> onResetTimeout(generation), config.resetTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.error("Failed to schedule reset timer for circuit breaker {}, staying OPEN until reset()", name, e);
        }
    }

    // lock 보유 상태에서만 호출
    private void moveTo(CircuitBreakerState next, List<Runnable> events) {
        CircuitBreakerState from = state;
        state = CircuitTransition.transition(from, next);
        lastStateChange = clock.instant();
        events.add(() -> listener.onStateChange(name, from, next));
    }

    // lock 보유 상태에서만 호출
    private void cancelResetTask() {
        if (resetTask != null) {
            resetTask.cancel(false);
            resetTask = null;
        }
        openGeneration++;
    }

    private void fire(Runnable event) {
        try {
            event.run();
        } catch (RuntimeException e) {
            log.warn("Circuit breaker listener failed: name={}", name, e);
        }
    }
}
