package com.ryuqq.resilience.adapter.local;

import com.ryuqq.resilience.core.exception.OperationTimeoutException;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ExecutorService 기반 Timeout Policy 구현.
 *
 * <p>함수를 별도 스레드에 제출하고 {@link Future#get(long, TimeUnit)}으로 마감 시간까지만 기다립니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. timeoutMs ≤ 0 → 호출 스레드에서 직접 실행 (마감 시간 없음)
 * 2. executor.submit(call)
 * 3. future.get(timeoutMs)
 *    - 결과 도착: 그대로 반환
 *    - 함수 예외: ExecutionException을 벗겨 원래 예외를 전파
 *    - 마감 시간 초과: future.cancel(true)로 인터럽트 전파 후 OperationTimeoutException
 *    - 호출자 인터럽트: future.cancel(true) 후 InterruptedException 전파
 * </pre>
 *
 * <p>인터럽트에 반응하지 않는 함수는 타임아웃 이후에도 백그라운드에서 끝까지 실행될 수 있으며,
 * 그 결과는 버려집니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class TimeoutGuard implements TimeoutPolicy {

    private static final Logger log = LoggerFactory.getLogger(TimeoutGuard.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * 기본 생성자 (전용 데몬 스레드 풀 생성).
     */
    public TimeoutGuard() {
        this(Executors.newCachedThreadPool(new NamedDaemonThreadFactory("resilience-timeout-")), true);
    }

    /**
     * 외부 ExecutorService 사용.
     *
     * <p>전달된 ExecutorService의 수명은 호출자가 관리합니다.</p>
     *
     * @param executor 함수 실행용 ExecutorService
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public TimeoutGuard(ExecutorService executor) {
        this(executor, false);
    }

    private TimeoutGuard(ExecutorService executor, boolean ownsExecutor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public <T> T execute(Callable<T> call, long timeoutMs, String operation) throws Exception {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        if (timeoutMs <= 0) {
            return call.call();
        }

        Future<T> future = executor.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Operation {} timed out after {}ms", operation, timeoutMs);
            throw new OperationTimeoutException(operation, timeoutMs);

        } catch (ExecutionException e) {
            throw unwrap(e);

        } catch (InterruptedException e) {
            future.cancel(true);
            log.debug("Caller interrupted while waiting for {}", operation);
            throw e;
        }
    }

    private static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        return e;
    }

    /**
     * 전용 스레드 풀 종료.
     *
     * <p>외부에서 주입한 ExecutorService는 종료하지 않습니다.</p>
     */
    public void shutdown() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }
}
