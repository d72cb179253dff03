package com.ryuqq.resilience.adapter.local;

import com.ryuqq.resilience.application.manager.ResilienceComponentFactory;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadListener;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerListener;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * 프로세스 로컬 컴포넌트 팩토리.
 *
 * <p>모든 Circuit Breaker가 하나의 리셋 타이머 스케줄러와 하나의 {@link TimeoutGuard}를 공유합니다.
 * 두 리소스는 이 팩토리가 소유하며 {@link #shutdown()}에서 해제합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ResilienceRegistry registry = new ResilienceRegistry(new LocalResilienceComponentFactory());
 * ResilienceManager llm = registry.getOrCreate(ServiceProfile.LLM, "openai-gpt4");
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class LocalResilienceComponentFactory implements ResilienceComponentFactory {

    private static final Logger log = LoggerFactory.getLogger(LocalResilienceComponentFactory.class);

    private final ScheduledThreadPoolExecutor scheduler;
    private final TimeoutGuard timeoutGuard;
    private final CircuitBreakerListener circuitBreakerListener;
    private final BulkheadListener bulkheadListener;
    private final Clock clock;

    /**
     * 기본 생성자 (SLF4J 리스너, 시스템 UTC 시계).
     */
    public LocalResilienceComponentFactory() {
        this(new Slf4jCircuitBreakerListener(), new Slf4jBulkheadListener(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param circuitBreakerListener Circuit Breaker 리스너 (null이면 NOOP)
     * @param bulkheadListener Bulkhead 리스너 (null이면 NOOP)
     * @param clock 실패 시각 계산용 시계
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public LocalResilienceComponentFactory(CircuitBreakerListener circuitBreakerListener,
                                           BulkheadListener bulkheadListener, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.circuitBreakerListener = circuitBreakerListener;
        this.bulkheadListener = bulkheadListener;
        this.clock = clock;
        this.scheduler = new ScheduledThreadPoolExecutor(1, new NamedDaemonThreadFactory("resilience-reset-"));
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.timeoutGuard = new TimeoutGuard();
    }

    @Override
    public CircuitBreaker createCircuitBreaker(String name, CircuitBreakerConfig config) {
        return new DefaultCircuitBreaker(name, config, scheduler, timeoutGuard, circuitBreakerListener, clock);
    }

    @Override
    public Bulkhead createBulkhead(String name, BulkheadConfig config) {
        return new QueueingBulkhead(name, config, bulkheadListener);
    }

    @Override
    public TimeoutPolicy timeoutPolicy() {
        return timeoutGuard;
    }

    /**
     * 리셋 타이머 스케줄러와 타임아웃 스레드 풀 종료.
     */
    @Override
    public void shutdown() {
        scheduler.shutdownNow();
        timeoutGuard.shutdown();
        log.info("Local resilience components shut down");
    }
}
