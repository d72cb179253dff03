package com.ryuqq.resilience.application.manager;

import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadPermit;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitPermit;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import com.ryuqq.resilience.core.protection.noop.NoOpBulkhead;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.core.protection.noop.NoOpTimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Circuit Breaker + Bulkhead + Timeout 통합 실행기.
 *
 * <p>하나의 {@link #execute(Callable)} 진입점으로 세 보호 메커니즘을 고정된 순서로 합성합니다.</p>
 *
 * <p><strong>합성 순서:</strong></p>
 * <pre>
 * execute(call)
 *   ↓
 * 1. permit = circuitBreaker.tryAcquire()  → OPEN이면 CircuitOpenException (Bulkhead 슬롯 미소비)
 *   ↓
 * 2. slot = bulkhead.acquire()              → 용량 초과 시 대기열 또는 BulkheadRejectedException
 *   ↓
 * 3. timeoutPolicy.execute(call, ...)       → 함수 자체에 timeoutMs 적용
 *   ↓
 * 4. 결과 분류
 *    - 성공 → recordSuccess(permit)
 *    - 함수 예외 / Error / 타임아웃 → recordFailure(permit, e) 후 그대로 전파
 *    - 함수 미호출 (Bulkhead 거부, 대기 중 인터럽트) → releasePermission(permit)
 *    - 결과 대기 중 호출자 인터럽트 → releasePermission(permit)
 * </pre>
 *
 * <p><strong>슬롯 수명:</strong> Bulkhead 슬롯은 호출자가 아니라 함수의 종료에 묶입니다.
 * 타임아웃으로 호출자가 먼저 돌아가도 인터럽트를 무시하는 함수가 계속 실행 중이면 슬롯은 유지되므로,
 * 실제로 실행 중인 함수 수는 maxConcurrent를 넘지 않습니다.</p>
 *
 * <p>비활성화된 계층은 NoOp 구현으로 대체되어 함수를 그대로 통과시킵니다.
 * 두 계층이 모두 비활성화되면 함수는 보호 없이 호출됩니다.</p>
 *
 * <p>이 클래스는 thread-safe합니다. 상태는 소유한 Circuit Breaker와 Bulkhead에만 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResilienceManager {

    private static final Logger log = LoggerFactory.getLogger(ResilienceManager.class);

    private final String name;
    private final ResilienceConfig config;
    private final CircuitBreaker circuitBreaker;
    private final Bulkhead bulkhead;
    private final TimeoutPolicy timeoutPolicy;

    /**
     * 생성자 (팩토리로 컴포넌트 생성).
     *
     * @param name 매니저 이름 (Circuit Breaker, Bulkhead 이름과 동일)
     * @param config 설정
     * @param factory 컴포넌트 팩토리
     * @throws IllegalArgumentException 인자가 null이거나 이름이 비어 있는 경우
     */
    public ResilienceManager(String name, ResilienceConfig config, ResilienceComponentFactory factory) {
        this(
            name,
            config,
            createCircuitBreaker(name, config, factory),
            createBulkhead(name, config, factory),
            createTimeoutPolicy(name, config, factory)
        );
    }

    /**
     * 생성자 (컴포넌트 직접 주입).
     *
     * <p>null 컴포넌트는 NoOp 구현으로 대체됩니다.</p>
     *
     * @param name 매니저 이름
     * @param config 설정
     * @param circuitBreaker Circuit Breaker (null이면 비활성)
     * @param bulkhead Bulkhead (null이면 비활성)
     * @param timeoutPolicy Timeout Policy (null이면 타임아웃 없음)
     * @throws IllegalArgumentException name 또는 config가 유효하지 않은 경우
     */
    ResilienceManager(String name, ResilienceConfig config,
                      CircuitBreaker circuitBreaker, Bulkhead bulkhead, TimeoutPolicy timeoutPolicy) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.name = name;
        this.config = config;
        this.circuitBreaker = circuitBreaker != null ? circuitBreaker : new NoOpCircuitBreaker(name);
        this.bulkhead = bulkhead != null ? bulkhead : new NoOpBulkhead(name);
        this.timeoutPolicy = timeoutPolicy != null ? timeoutPolicy : new NoOpTimeoutPolicy();

        log.debug("Resilience manager initialized: name={}, circuitBreakerEnabled={}, bulkheadEnabled={}",
            name, isCircuitBreakerEnabled(), isBulkheadEnabled());
    }

    private static CircuitBreaker createCircuitBreaker(String name, ResilienceConfig config,
                                                       ResilienceComponentFactory factory) {
        validateFactoryArguments(name, config, factory);
        return config.circuitBreakerEnabled() ? factory.createCircuitBreaker(name, config.circuitBreaker()) : null;
    }

    private static Bulkhead createBulkhead(String name, ResilienceConfig config,
                                           ResilienceComponentFactory factory) {
        validateFactoryArguments(name, config, factory);
        return config.bulkheadEnabled() ? factory.createBulkhead(name, config.bulkhead()) : null;
    }

    private static TimeoutPolicy createTimeoutPolicy(String name, ResilienceConfig config,
                                                     ResilienceComponentFactory factory) {
        validateFactoryArguments(name, config, factory);
        return config.circuitBreakerEnabled() ? factory.timeoutPolicy() : null;
    }

    private static void validateFactoryArguments(String name, ResilienceConfig config,
                                                 ResilienceComponentFactory factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
    }

    /**
     * 보호 대상 함수 실행.
     *
     * @param call 보호 대상 함수
     * @param <T> 결과 타입
     * @return 함수 결과
     * @throws com.ryuqq.resilience.core.exception.CircuitOpenException 회로가 열려 있는 경우
     * @throws com.ryuqq.resilience.core.exception.BulkheadRejectedException 용량과 대기열이 가득 찬 경우
     * @throws com.ryuqq.resilience.core.exception.OperationTimeoutException 타임아웃 초과 시
     * @throws InterruptedException 대기 중 호출 스레드가 인터럽트된 경우
     * @throws Exception 함수가 던진 예외 (변경 없이 전파)
     */
    public <T> T execute(Callable<T> call) throws Exception {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }

        // 1. 회로 진입 (OPEN이면 여기서 실패, Bulkhead 슬롯 미소비)
        CircuitPermit permit = circuitBreaker.tryAcquire();

        boolean classified = false;
        try {
            // 2. Bulkhead 진입
            BulkheadPermit slot = bulkhead.acquire();
            SlotHoldingCall<T> guarded = new SlotHoldingCall<>(call, slot);

            try {
                // 3. 함수 자체에 타임아웃 적용, 슬롯은 함수 종료 시 반환
                T result = timeoutPolicy.execute(guarded, config.circuitBreaker().timeoutMs(), name);
                circuitBreaker.recordSuccess(permit);
                classified = true;
                return result;

            } catch (InterruptedException e) {
                // 호출자 취소: 다운스트림 실패로 분류하지 않음
                guarded.abandon(e);
                throw e;

            } catch (Exception | Error e) {
                guarded.abandon(e);
                if (guarded.wasInvoked()) {
                    circuitBreaker.recordFailure(permit, e);
                    classified = true;
                }
                throw e;
            }

        } finally {
            if (!classified) {
                circuitBreaker.releasePermission(permit);
            }
        }
    }

    /**
     * 통합 통계 조회.
     *
     * @return Circuit Breaker + Bulkhead 통계 (비활성화된 계층은 null)
     */
    public ResilienceStats getStats() {
        return new ResilienceStats(
            name,
            isCircuitBreakerEnabled() ? circuitBreaker.getStats() : null,
            isBulkheadEnabled() ? bulkhead.getStats() : null
        );
    }

    /**
     * 관리자 리셋.
     *
     * <p>Circuit Breaker를 강제로 CLOSED 전이하고 카운터를 0으로 초기화하며,
     * Bulkhead 대기열을 정리합니다. 일반적인 실패 처리 경로에서는 사용하지 않습니다.</p>
     */
    public void reset() {
        circuitBreaker.reset();
        bulkhead.clear();
        log.info("Resilience manager reset: name={}", name);
    }

    public String getName() {
        return name;
    }

    public ResilienceConfig getConfig() {
        return config;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Bulkhead getBulkhead() {
        return bulkhead;
    }

    public boolean isCircuitBreakerEnabled() {
        return !(circuitBreaker instanceof NoOpCircuitBreaker);
    }

    public boolean isBulkheadEnabled() {
        return !(bulkhead instanceof NoOpBulkhead);
    }
}
