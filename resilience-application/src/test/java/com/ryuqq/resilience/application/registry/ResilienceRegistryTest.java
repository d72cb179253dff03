package com.ryuqq.resilience.application.registry;

import com.ryuqq.resilience.application.manager.ResilienceComponentFactory;
import com.ryuqq.resilience.application.manager.ResilienceConfig;
import com.ryuqq.resilience.application.manager.ResilienceManager;
import com.ryuqq.resilience.application.manager.ResilienceStats;
import com.ryuqq.resilience.application.profile.ServiceProfile;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import com.ryuqq.resilience.core.protection.noop.NoOpBulkhead;
import com.ryuqq.resilience.core.protection.noop.NoOpTimeoutPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ResilienceRegistry 유닛 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class ResilienceRegistryTest {

    private RecordingFactory factory;
    private ResilienceRegistry registry;

    @BeforeEach
    void setUp() {
        factory = new RecordingFactory();
        registry = new ResilienceRegistry(factory);
    }

    // ============================================================
    // 1. 조회 또는 생성
    // ============================================================

    @Test
    void getOrCreate_같은_이름은_같은_인스턴스() {
        ResilienceManager first = registry.getOrCreate("vector-search");
        ResilienceManager second = registry.getOrCreate("vector-search");

        assertThat(second).isSameAs(first);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(factory.circuitBreakersCreated.get()).isEqualTo(1);
    }

    @Test
    void getOrCreate_기존_이름이면_새_설정은_무시() {
        ResilienceConfig original = new ResilienceConfig();
        ResilienceConfig other = original.withCircuitBreaker(new CircuitBreakerConfig().withFailureThreshold(9));

        ResilienceManager first = registry.getOrCreate("db", original);
        ResilienceManager second = registry.getOrCreate("db", other);

        assertThat(second).isSameAs(first);
        assertThat(second.getConfig()).isEqualTo(original);
    }

    @Test
    void getOrCreate_동시_호출에도_한번만_생성() throws Exception {
        // given
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ResilienceManager>> futures = new ArrayList<>();

        try {
            // when
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return registry.getOrCreate("shared");
                }));
            }
            start.countDown();

            Set<ResilienceManager> distinct = ConcurrentHashMap.newKeySet();
            for (Future<ResilienceManager> future : futures) {
                distinct.add(future.get(5, TimeUnit.SECONDS));
            }

            // then
            assertThat(distinct).hasSize(1);
            assertThat(factory.circuitBreakersCreated.get()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void getOrCreate_프로필은_유형_접두어_키와_기본_설정_사용() {
        ResilienceManager manager = registry.getOrCreate(ServiceProfile.LLM, "openai-gpt4");

        assertThat(manager.getName()).isEqualTo("llm:openai-gpt4");
        assertThat(manager.getConfig()).isEqualTo(ServiceProfile.LLM.defaultConfig());
        assertThat(registry.find("llm:openai-gpt4")).containsSame(manager);
    }

    @Test
    void getOrCreate_빈_이름은_IllegalArgumentException() {
        assertThatThrownBy(() -> registry.getOrCreate(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.getOrCreate("x", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void find_없는_이름은_empty() {
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    // ============================================================
    // 2. 집계
    // ============================================================

    @Test
    void getAll_getAllStats_이름순으로_반환() {
        registry.getOrCreate("webhook");
        registry.getOrCreate("db");
        registry.getOrCreate("llm");

        Map<String, ResilienceManager> all = registry.getAll();
        Map<String, ResilienceStats> stats = registry.getAllStats();

        assertThat(all.keySet()).containsExactly("db", "llm", "webhook");
        assertThat(stats.keySet()).containsExactly("db", "llm", "webhook");
        assertThat(stats.get("db").state()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void health_열린_회로가_있으면_unhealthy() {
        // given
        factory.stateFor("llm:down", CircuitBreakerState.OPEN);
        registry.getOrCreate("llm:down");
        registry.getOrCreate("vector:up");

        // when
        CircuitHealth health = registry.health();

        // then
        assertThat(health.healthy()).isFalse();
        assertThat(health.openCircuits()).containsExactly("llm:down");
        assertThat(health.totalCircuits()).isEqualTo(2);
    }

    @Test
    void health_빈_레지스트리는_healthy() {
        CircuitHealth health = registry.health();

        assertThat(health.healthy()).isTrue();
        assertThat(health.openCircuits()).isEmpty();
        assertThat(health.totalCircuits()).isZero();
    }

    @Test
    void resetAll_모든_회로_리셋() {
        registry.getOrCreate("a");
        registry.getOrCreate("b");

        registry.resetAll();

        factory.breakers.values().forEach(cb -> verify(cb).reset());
    }

    @Test
    void shutdown_리셋_후_등록_해제하고_팩토리_종료() {
        registry.getOrCreate("a");

        registry.shutdown();

        assertThat(registry.size()).isZero();
        assertThat(factory.shutdownCalled).isTrue();
        verify(factory.breakers.get("a")).reset();
    }

    /**
     * Circuit Breaker는 Mockito mock으로, 나머지는 NoOp으로 생성하는 팩토리.
     */
    private static final class RecordingFactory implements ResilienceComponentFactory {

        private final AtomicInteger circuitBreakersCreated = new AtomicInteger();
        private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
        private final Map<String, CircuitBreakerState> states = new ConcurrentHashMap<>();
        private volatile boolean shutdownCalled;

        void stateFor(String name, CircuitBreakerState state) {
            states.put(name, state);
        }

        @Override
        public CircuitBreaker createCircuitBreaker(String name, CircuitBreakerConfig config) {
            circuitBreakersCreated.incrementAndGet();
            CircuitBreaker breaker = mock(CircuitBreaker.class);
            when(breaker.getState()).thenReturn(states.getOrDefault(name, CircuitBreakerState.CLOSED));
            breakers.put(name, breaker);
            return breaker;
        }

        @Override
        public Bulkhead createBulkhead(String name, BulkheadConfig config) {
            return new NoOpBulkhead(name);
        }

        @Override
        public TimeoutPolicy timeoutPolicy() {
            return new NoOpTimeoutPolicy();
        }

        @Override
        public void shutdown() {
            shutdownCalled = true;
        }
    }
}
