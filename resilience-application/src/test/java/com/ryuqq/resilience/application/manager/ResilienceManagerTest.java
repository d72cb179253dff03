package com.ryuqq.resilience.application.manager;

import com.ryuqq.resilience.core.exception.BulkheadRejectedException;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.exception.OperationTimeoutException;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadPermit;
import com.ryuqq.resilience.core.protection.BulkheadStats;
import com.ryuqq.resilience.core.protection.BulkheadTier;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;
import com.ryuqq.resilience.core.protection.CircuitPermit;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * ResilienceManager 유닛 테스트.
 *
 * <p>보호 계층 합성 순서와 결과 분류를 검증합니다:</p>
 * <ul>
 *   <li>tryAcquire → Bulkhead → Timeout → 함수</li>
 *   <li>함수 실패(Error 포함)와 타임아웃만 Circuit Breaker 실패로 기록</li>
 *   <li>Bulkhead 슬롯은 함수가 끝날 때 반환</li>
 *   <li>함수에 도달하지 못한 호출은 퍼미션 반환</li>
 *   <li>비활성화된 계층은 NoOp으로 대체</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResilienceManagerTest {

    private static final String NAME = "llm";
    private static final CircuitPermit PERMIT = new CircuitPermit(4);

    @Mock
    private CircuitBreaker circuitBreaker;

    @Mock
    private Bulkhead bulkhead;

    @Mock
    private TimeoutPolicy timeoutPolicy;

    @Mock
    private BulkheadPermit slot;

    private ResilienceConfig config;
    private ResilienceManager manager;

    @BeforeEach
    void setUp() {
        config = new ResilienceConfig(
            new CircuitBreakerConfig(3, 10_000, 5_000, 1_000),
            BulkheadConfig.forTier(BulkheadTier.STANDARD)
        );
        manager = new ResilienceManager(NAME, config, circuitBreaker, bulkhead, timeoutPolicy);
    }

    private void admit() {
        when(circuitBreaker.tryAcquire()).thenReturn(PERMIT);
    }

    private void passThroughBulkhead() throws Exception {
        when(bulkhead.acquire()).thenReturn(slot);
    }

    private void passThroughTimeout() throws Exception {
        when(timeoutPolicy.execute(any(), anyLong(), anyString()))
            .thenAnswer(inv -> inv.<Callable<?>>getArgument(0).call());
    }

    // ============================================================
    // 1. 정상 경로
    // ============================================================

    @Test
    void execute_성공시_순서대로_통과하고_성공_기록() throws Exception {
        // given
        admit();
        passThroughBulkhead();
        passThroughTimeout();

        // when
        String result = manager.execute(() -> "answer");

        // then
        assertThat(result).isEqualTo("answer");
        InOrder inOrder = inOrder(circuitBreaker, bulkhead, timeoutPolicy, slot);
        inOrder.verify(circuitBreaker).tryAcquire();
        inOrder.verify(bulkhead).acquire();
        inOrder.verify(timeoutPolicy).execute(any(), eq(1_000L), eq(NAME));
        inOrder.verify(slot).release(null);
        inOrder.verify(circuitBreaker).recordSuccess(PERMIT);
        verify(circuitBreaker, never()).recordFailure(any(), any());
        verify(circuitBreaker, never()).releasePermission(any());
    }

    @Test
    void execute_null_함수는_IllegalArgumentException() {
        assertThatThrownBy(() -> manager.execute(null))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(circuitBreaker, bulkhead, timeoutPolicy);
    }

    // ============================================================
    // 2. 실패 분류
    // ============================================================

    @Test
    void execute_함수_예외는_그대로_전파되고_실패로_기록() throws Exception {
        // given
        admit();
        passThroughBulkhead();
        passThroughTimeout();
        IOException failure = new IOException("upstream 503");

        // when & then
        assertThatThrownBy(() -> manager.execute(() -> {
            throw failure;
        })).isSameAs(failure);

        verify(circuitBreaker).recordFailure(PERMIT, failure);
        verify(slot).release(failure);
        verify(circuitBreaker, never()).recordSuccess(any());
        verify(circuitBreaker, never()).releasePermission(any());
    }

    @Test
    void execute_함수가_던진_Error도_실패로_기록() throws Exception {
        // given
        admit();
        passThroughBulkhead();
        passThroughTimeout();
        OutOfMemoryError error = new OutOfMemoryError("embedding batch too large");

        // when & then
        assertThatThrownBy(() -> manager.execute(() -> {
            throw error;
        })).isSameAs(error);

        verify(circuitBreaker).recordFailure(PERMIT, error);
        verify(circuitBreaker, never()).releasePermission(any());
    }

    @Test
    void execute_타임아웃은_실패로_기록() throws Exception {
        // given
        admit();
        passThroughBulkhead();
        OperationTimeoutException timeout = new OperationTimeoutException(NAME, 1_000);
        when(timeoutPolicy.execute(any(), anyLong(), anyString())).thenAnswer(inv -> {
            inv.<Callable<?>>getArgument(0).call();
            throw timeout;
        });

        // when & then
        assertThatThrownBy(() -> manager.execute(() -> "late"))
            .isSameAs(timeout);
        verify(circuitBreaker).recordFailure(PERMIT, timeout);
    }

    @Test
    void execute_타임아웃_후에도_함수가_끝날_때까지_슬롯_유지() throws Exception {
        // given: 함수는 별도 스레드에서 계속 실행되고 호출자는 마감 시간에 먼저 반환
        admit();
        passThroughBulkhead();
        CountDownLatch finish = new CountDownLatch(1);
        OperationTimeoutException deadline = new OperationTimeoutException(NAME, 1_000);
        ExecutorService worker = Executors.newSingleThreadExecutor();
        when(timeoutPolicy.execute(any(), anyLong(), anyString())).thenAnswer(inv -> {
            Callable<?> guarded = inv.getArgument(0);
            CountDownLatch started = new CountDownLatch(1);
            worker.submit(() -> {
                started.countDown();
                return guarded.call();
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            throw deadline;
        });

        try {
            // when
            assertThatThrownBy(() -> manager.execute(() -> finish.await(5, TimeUnit.SECONDS)))
                .isSameAs(deadline);

            // then
            verify(circuitBreaker).recordFailure(PERMIT, deadline);
            verify(slot, after(100).never()).release(any());

            finish.countDown();
            verify(slot, timeout(5_000)).release(null);
        } finally {
            finish.countDown();
            worker.shutdownNow();
        }
    }

    @Test
    void execute_함수가_시작되기_전_실패는_분류하지_않고_슬롯과_퍼미션_반환() throws Exception {
        // given
        admit();
        passThroughBulkhead();
        RejectedExecutionException rejected = new RejectedExecutionException("timeout pool shut down");
        when(timeoutPolicy.execute(any(), anyLong(), anyString())).thenThrow(rejected);
        AtomicInteger invocations = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> manager.execute(invocations::incrementAndGet))
            .isSameAs(rejected);
        assertThat(invocations.get()).isZero();
        verify(slot).release(rejected);
        verify(circuitBreaker).releasePermission(PERMIT);
        verify(circuitBreaker, never()).recordFailure(any(), any());
    }

    @Test
    void execute_회로가_열려있으면_Bulkhead를_거치지_않음() {
        // given
        CircuitOpenException open = new CircuitOpenException(NAME, CircuitBreakerState.OPEN);
        when(circuitBreaker.tryAcquire()).thenThrow(open);
        AtomicInteger invocations = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> manager.execute(invocations::incrementAndGet))
            .isSameAs(open);
        assertThat(invocations.get()).isZero();
        verifyNoInteractions(bulkhead, timeoutPolicy);
        verify(circuitBreaker, never()).releasePermission(any());
        verify(circuitBreaker, never()).recordFailure(any(), any());
    }

    @Test
    void execute_Bulkhead_거부는_실패가_아니며_퍼미션_반환() throws Exception {
        // given
        admit();
        BulkheadRejectedException rejected =
            new BulkheadRejectedException(NAME, BulkheadTier.STANDARD, "queue full");
        when(bulkhead.acquire()).thenThrow(rejected);

        // when & then
        assertThatThrownBy(() -> manager.execute(() -> "never"))
            .isSameAs(rejected);
        verify(circuitBreaker).releasePermission(PERMIT);
        verify(circuitBreaker, never()).recordFailure(any(), any());
        verify(circuitBreaker, never()).recordSuccess(any());
        verifyNoInteractions(timeoutPolicy);
    }

    @Test
    void execute_호출자_인터럽트는_실패가_아니며_퍼미션_반환() throws Exception {
        // given
        admit();
        passThroughBulkhead();
        when(timeoutPolicy.execute(any(), anyLong(), anyString()))
            .thenThrow(new InterruptedException("cancelled"));

        // when & then
        assertThatThrownBy(() -> manager.execute(() -> "slow"))
            .isInstanceOf(InterruptedException.class);
        verify(circuitBreaker).releasePermission(PERMIT);
        verify(circuitBreaker, never()).recordFailure(any(), any());
        verify(slot).release(any(InterruptedException.class));
    }

    // ============================================================
    // 3. 비활성화된 계층
    // ============================================================

    @Test
    void 두_계층_모두_비활성화면_함수를_그대로_호출() throws Exception {
        // given
        ResilienceManager bare = new ResilienceManager(NAME, config, null, null, null);

        // when
        String result = bare.execute(() -> "direct");

        // then
        assertThat(result).isEqualTo("direct");
        assertThat(bare.isCircuitBreakerEnabled()).isFalse();
        assertThat(bare.isBulkheadEnabled()).isFalse();
        ResilienceStats stats = bare.getStats();
        assertThat(stats.circuitBreaker()).isNull();
        assertThat(stats.bulkhead()).isNull();
        assertThat(stats.state()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 팩토리는_활성화된_계층만_생성() throws Exception {
        // given
        ResilienceComponentFactory factory = mock(ResilienceComponentFactory.class);
        when(factory.createBulkhead(NAME, config.bulkhead())).thenReturn(bulkhead);
        passThroughBulkhead();
        ResilienceConfig bulkheadOnly = config.withCircuitBreakerEnabled(false);

        // when
        ResilienceManager created = new ResilienceManager(NAME, bulkheadOnly, factory);
        String result = created.execute(() -> "ok");

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(created.isCircuitBreakerEnabled()).isFalse();
        assertThat(created.isBulkheadEnabled()).isTrue();
        verify(factory, never()).createCircuitBreaker(anyString(), any());
        verify(factory, never()).timeoutPolicy();
    }

    @Test
    void 팩토리가_null이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new ResilienceManager(NAME, config, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("factory");
    }

    // ============================================================
    // 4. 통계 및 리셋
    // ============================================================

    @Test
    void getStats_두_계층_통계를_합친다() {
        // given
        Instant changedAt = Instant.parse("2026-01-01T00:00:00Z");
        when(circuitBreaker.getStats()).thenReturn(
            new CircuitBreakerStats(CircuitBreakerState.OPEN, 3, 7, 2, changedAt, changedAt));
        when(bulkhead.getStats()).thenReturn(
            new BulkheadStats(BulkheadTier.STANDARD, 4, 10, 1, 20, 11, 0));

        // when
        ResilienceStats stats = manager.getStats();

        // then
        assertThat(stats.name()).isEqualTo(NAME);
        assertThat(stats.state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(stats.failures()).isEqualTo(3);
        assertThat(stats.successes()).isEqualTo(7);
        assertThat(stats.rejections()).isEqualTo(2);
        assertThat(stats.lastStateChange()).isEqualTo(changedAt);
        assertThat(stats.activeCount()).isEqualTo(4);
        assertThat(stats.queueLength()).isEqualTo(1);
    }

    @Test
    void reset_회로를_닫고_대기열을_정리() {
        // when
        manager.reset();

        // then
        verify(circuitBreaker).reset();
        verify(bulkhead).clear();
    }
}
