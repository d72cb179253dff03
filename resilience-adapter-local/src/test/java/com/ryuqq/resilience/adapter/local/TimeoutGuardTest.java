package com.ryuqq.resilience.adapter.local;

import com.ryuqq.resilience.core.exception.OperationTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TimeoutGuard 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class TimeoutGuardTest {

    private final TimeoutGuard guard = new TimeoutGuard();

    @AfterEach
    void tearDown() {
        guard.shutdown();
    }

    @Test
    void 마감_전에_끝나면_결과_반환() throws Exception {
        String result = guard.execute(() -> "fast", 1_000, "vector-search");

        assertThat(result).isEqualTo("fast");
    }

    @Test
    void 마감_초과시_timeoutMs_근처에서_OperationTimeoutException_및_인터럽트_전파() throws Exception {
        // given
        CountDownLatch interrupted = new CountDownLatch(1);
        long start = System.nanoTime();

        // when & then
        assertThatThrownBy(() -> guard.execute(() -> {
            try {
                Thread.sleep(5_000);
                return "late";
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
        }, 100, "llm-invoke"))
            .isInstanceOf(OperationTimeoutException.class)
            .hasMessage("Operation 'llm-invoke' timed out after 100ms")
            .satisfies(e -> assertThat(((OperationTimeoutException) e).getTimeoutMs()).isEqualTo(100));

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(90).isLessThan(2_000);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void 함수_예외는_벗겨서_그대로_전파() {
        IOException failure = new IOException("connection reset");

        assertThatThrownBy(() -> guard.execute(() -> {
            throw failure;
        }, 1_000, "http"))
            .isSameAs(failure);
    }

    @Test
    void timeoutMs가_0_이하이면_호출_스레드에서_직접_실행() throws Exception {
        Thread caller = Thread.currentThread();

        Thread executedOn = guard.execute(Thread::currentThread, 0, "db");

        assertThat(executedOn).isSameAs(caller);
    }

    @Test
    void 호출자_인터럽트시_InterruptedException_및_함수_취소() throws Exception {
        // given
        ExecutorService caller = Executors.newSingleThreadExecutor();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch cancelled = new CountDownLatch(1);

        try {
            Future<String> pending = caller.submit(() -> guard.execute(() -> {
                started.countDown();
                try {
                    Thread.sleep(5_000);
                    return "never";
                } catch (InterruptedException e) {
                    cancelled.countDown();
                    throw e;
                }
            }, 10_000, "llm-stream"));
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

            // when
            pending.cancel(true);

            // then
            assertThat(cancelled.await(2, TimeUnit.SECONDS)).isTrue();
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void 외부_ExecutorService는_shutdown하지_않음() throws Exception {
        ExecutorService external = Executors.newSingleThreadExecutor();
        try {
            TimeoutGuard borrowed = new TimeoutGuard(external);

            borrowed.shutdown();

            assertThat(external.isShutdown()).isFalse();
            assertThat(borrowed.execute(() -> "still running", 1_000, "http")).isEqualTo("still running");
        } finally {
            external.shutdownNow();
        }
    }

    @Test
    void shutdown_후에는_새_호출을_받지_않음() {
        guard.shutdown();

        assertThatThrownBy(() -> guard.execute(() -> "x", 1_000, "http"))
            .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void 함수_Error는_그대로_전파() {
        assertThatThrownBy(() -> guard.execute(() -> {
            throw new AssertionError("bug");
        }, 1_000, "db"))
            .isInstanceOf(AssertionError.class)
            .isNotInstanceOf(ExecutionException.class);
    }
}
