package com.ryuqq.resilience.testkit.contract;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Protected function that blocks until the test releases it.
 *
 * <p>Used to hold bulkhead slots or a half-open trial open while the test
 * issues concurrent calls.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class BlockingCall implements Callable<String> {

    private final String result;
    private final String failureMessage;
    private final CountDownLatch release = new CountDownLatch(1);
    private final AtomicInteger started = new AtomicInteger();

    public BlockingCall(String result) {
        this(result, null);
    }

    private BlockingCall(String result, String failureMessage) {
        this.result = result;
        this.failureMessage = failureMessage;
    }

    /**
     * Blocks like {@link #BlockingCall(String)} but throws {@link IOException} once released.
     *
     * @param message failure message
     * @return failing blocking call
     */
    public static BlockingCall failing(String message) {
        return new BlockingCall(null, message);
    }

    @Override
    public String call() throws Exception {
        started.incrementAndGet();
        if (!release.await(10, TimeUnit.SECONDS)) {
            throw new IllegalStateException("BlockingCall was never released");
        }
        if (failureMessage != null) {
            throw new IOException(failureMessage);
        }
        return result;
    }

    /**
     * Lets every current and future invocation return.
     */
    public void release() {
        release.countDown();
    }

    /**
     * Number of invocations that reached the function body.
     */
    public int startedCount() {
        return started.get();
    }

    /**
     * Waits until at least {@code expected} invocations have started.
     *
     * @param expected number of started invocations
     * @param timeoutMs maximum wait
     * @return true if reached in time
     * @throws InterruptedException if interrupted while polling
     */
    public boolean awaitStarted(int expected, long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (started.get() < expected) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }
}
