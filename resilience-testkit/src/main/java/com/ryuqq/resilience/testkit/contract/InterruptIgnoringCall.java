package com.ryuqq.resilience.testkit.contract;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Protected function that busy-waits and never reacts to interruption.
 *
 * <p>Stands in for blocking client I/O that keeps running after the caller has
 * timed out. Tracks how many bodies run at the same time.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InterruptIgnoringCall implements Callable<String> {

    private final String result;
    private final long runMs;
    private final AtomicBoolean released = new AtomicBoolean();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();

    /**
     * @param result value returned when the body finishes
     * @param runMs how long each body spins unless released earlier
     */
    public InterruptIgnoringCall(String result, long runMs) {
        this.result = result;
        this.runMs = runMs;
    }

    @Override
    public String call() {
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        try {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(runMs);
            while (!released.get() && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            return result;
        } finally {
            running.decrementAndGet();
            completed.incrementAndGet();
        }
    }

    /**
     * Lets every current and future body finish immediately.
     */
    public void release() {
        released.set(true);
    }

    public int runningCount() {
        return running.get();
    }

    /**
     * Highest number of bodies observed running at the same time.
     */
    public int maxRunningCount() {
        return maxRunning.get();
    }

    public int completedCount() {
        return completed.get();
    }
}
