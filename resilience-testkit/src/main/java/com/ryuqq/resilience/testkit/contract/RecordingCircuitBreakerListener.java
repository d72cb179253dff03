package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.protection.CircuitBreakerListener;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Circuit breaker listener that records every event as a short string.
 *
 * <p>Event format: {@code "<type>:<name>[:<detail>]"}, for example
 * {@code "open:llm:3"} or {@code "stateChange:llm:OPEN->HALF_OPEN"}.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RecordingCircuitBreakerListener implements CircuitBreakerListener {

    private final List<String> events = new CopyOnWriteArrayList<>();

    @Override
    public void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to) {
        events.add("stateChange:" + name + ":" + from + "->" + to);
    }

    @Override
    public void onOpen(String name, int failures) {
        events.add("open:" + name + ":" + failures);
    }

    @Override
    public void onHalfOpen(String name) {
        events.add("halfOpen:" + name);
    }

    @Override
    public void onClose(String name) {
        events.add("close:" + name);
    }

    @Override
    public void onSuccess(String name) {
        events.add("success:" + name);
    }

    @Override
    public void onFailure(String name, Throwable error) {
        events.add("failure:" + name);
    }

    @Override
    public void onReject(String name, CircuitBreakerState state) {
        events.add("reject:" + name + ":" + state);
    }

    @Override
    public void onReset(String name) {
        events.add("reset:" + name);
    }

    /**
     * Returns a snapshot of the recorded events in arrival order.
     */
    public List<String> events() {
        return List.copyOf(events);
    }

    /**
     * Counts recorded events whose string starts with the given prefix.
     *
     * @param prefix event prefix (e.g. "open:llm")
     * @return number of matching events
     */
    public long count(String prefix) {
        return events.stream().filter(event -> event.startsWith(prefix)).count();
    }

    public void clear() {
        events.clear();
    }
}
