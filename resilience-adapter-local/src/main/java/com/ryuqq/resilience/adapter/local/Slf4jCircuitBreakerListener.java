package com.ryuqq.resilience.adapter.local;

import com.ryuqq.resilience.core.protection.CircuitBreakerListener;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Circuit Breaker 이벤트를 SLF4J로 기록하는 리스너.
 *
 * <p><strong>로그 레벨:</strong></p>
 * <ul>
 *   <li>OPEN 전이: ERROR</li>
 *   <li>HALF_OPEN 전이, 호출 거부: WARN</li>
 *   <li>상태 변경, CLOSED 전이, 리셋: INFO</li>
 *   <li>실패: DEBUG</li>
 *   <li>성공: TRACE</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class Slf4jCircuitBreakerListener implements CircuitBreakerListener {

    private static final Logger log = LoggerFactory.getLogger(Slf4jCircuitBreakerListener.class);

    @Override
    public void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to) {
        log.info("Circuit breaker {} state changed: {} → {}", name, from, to);
    }

    @Override
    public void onOpen(String name, int failures) {
        log.error("Circuit breaker {} opened after {} failures", name, failures);
    }

    @Override
    public void onHalfOpen(String name) {
        log.warn("Circuit breaker {} half-open, admitting trial call", name);
    }

    @Override
    public void onClose(String name) {
        log.info("Circuit breaker {} closed, service healthy", name);
    }

    @Override
    public void onSuccess(String name) {
        log.trace("Circuit breaker {} recorded success", name);
    }

    @Override
    public void onFailure(String name, Throwable error) {
        log.debug("Circuit breaker {} recorded failure: {}", name, error == null ? null : error.toString());
    }

    @Override
    public void onReject(String name, CircuitBreakerState state) {
        log.warn("Circuit breaker {} rejected call, circuit is {}", name, state);
    }

    @Override
    public void onReset(String name) {
        log.info("Circuit breaker {} reset", name);
    }
}
