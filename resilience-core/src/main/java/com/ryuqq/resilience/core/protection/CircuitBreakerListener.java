package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 관측 훅.
 *
 * <p>리스너는 best-effort이며 Circuit Breaker 동작(상태 전이, 카운터)에 영향을 주지 않습니다.
 * 구현체는 빠르고 비블로킹이어야 하며, 여러 스레드에서 동시에 호출될 수 있습니다.</p>
 *
 * <p>리스너가 던진 예외는 Circuit Breaker 구현체가 포착하여 로깅하며,
 * 호출자에게 전파되지 않습니다.</p>
 *
 * <p>상태 전이 콜백은 내부 잠금을 해제한 뒤에 호출됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CircuitBreakerListener {

    /**
     * 아무 동작도 하지 않는 리스너.
     */
    CircuitBreakerListener NOOP = new CircuitBreakerListener() {
    };

    /**
     * 상태가 변경되었을 때 호출 (open/halfOpen/close 콜백보다 먼저).
     *
     * @param name Circuit Breaker 이름
     * @param from 이전 상태
     * @param to 새 상태
     */
    default void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to) {}

    /**
     * OPEN으로 전이했을 때 호출.
     *
     * @param name Circuit Breaker 이름
     * @param failures 전이 시점의 윈도우 내 실패 횟수
     */
    default void onOpen(String name, int failures) {}

    /**
     * HALF_OPEN으로 전이했을 때 호출 (리셋 타이머 만료).
     *
     * @param name Circuit Breaker 이름
     */
    default void onHalfOpen(String name) {}

    /**
     * HALF_OPEN 시험 호출 성공으로 CLOSED 전이했을 때 호출.
     *
     * @param name Circuit Breaker 이름
     */
    default void onClose(String name) {}

    /**
     * 보호 대상 호출이 성공했을 때 호출.
     *
     * @param name Circuit Breaker 이름
     */
    default void onSuccess(String name) {}

    /**
     * 보호 대상 호출이 실패(타임아웃 포함)했을 때 호출.
     *
     * @param name Circuit Breaker 이름
     * @param error 발생한 예외
     */
    default void onFailure(String name, Throwable error) {}

    /**
     * 요청이 fail-fast로 거부되었을 때 호출.
     *
     * @param name Circuit Breaker 이름
     * @param state 거부 시점 상태 (OPEN 또는 HALF_OPEN)
     */
    default void onReject(String name, CircuitBreakerState state) {}

    /**
     * 관리자 리셋이 수행되었을 때 호출.
     *
     * @param name Circuit Breaker 이름
     */
    default void onReset(String name) {}
}
