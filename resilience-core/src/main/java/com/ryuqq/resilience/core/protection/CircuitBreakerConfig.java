package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: OPEN 전이를 위한 실패 횟수 (기본 5)</li>
 *   <li>windowMs: 실패를 누적하는 롤링 윈도우 (기본 60000ms)</li>
 *   <li>resetTimeoutMs: OPEN 유지 시간, 경과 후 HALF_OPEN (기본 30000ms)</li>
 *   <li>timeoutMs: 개별 호출 타임아웃 (기본 3000ms, 0은 타임아웃 없음)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param failureThreshold OPEN 전이 실패 임계값 (1 이상)
 * @param windowMs 롤링 윈도우 (밀리초, 양수)
 * @param resetTimeoutMs OPEN → HALF_OPEN 대기 시간 (밀리초, 양수)
 * @param timeoutMs 호출 타임아웃 (밀리초, 0 이상)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    long windowMs,
    long resetTimeoutMs,
    long timeoutMs
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_WINDOW_MS = 60_000;
    public static final long DEFAULT_RESET_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_TIMEOUT_MS = 3_000;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, windowMs=60000ms, resetTimeoutMs=30000ms, timeoutMs=3000ms</p>
     */
    public CircuitBreakerConfig() {
        this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_WINDOW_MS, DEFAULT_RESET_TIMEOUT_MS, DEFAULT_TIMEOUT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException(
                "windowMs must be positive (current: " + windowMs + ")"
            );
        }
        if (resetTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "resetTimeoutMs must be positive (current: " + resetTimeoutMs + ")"
            );
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException(
                "timeoutMs cannot be negative (current: " + timeoutMs + ")"
            );
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, windowMs, resetTimeoutMs, timeoutMs);
    }

    /**
     * windowMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withWindowMs(long windowMs) {
        return new CircuitBreakerConfig(failureThreshold, windowMs, resetTimeoutMs, timeoutMs);
    }

    /**
     * resetTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withResetTimeoutMs(long resetTimeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, windowMs, resetTimeoutMs, timeoutMs);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withTimeoutMs(long timeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, windowMs, resetTimeoutMs, timeoutMs);
    }
}
