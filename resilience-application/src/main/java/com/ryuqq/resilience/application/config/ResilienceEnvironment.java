package com.ryuqq.resilience.application.config;

import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 환경 변수 기반 기본 Circuit Breaker 설정.
 *
 * <p><strong>지원 변수 (밀리초):</strong></p>
 * <ul>
 *   <li>{@code CIRCUIT_BREAKER_TIMEOUT}: timeoutMs</li>
 *   <li>{@code CIRCUIT_BREAKER_RESET_TIMEOUT}: resetTimeoutMs</li>
 * </ul>
 *
 * <p>지정되지 않은 값은 {@link CircuitBreakerConfig} 기본값을 사용합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResilienceEnvironment {

    private static final Logger log = LoggerFactory.getLogger(ResilienceEnvironment.class);

    public static final String CIRCUIT_BREAKER_TIMEOUT = "CIRCUIT_BREAKER_TIMEOUT";
    public static final String CIRCUIT_BREAKER_RESET_TIMEOUT = "CIRCUIT_BREAKER_RESET_TIMEOUT";

    private ResilienceEnvironment() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 변수 맵에서 기본 설정 생성.
     *
     * @param env 변수 맵
     * @return Circuit Breaker 설정
     * @throws IllegalArgumentException 값이 숫자가 아니거나 설정 검증에 실패한 경우
     */
    public static CircuitBreakerConfig from(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }

        CircuitBreakerConfig config = new CircuitBreakerConfig();
        Long timeoutMs = parseMillis(env, CIRCUIT_BREAKER_TIMEOUT);
        if (timeoutMs != null) {
            config = config.withTimeoutMs(timeoutMs);
        }
        Long resetTimeoutMs = parseMillis(env, CIRCUIT_BREAKER_RESET_TIMEOUT);
        if (resetTimeoutMs != null) {
            config = config.withResetTimeoutMs(resetTimeoutMs);
        }

        log.debug("Circuit breaker defaults from environment: {}", config);
        return config;
    }

    /**
     * 프로세스 환경 변수에서 기본 설정 생성.
     *
     * @return Circuit Breaker 설정
     */
    public static CircuitBreakerConfig fromSystemEnvironment() {
        return from(System.getenv());
    }

    private static Long parseMillis(Map<String, String> env, String variable) {
        String raw = env.get(variable);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                variable + " must be a number of milliseconds (current: " + raw + ")", e);
        }
    }
}
