package com.ryuqq.resilience.core.exception;

/**
 * 보호 계층 자체가 발생시키는 예외의 공통 상위 타입.
 *
 * <p>보호 대상 함수가 던진 예외는 이 타입으로 감싸지지 않고 그대로 전파됩니다.
 * 이 타입을 받았다면 실패 원인이 보호 계층(타임아웃, 회로 차단, 용량 초과)에 있다는 뜻입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class ResilienceException extends RuntimeException {

    protected ResilienceException(String message) {
        super(message);
    }

    protected ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }
}
