package com.ryuqq.resilience.core.exception;

/**
 * 보호 대상 호출이 마감 시간을 넘겼을 때 발생하는 예외.
 *
 * <p>Circuit Breaker는 이 예외를 실패로 분류합니다.
 * 함수는 백그라운드에서 계속 실행될 수 있으며, 그 결과는 폐기됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class OperationTimeoutException extends ResilienceException {

    private final String operation;
    private final long timeoutMs;

    /**
     * 생성자.
     *
     * @param operation 작업 이름
     * @param timeoutMs 적용된 타임아웃 (밀리초)
     */
    public OperationTimeoutException(String operation, long timeoutMs) {
        super("Operation '" + operation + "' timed out after " + timeoutMs + "ms");
        this.operation = operation;
        this.timeoutMs = timeoutMs;
    }

    public String getOperation() {
        return operation;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
