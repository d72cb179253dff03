package com.ryuqq.resilience.core.protection;

import java.util.concurrent.Callable;

/**
 * Timeout Policy SPI.
 *
 * <p>보호 대상 함수를 마감 시간과 경주시켜 무한 대기를 방지합니다.
 * 상태가 없는 순수 실행 래퍼입니다.</p>
 *
 * <p><strong>타임아웃 동작:</strong></p>
 * <ul>
 *   <li>함수가 먼저 끝나면 그 결과 또는 예외를 그대로 반환</li>
 *   <li>마감 시간이 먼저 도래하면 함수 종료를 기다리지 않고 {@code OperationTimeoutException}</li>
 *   <li>타임아웃 시 구현체는 실행 중인 함수에 취소(인터럽트)를 전파</li>
 *   <li>timeoutMs가 0 이하이면 마감 시간 없이 호출 스레드에서 직접 실행</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * TimeoutPolicy policy = ...;
 *
 * String answer = policy.execute(() -> model.invoke(messages), 30_000, "llm-chat-completion");
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface TimeoutPolicy {

    /**
     * 마감 시간을 적용하여 함수 실행.
     *
     * @param call 보호 대상 함수
     * @param timeoutMs 타임아웃 (밀리초), 0 이하는 타임아웃 없음
     * @param operation 작업 이름 (오류 메시지 및 로깅용)
     * @param <T> 결과 타입
     * @return 함수 결과
     * @throws com.ryuqq.resilience.core.exception.OperationTimeoutException 마감 시간 초과 시
     * @throws InterruptedException 결과를 기다리는 중 호출 스레드가 인터럽트된 경우
     * @throws Exception 함수가 던진 예외 (변경 없이 전파)
     */
    <T> T execute(Callable<T> call, long timeoutMs, String operation) throws Exception;
}
