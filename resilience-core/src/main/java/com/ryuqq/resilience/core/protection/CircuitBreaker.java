package com.ryuqq.resilience.core.protection;

import java.util.concurrent.Callable;

/**
 * Circuit Breaker SPI.
 *
 * <p>다운스트림 호출(LLM, 벡터 검색, DB, HTTP/웹훅)의 실패를 추적하고, 임계값 초과 시
 * 빠르게 실패(Fail-Fast)하여 장애가 전체 시스템으로 전파되는 것을 방지합니다.</p>
 *
 * <p>Circuit Breaker는 함수에 묶이지 않습니다. 보호 대상 함수는 {@link #execute(Callable)}
 * 호출 시점에만 전달됩니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 롤링 윈도우 내 실패 횟수 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 시험 호출 1건으로 복구 확인</li>
 * </ul>
 *
 * <p><strong>퍼미션 프로토콜:</strong> 다른 보호 계층(예: Bulkhead)을 진입 허용과 실제 호출 사이에
 * 끼워 넣어야 하는 경우 {@code execute} 대신 아래 순서로 사용합니다.</p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 *
 * CircuitPermit permit = cb.tryAcquire();   // OPEN이면 CircuitOpenException
 * try {
 *     Result result = timeoutPolicy.execute(call, timeoutMs, "llm");
 *     cb.recordSuccess(permit);
 *     return result;
 * } catch (BulkheadRejectedException e) {
 *     cb.releasePermission(permit);         // 실패로 분류하지 않음
 *     throw e;
 * } catch (Exception | Error e) {
 *     cb.recordFailure(permit, e);
 *     throw e;
 * }
 * }</pre>
 *
 * <p>결과 기록 메서드는 반드시 {@code tryAcquire()}가 돌려준 토큰과 함께 호출합니다.
 * HALF_OPEN 상태의 시험 슬롯과 회로 닫기는 시험 호출 토큰만 결정합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 이름 조회.
     *
     * @return 이름 (로깅 및 레지스트리 키)
     */
    String getName();

    /**
     * 보호 대상 함수를 Circuit Breaker와 타임아웃으로 감싸 실행.
     *
     * <ol>
     *   <li>OPEN: 함수를 호출하지 않고 즉시 {@code CircuitOpenException}, 거부 카운터 증가</li>
     *   <li>그 외: 설정된 timeoutMs로 함수 실행</li>
     *   <li>성공: 성공 카운터 증가, HALF_OPEN이었다면 CLOSED 전이</li>
     *   <li>실패(타임아웃 포함): 실패 기록 후 예외를 그대로 전파</li>
     * </ol>
     *
     * @param call 보호 대상 함수
     * @param <T> 결과 타입
     * @return 함수 결과
     * @throws com.ryuqq.resilience.core.exception.CircuitOpenException OPEN 상태이거나 HALF_OPEN 시험 호출이 진행 중인 경우
     * @throws com.ryuqq.resilience.core.exception.OperationTimeoutException 타임아웃 초과 시
     * @throws Exception 함수가 던진 예외 (변경 없이 전파)
     */
    <T> T execute(Callable<T> call) throws Exception;

    /**
     * 호출 진입 허용 획득.
     *
     * <ul>
     *   <li>CLOSED: 항상 허용 ({@link CircuitPermit#STANDARD})</li>
     *   <li>OPEN: 거부 카운터 증가 후 {@code CircuitOpenException}</li>
     *   <li>HALF_OPEN: 진행 중인 시험 호출이 없으면 새 시험 토큰 발급, 있으면 거부</li>
     * </ul>
     *
     * <p>허용된 호출은 반드시 {@link #recordSuccess(CircuitPermit)}, {@link #recordFailure(CircuitPermit, Throwable)},
     * {@link #releasePermission(CircuitPermit)} 중 하나로 종료되어야 합니다.</p>
     *
     * @return 진입 허용 토큰
     * @throws com.ryuqq.resilience.core.exception.CircuitOpenException 허용되지 않은 경우
     */
    CircuitPermit tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>성공 카운터는 항상 증가</li>
     *   <li>HALF_OPEN + 현재 시험 토큰: CLOSED로 전이하고 실패 카운트를 0으로 초기화</li>
     *   <li>HALF_OPEN + 일반 토큰 (OPEN 이전에 허용된 호출): 상태 변경 없음</li>
     * </ul>
     *
     * @param permit {@link #tryAcquire()}가 발급한 토큰
     */
    void recordSuccess(CircuitPermit permit);

    /**
     * 실행 실패 기록.
     *
     * <p>{@link Exception}뿐 아니라 보호 대상 함수가 던진 {@link Error}도 실패로 기록합니다.</p>
     *
     * <ul>
     *   <li>CLOSED: 롤링 윈도우 기준 실패 카운트 갱신, 임계값 도달 시 OPEN 전이</li>
     *   <li>HALF_OPEN + 현재 시험 토큰: 즉시 OPEN으로 전이 (리셋 타이머 재시작)</li>
     *   <li>HALF_OPEN + 일반 토큰: 카운트만 갱신</li>
     *   <li>OPEN: 카운트만 갱신, 기존 리셋 타이머는 변경하지 않음</li>
     * </ul>
     *
     * @param permit {@link #tryAcquire()}가 발급한 토큰
     * @param throwable 발생한 예외
     */
    void recordFailure(CircuitPermit permit, Throwable throwable);

    /**
     * 결과를 분류하지 않고 진입 허용만 반환.
     *
     * <p>허용된 호출이 보호 대상 함수에 도달하지 못한 경우(예: Bulkhead 거부, 대기 중 인터럽트)에 사용합니다.
     * 토큰이 현재 시험 호출의 것일 때만 시험 슬롯을 반환하며, 그 외에는 아무 동작도 하지 않습니다.</p>
     *
     * @param permit {@link #tryAcquire()}가 발급한 토큰
     */
    void releasePermission(CircuitPermit permit);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 통계 스냅샷 조회.
     *
     * @return 현재 통계
     */
    CircuitBreakerStats getStats();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>리셋 타이머를 취소하고 모든 카운터를 0으로 초기화합니다.
     * 관리 목적의 연산이며, 일반적인 실패 처리 경로에서는 사용하지 않습니다.</p>
     */
    void reset();
}
