/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>다운스트림 호출(LLM, 벡터 검색, DB 쿼리, HTTP/웹훅)의 장애를 격리하기 위한
 * Circuit Breaker, Bulkhead, Timeout Policy 인터페이스와 설정, 통계, 관측 훅을 정의합니다.</p>
 *
 * <h2>보호 체인 순서</h2>
 *
 * <p>세 보호 메커니즘은 다음 순서로 합성됩니다 (바깥쪽에서 안쪽으로):</p>
 * <pre>
 * 1. CircuitBreaker  → OPEN 상태 시 즉시 실패 (Bulkhead 슬롯 미소비)
 * 2. Bulkhead        → 동시 실행 수 제한, 초과 시 FIFO 대기열 또는 거부
 * 3. TimeoutPolicy   → 보호 대상 함수 자체에 마감 시간 적용
 * 4. 함수 실행
 * 5. 결과를 CircuitBreaker와 Bulkhead에 기록
 * </pre>
 *
 * <h3>예외 분류</h3>
 * <ul>
 *   <li><strong>OperationTimeoutException:</strong> 실패로 분류</li>
 *   <li><strong>CircuitOpenException:</strong> 함수 미호출, 실패로 분류하지 않음</li>
 *   <li><strong>BulkheadRejectedException:</strong> 함수 미호출, 실패로 분류하지 않음</li>
 *   <li><strong>함수가 던진 예외:</strong> 그대로 전파, 실패로 분류</li>
 * </ul>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>모든 Protection SPI는 {@code noop} 하위 패키지에 NoOp 기본 구현을 제공합니다.
 * 설정으로 Circuit Breaker나 Bulkhead를 비활성화하면 NoOp 구현이 대신 체인에 들어가며,
 * 해당 계층은 함수를 그대로 통과시킵니다.</p>
 *
 * <h2>사용 예시</h2>
 * <pre>{@code
 * ResilienceRegistry registry = new ResilienceRegistry(new LocalResilienceComponentFactory());
 * ResilienceManager llm = registry.getOrCreate("llm", ServiceProfile.LLM.defaultConfig());
 *
 * String answer = llm.execute(() -> model.invoke(messages));
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 * @see com.ryuqq.resilience.core.protection.Bulkhead
 * @see com.ryuqq.resilience.core.protection.TimeoutPolicy
 * @see com.ryuqq.resilience.core.protection.noop
 */
package com.ryuqq.resilience.core.protection;
