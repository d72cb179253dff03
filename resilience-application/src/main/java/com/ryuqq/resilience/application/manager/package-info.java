/**
 * Circuit Breaker, Bulkhead, Timeout을 하나의 실행 경로로 합성하는 매니저.
 *
 * <h2>핵심 컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.application.manager.ResilienceManager}: 합성 실행기</li>
 *   <li>{@link com.ryuqq.resilience.application.manager.ResilienceConfig}: 계층별 설정과 활성화 여부</li>
 *   <li>{@link com.ryuqq.resilience.application.manager.ResilienceComponentFactory}: 보호 컴포넌트 생성 SPI</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.manager;
