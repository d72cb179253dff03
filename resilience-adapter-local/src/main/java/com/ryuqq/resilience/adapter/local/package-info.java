/**
 * 프로세스 로컬 Protection 구현 (Adapter).
 *
 * <p>Circuit Breaker 상태는 프로세스마다 독립적으로 추적되며, 프로세스 간 공유하지 않습니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.adapter.local.DefaultCircuitBreaker}: 롤링 윈도우 + 단일 시험 호출 HALF_OPEN</li>
 *   <li>{@link com.ryuqq.resilience.adapter.local.QueueingBulkhead}: FIFO 대기열, 슬롯 직접 인계</li>
 *   <li>{@link com.ryuqq.resilience.adapter.local.TimeoutGuard}: Future 기반 마감 시간, 인터럽트 전파</li>
 *   <li>{@link com.ryuqq.resilience.adapter.local.LocalResilienceComponentFactory}: 위 구현을 조립하고 스레드 리소스를 소유</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.local;
