package com.ryuqq.resilience.core.protection;

import java.util.concurrent.Callable;

/**
 * Bulkhead SPI.
 *
 * <p>동시 실행 수를 제한하여 특정 작업 유형이 전체 시스템 리소스를 독점하지 못하도록 격리합니다.</p>
 *
 * <p><strong>진입 정책:</strong></p>
 * <ol>
 *   <li>activeCount &lt; maxConcurrent: 즉시 진입</li>
 *   <li>대기열 길이 &lt; maxQueueSize: 대기열(FIFO)에 추가하고 슬롯이 날 때까지 호출 스레드 대기</li>
 *   <li>그 외: 대기 없이 즉시 {@code BulkheadRejectedException}</li>
 * </ol>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>동시에 실행 중인 호출 수는 maxConcurrent를 넘지 않음</li>
 *   <li>대기열 길이는 maxQueueSize를 넘지 않음</li>
 *   <li>대기열 진입 순서대로 실행 (앞선 대기자가 굶지 않음)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Bulkhead bulkhead = ...;
 *
 * try {
 *     return bulkhead.execute(() -> vectorStore.search(query));
 * } catch (BulkheadRejectedException e) {
 *     // 용량 초과: 부하 차단 신호
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface Bulkhead {

    /**
     * Bulkhead 이름 조회.
     *
     * @return 이름
     */
    String getName();

    /**
     * 동시 실행 제한을 적용하여 함수 실행.
     *
     * <p>대기 중인 호출 스레드가 인터럽트되면 대기열에서 제거되며 슬롯은 누수되지 않습니다.</p>
     *
     * @param call 보호 대상 함수
     * @param <T> 결과 타입
     * @return 함수 결과
     * @throws com.ryuqq.resilience.core.exception.BulkheadRejectedException 용량과 대기열이 모두 가득 찬 경우 또는 대기 중 대기열이 정리된 경우
     * @throws InterruptedException 대기열에서 기다리는 중 인터럽트된 경우
     * @throws Exception 함수가 던진 예외 (변경 없이 전파)
     */
    <T> T execute(Callable<T> call) throws Exception;

    /**
     * 슬롯만 획득.
     *
     * <p>{@link #execute(Callable)}와 같은 진입 정책을 따르지만 함수를 호출하지 않습니다.
     * 함수가 다른 스레드에서 실행되어 호출자보다 늦게 끝날 수 있는 경우 사용하며,
     * 반환된 슬롯은 함수가 실제로 끝난 뒤 반환합니다.</p>
     *
     * @return 획득한 슬롯
     * @throws com.ryuqq.resilience.core.exception.BulkheadRejectedException 용량과 대기열이 모두 가득 찬 경우 또는 대기 중 대기열이 정리된 경우
     * @throws InterruptedException 대기열에서 기다리는 중 인터럽트된 경우
     */
    BulkheadPermit acquire() throws InterruptedException;

    /**
     * 통계 스냅샷 조회.
     *
     * @return 현재 통계
     */
    BulkheadStats getStats();

    /**
     * Bulkhead 설정 정보 조회.
     *
     * @return Bulkhead 설정
     */
    BulkheadConfig getConfig();

    /**
     * 대기열 정리.
     *
     * <p>대기 중인 모든 호출을 {@code BulkheadRejectedException}으로 거부하고
     * 누적 카운터를 0으로 초기화합니다. 실행 중인 호출에는 영향을 주지 않습니다.</p>
     */
    void clear();

    /**
     * 실행 중이거나 대기 중인 호출이 모두 끝날 때까지 대기.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return true: 유휴 상태 도달, false: 시간 초과
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean awaitIdle(long timeoutMs) throws InterruptedException;
}
