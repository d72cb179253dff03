package com.ryuqq.resilience.application.registry;

import java.util.List;

/**
 * 프로세스 전역 회로 상태 요약.
 *
 * <p>liveness/readiness 엔드포인트에서 사용하는 읽기 전용 집계입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @param healthy 열린 회로가 하나도 없으면 true
 * @param openCircuits OPEN 상태인 매니저 이름 (이름순)
 * @param totalCircuits 등록된 매니저 수
 */
public record CircuitHealth(boolean healthy, List<String> openCircuits, int totalCircuits) {

    public CircuitHealth {
        if (openCircuits == null) {
            throw new IllegalArgumentException("openCircuits cannot be null");
        }
        openCircuits = List.copyOf(openCircuits);
    }
}
