package com.ryuqq.resilience.application.profile;

/**
 * 작업 종류별 표준 타임아웃 (밀리초).
 *
 * <p>{@code TimeoutGuard}를 단독으로 사용할 때의 기본값 카탈로그입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum OperationTimeouts {

    LLM_INVOKE(30_000),
    LLM_STREAM(60_000),
    VECTOR_SEARCH(10_000),
    VECTOR_EMBED(15_000),
    DATABASE_QUERY(10_000),
    DATABASE_TRANSACTION(30_000),
    HTTP_REQUEST(10_000),
    WEBHOOK(5_000);

    private final long timeoutMs;

    OperationTimeouts(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
