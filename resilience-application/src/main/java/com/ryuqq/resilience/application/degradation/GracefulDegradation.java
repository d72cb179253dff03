package com.ryuqq.resilience.application.degradation;

import com.ryuqq.resilience.application.manager.ResilienceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * 호출자가 명시적으로 선택하는 대체값 래퍼.
 *
 * <p>ResilienceManager는 스스로 기본값을 대신 반환하지 않습니다.
 * 실패 시 대체값이 필요한 호출 지점은 이 유틸리티로 감쌉니다.</p>
 *
 * <p>호출자 인터럽트({@link InterruptedException})는 대체하지 않고 그대로 전파합니다.</p>
 *
 * <pre>{@code
 * List<Document> docs = GracefulDegradation.withFallbackValue(
 *     vectorManager, () -> vectorStore.search(query), List.of());
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class GracefulDegradation {

    private static final Logger log = LoggerFactory.getLogger(GracefulDegradation.class);

    private GracefulDegradation() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 실패 시 고정 대체값 반환.
     *
     * @param manager 보호 매니저
     * @param call 보호 대상 함수
     * @param fallbackValue 실패 시 반환값
     * @param <T> 결과 타입
     * @return 함수 결과 또는 대체값
     * @throws InterruptedException 호출 스레드가 인터럽트된 경우
     */
    public static <T> T withFallbackValue(ResilienceManager manager, Callable<T> call, T fallbackValue)
            throws InterruptedException {
        return withFallback(manager, call, () -> fallbackValue);
    }

    /**
     * 실패 시 대체 함수 결과 반환.
     *
     * @param manager 보호 매니저
     * @param call 보호 대상 함수
     * @param fallback 실패 시 호출할 대체 함수
     * @param <T> 결과 타입
     * @return 함수 결과 또는 대체 함수 결과
     * @throws InterruptedException 호출 스레드가 인터럽트된 경우
     * @throws IllegalStateException 대체 함수도 실패한 경우 (원인 예외 포함)
     */
    public static <T> T withFallback(ResilienceManager manager, Callable<T> call, Callable<T> fallback)
            throws InterruptedException {
        if (manager == null) {
            throw new IllegalArgumentException("manager cannot be null");
        }
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }

        try {
            return manager.execute(call);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Using fallback for {}: {}", manager.getName(), e.getMessage());
            try {
                return fallback.call();
            } catch (Exception fallbackError) {
                fallbackError.addSuppressed(e);
                throw new IllegalStateException(
                    "Fallback failed for " + manager.getName(), fallbackError);
            }
        }
    }
}
