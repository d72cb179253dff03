package com.ryuqq.resilience.application.registry;

import com.ryuqq.resilience.application.manager.ResilienceComponentFactory;
import com.ryuqq.resilience.application.manager.ResilienceConfig;
import com.ryuqq.resilience.application.manager.ResilienceManager;
import com.ryuqq.resilience.application.manager.ResilienceStats;
import com.ryuqq.resilience.application.profile.ServiceProfile;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이름이 붙은 ResilienceManager 레지스트리.
 *
 * <p>같은 논리적 다운스트림 서비스(예: "llm", "vector-search")를 호출하는 지점들이
 * 호출마다 새 인스턴스를 만들지 않고 같은 Circuit Breaker/Bulkhead 상태를 공유하도록 합니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>{@link #getOrCreate(String, ResilienceConfig)}는 같은 이름에 대해 원자적 (중복 생성 없음)</li>
 *   <li>전역 싱글톤이 아니며, 애플리케이션 조립 지점에서 생성하여 주입합니다</li>
 *   <li>테스트마다 독립된 레지스트리를 만들 수 있습니다</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResilienceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ResilienceRegistry.class);

    private final ResilienceComponentFactory factory;
    private final ResilienceConfig defaultConfig;
    private final ConcurrentHashMap<String, ResilienceManager> managers = new ConcurrentHashMap<>();

    /**
     * 생성자 (기본 ResilienceConfig 사용).
     *
     * @param factory 컴포넌트 팩토리
     * @throws IllegalArgumentException factory가 null인 경우
     */
    public ResilienceRegistry(ResilienceComponentFactory factory) {
        this(factory, new ResilienceConfig());
    }

    /**
     * 생성자 (이름만으로 생성할 때 사용할 기본 설정 지정).
     *
     * @param factory 컴포넌트 팩토리
     * @param defaultConfig 기본 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResilienceRegistry(ResilienceComponentFactory factory, ResilienceConfig defaultConfig) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        this.factory = factory;
        this.defaultConfig = defaultConfig;
    }

    /**
     * 이름으로 매니저를 조회하고, 없으면 설정으로 생성하여 등록.
     *
     * <p>이미 존재하면 전달된 설정은 무시되고 기존 매니저(와 그 상태)가 반환됩니다.</p>
     *
     * @param name 매니저 이름
     * @param config 최초 생성 시 사용할 설정
     * @return 이름에 해당하는 매니저
     * @throws IllegalArgumentException name이 비어 있거나 config가 null인 경우
     */
    public ResilienceManager getOrCreate(String name, ResilienceConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        ResilienceManager manager = managers.computeIfAbsent(name, key -> {
            log.debug("Creating resilience manager: name={}, config={}", key, config);
            return new ResilienceManager(key, config, factory);
        });

        if (!manager.getConfig().equals(config)) {
            log.debug("Resilience manager {} already exists, ignoring new config", name);
        }
        return manager;
    }

    /**
     * 기본 설정으로 조회 또는 생성.
     *
     * @param name 매니저 이름
     * @return 이름에 해당하는 매니저
     */
    public ResilienceManager getOrCreate(String name) {
        return getOrCreate(name, defaultConfig);
    }

    /**
     * 서비스 유형 프로필로 조회 또는 생성.
     *
     * <p>키는 {@code "유형:서비스명"} 형식입니다 (예: {@code "llm:openai-gpt4"}).</p>
     *
     * @param profile 서비스 유형
     * @param serviceName 서비스 이름
     * @return 매니저
     */
    public ResilienceManager getOrCreate(ServiceProfile profile, String serviceName) {
        if (profile == null) {
            throw new IllegalArgumentException("profile cannot be null");
        }
        return getOrCreate(profile.key(serviceName), profile.defaultConfig());
    }

    /**
     * 이름으로 조회 (생성하지 않음).
     *
     * @param name 매니저 이름
     * @return 매니저 (없으면 empty)
     */
    public Optional<ResilienceManager> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(managers.get(name));
    }

    /**
     * 등록된 모든 매니저 (이름순 스냅샷).
     *
     * @return 이름 → 매니저 (수정 불가)
     */
    public Map<String, ResilienceManager> getAll() {
        return Collections.unmodifiableMap(new TreeMap<>(managers));
    }

    /**
     * 등록된 모든 매니저의 통계 (이름순).
     *
     * @return 이름 → 통계 (수정 불가)
     */
    public Map<String, ResilienceStats> getAllStats() {
        Map<String, ResilienceStats> stats = new TreeMap<>();
        managers.forEach((name, manager) -> stats.put(name, manager.getStats()));
        return Collections.unmodifiableMap(stats);
    }

    /**
     * 모든 매니저 리셋.
     */
    public void resetAll() {
        managers.values().forEach(ResilienceManager::reset);
        log.info("Reset {} resilience managers", managers.size());
    }

    /**
     * 회로 상태 헬스 체크.
     *
     * @return 열린 회로 목록과 정상 여부
     */
    public CircuitHealth health() {
        List<String> openCircuits = new ArrayList<>();
        int total = 0;
        for (Map.Entry<String, ResilienceManager> entry : new TreeMap<>(managers).entrySet()) {
            total++;
            if (entry.getValue().getCircuitBreaker().getState() == CircuitBreakerState.OPEN) {
                openCircuits.add(entry.getKey());
            }
        }
        return new CircuitHealth(openCircuits.isEmpty(), openCircuits, total);
    }

    /**
     * 등록된 매니저 수.
     */
    public int size() {
        return managers.size();
    }

    /**
     * 레지스트리 종료.
     *
     * <p>모든 매니저를 리셋(리셋 타이머 취소, 대기열 정리)하고 등록을 해제한 뒤
     * 팩토리 리소스를 해제합니다.</p>
     */
    public void shutdown() {
        log.info("Shutting down resilience registry: count={}", managers.size());
        managers.values().forEach(ResilienceManager::reset);
        managers.clear();
        factory.shutdown();
    }
}
