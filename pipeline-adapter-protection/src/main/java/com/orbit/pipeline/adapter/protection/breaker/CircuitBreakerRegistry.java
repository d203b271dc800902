package com.orbit.pipeline.adapter.protection.breaker;

import com.orbit.pipeline.core.protection.CircuitBreaker;
import com.orbit.pipeline.core.protection.CircuitBreakerConfig;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 작업 키별 Circuit Breaker 등록소.
 *
 * <p>처음 요청된 키에 대해 독립된 {@link ConsecutiveFailureCircuitBreaker}를 만들어 재사용합니다.
 * 서로 다른 작업은 서로의 실패에 영향받지 않습니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class CircuitBreakerRegistry {

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry() {
        this(new CircuitBreakerConfig(), Clock.systemUTC());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        if (config == null || clock == null) {
            throw new IllegalArgumentException("config and clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    /**
     * 작업 키의 Breaker 조회 (없으면 생성).
     *
     * @param operationKey 작업 키 (예: "openai")
     * @return Breaker
     */
    public CircuitBreaker get(String operationKey) {
        if (operationKey == null || operationKey.isBlank()) {
            throw new IllegalArgumentException("operationKey cannot be null or blank");
        }
        return breakers.computeIfAbsent(operationKey, key -> new ConsecutiveFailureCircuitBreaker(key, config, clock));
    }

    /**
     * 등록된 Breaker 스냅샷 (키 순).
     *
     * @return 키 → Breaker
     */
    public Map<String, CircuitBreaker> snapshot() {
        return new TreeMap<>(breakers);
    }

    /**
     * 모든 Breaker를 CLOSED로 리셋.
     */
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
