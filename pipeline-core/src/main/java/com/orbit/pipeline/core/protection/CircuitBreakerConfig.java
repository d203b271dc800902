package com.orbit.pipeline.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * @param failureThreshold OPEN으로 전이하는 연속 실패 수
 * @param recoveryTimeout OPEN 상태 유지 시간 (경과 후 HALF_OPEN 시험 허용)
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, recoveryTimeout=60초</p>
     */
    public CircuitBreakerConfig() {
        this(5, Duration.ofSeconds(60));
    }

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive (current: " + failureThreshold + ")");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive (current: " + recoveryTimeout + ")");
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout);
    }

    /**
     * recoveryTimeout만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withRecoveryTimeout(Duration recoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout);
    }
}
