package com.orbit.pipeline.core.protection;

import java.time.Duration;

/**
 * 재시도 정책 설정.
 *
 * @param maxAttempts 최대 시도 횟수 (첫 시도 포함)
 * @param baseDelay 첫 재시도 지연의 기준값
 * @param maxDelay 지연 상한 (지터 적용 전)
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record RetryConfig(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelay=1초, maxDelay=60초</p>
     */
    public RetryConfig() {
        this(3, Duration.ofSeconds(1), Duration.ofSeconds(60));
    }

    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative (current: " + baseDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (baseDelay: " + baseDelay + ", maxDelay: " + maxDelay + ")"
            );
        }
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay);
    }

    public RetryConfig withBaseDelay(Duration baseDelay) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay);
    }

    public RetryConfig withMaxDelay(Duration maxDelay) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay);
    }
}
