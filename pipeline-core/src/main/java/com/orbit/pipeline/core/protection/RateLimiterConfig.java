package com.orbit.pipeline.core.protection;

/**
 * Rate Limiter 설정 (키 단위).
 *
 * @param permitsPerSecond 초당 토큰 충전 속도 (예: 5.0)
 * @param maxBurstSize 버스트 허용량 (Token Bucket의 버킷 크기)
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record RateLimiterConfig(double permitsPerSecond, int maxBurstSize) {

    /** 기본 충전 속도 (초당 5회). */
    public static final double DEFAULT_RATE = 5.0;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: permitsPerSecond=5.0, maxBurstSize=5</p>
     */
    public RateLimiterConfig() {
        this(DEFAULT_RATE, (int) DEFAULT_RATE);
    }

    public RateLimiterConfig {
        if (!(permitsPerSecond > 0) || Double.isInfinite(permitsPerSecond)) {
            throw new IllegalArgumentException("permitsPerSecond must be positive (current: " + permitsPerSecond + ")");
        }
        if (maxBurstSize <= 0) {
            throw new IllegalArgumentException("maxBurstSize must be positive (current: " + maxBurstSize + ")");
        }
    }

    /**
     * 충전 속도만으로 설정 생성.
     *
     * <p>버킷 크기는 {@code max(1, (int) rate)}입니다.</p>
     *
     * @param permitsPerSecond 초당 충전 속도
     * @return RateLimiterConfig
     */
    public static RateLimiterConfig ofRate(double permitsPerSecond) {
        return new RateLimiterConfig(permitsPerSecond, Math.max(1, (int) permitsPerSecond));
    }
}
