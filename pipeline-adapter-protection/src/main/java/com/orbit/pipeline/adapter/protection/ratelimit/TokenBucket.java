package com.orbit.pipeline.adapter.protection.ratelimit;

import com.orbit.pipeline.core.protection.RateLimiterConfig;

/**
 * 키 하나의 Token Bucket 상태.
 *
 * <p>모든 변경은 이 객체의 모니터로 직렬화됩니다. 토큰은 타이머 없이
 * 접근할 때마다 경과 시간만큼 충전됩니다 (lazy refill).</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
final class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private RateLimiterConfig config;
    private double tokens;
    private long lastRefillNanos;

    TokenBucket(RateLimiterConfig config, long nowNanos) {
        this.config = config;
        this.tokens = config.maxBurstSize();
        this.lastRefillNanos = nowNanos;
    }

    /**
     * 토큰 소비 시도.
     *
     * @param cost 비용
     * @param nowNanos 현재 시각 (나노초)
     * @return 0이면 소비 성공, 양수면 부족분이 충전될 때까지 필요한 나노초
     * @throws IllegalArgumentException cost가 버킷 크기를 초과하는 경우
     */
    synchronized long tryConsume(int cost, long nowNanos) {
        if (cost > config.maxBurstSize()) {
            throw new IllegalArgumentException(
                "cost must not exceed maxBurstSize (cost: " + cost + ", maxBurstSize: " + config.maxBurstSize() + ")"
            );
        }
        refill(nowNanos);
        if (tokens >= cost) {
            tokens -= cost;
            return 0L;
        }
        double deficit = cost - tokens;
        return Math.max(1L, (long) Math.ceil(deficit / config.permitsPerSecond() * NANOS_PER_SECOND));
    }

    /**
     * 설정 교체. 기존 토큰 수는 비율 조정 없이 새 버킷 크기로만 잘립니다.
     */
    synchronized TokenBucket reconfigure(RateLimiterConfig newConfig, long nowNanos) {
        refill(nowNanos);
        this.config = newConfig;
        this.tokens = Math.min(tokens, newConfig.maxBurstSize());
        return this;
    }

    synchronized double available(long nowNanos) {
        refill(nowNanos);
        return tokens;
    }

    synchronized RateLimiterConfig config() {
        return config;
    }

    private void refill(long nowNanos) {
        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(config.maxBurstSize(), tokens + elapsed / NANOS_PER_SECOND * config.permitsPerSecond());
        lastRefillNanos = nowNanos;
    }
}
