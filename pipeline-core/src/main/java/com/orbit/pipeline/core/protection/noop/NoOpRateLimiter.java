package com.orbit.pipeline.core.protection.noop;

import com.orbit.pipeline.core.protection.RateLimiter;
import com.orbit.pipeline.core.protection.RateLimiterConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 즉시 허용합니다. 테스트나 제한 없이 실행하고자 할 때 사용합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED = new RateLimiterConfig(Double.MAX_VALUE, Integer.MAX_VALUE);

    @Override
    public void acquire(String key, int cost) {
        // NoOp
    }

    @Override
    public boolean tryAcquire(String key, int cost) {
        return true;
    }

    @Override
    public CompletableFuture<Void> acquireAsync(String key, int cost) {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void setRate(String key, RateLimiterConfig config) {
        // NoOp
    }

    @Override
    public RateLimiterConfig getConfig(String key) {
        return UNLIMITED;
    }

    @Override
    public double availableTokens(String key) {
        return Double.MAX_VALUE;
    }
}
