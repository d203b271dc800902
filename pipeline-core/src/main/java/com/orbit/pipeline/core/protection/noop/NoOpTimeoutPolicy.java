package com.orbit.pipeline.core.protection.noop;

import com.orbit.pipeline.core.protection.TimeoutPolicy;

import java.time.Duration;

/**
 * Timeout Policy NoOp 구현.
 *
 * <p>타임아웃을 적용하지 않습니다 ({@link Duration#ZERO} 반환).</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class NoOpTimeoutPolicy implements TimeoutPolicy {

    @Override
    public Duration getPerAttemptTimeout(String operationKey) {
        return Duration.ZERO;
    }

    @Override
    public void recordTimeout(String operationKey, Duration elapsed) {
        // NoOp
    }
}
