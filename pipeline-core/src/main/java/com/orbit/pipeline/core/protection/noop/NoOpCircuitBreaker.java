package com.orbit.pipeline.core.protection.noop;

import com.orbit.pipeline.core.protection.CircuitBreaker;
import com.orbit.pipeline.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 호출을 허용하며 상태를 추적하지 않습니다. 항상 CLOSED입니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;

    public NoOpCircuitBreaker(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public void recordSuccess() {
        // NoOp
    }

    @Override
    public void recordFailure(Throwable throwable) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public int getConsecutiveFailures() {
        return 0;
    }

    @Override
    public void reset() {
        // NoOp
    }
}
