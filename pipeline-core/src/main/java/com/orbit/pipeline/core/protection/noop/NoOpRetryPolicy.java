package com.orbit.pipeline.core.protection.noop;

import com.orbit.pipeline.core.protection.RetryPolicy;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Retry Policy NoOp 구현.
 *
 * <p>작업을 정확히 한 번 수행하고 결과나 오류를 그대로 전달합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class NoOpRetryPolicy implements RetryPolicy {

    @Override
    public <T> T call(String operation, Callable<T> action) throws Exception {
        return action.call();
    }

    @Override
    public <T> CompletableFuture<T> callAsync(String operation, Supplier<CompletableFuture<T>> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public int getMaxAttempts() {
        return 1;
    }
}
