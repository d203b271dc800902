package com.orbit.pipeline.adapter.runner;

import com.orbit.pipeline.adapter.protection.breaker.CircuitBreakerRegistry;
import com.orbit.pipeline.core.error.ErrorKind;
import com.orbit.pipeline.core.protection.RateLimiter;
import com.orbit.pipeline.core.protection.RetryPolicy;
import com.orbit.pipeline.core.protection.TimeoutPolicy;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 원격 호출을 보호 계층으로 감싸 실행하는 Invoker.
 *
 * <p><strong>구성 순서:</strong></p>
 * <pre>
 * RateLimiter.acquireAsync(resourceKey)          // 단계당 1회
 *   → RetryPolicy.callAsync(operationKey,
 *       CircuitBreaker(operationKey).callAsync(
 *         io 스레드에서 호출 + 시도당 타임아웃))
 * </pre>
 *
 * <p>재시도 정책의 predicate가 Breaker OPEN 오류를 재시도하지 않도록 설정되어야 합니다
 * ({@link com.orbit.pipeline.adapter.protection.retry.RetryPredicates#transientOnly()}).</p>
 *
 * <p>토큰 대기와 재시도 지연은 스케줄러에서 진행되어 스레드를 점유하지 않습니다.
 * 블로킹 원격 호출만 io Executor 스레드를 사용합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class GuardedStageInvoker {

    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakers;
    private final RetryPolicy retryPolicy;
    private final TimeoutPolicy timeoutPolicy;
    private final ExecutorService io;

    /**
     * @param rateLimiter 리소스 키별 Rate Limiter
     * @param breakers 작업 키별 Circuit Breaker
     * @param retryPolicy 재시도 정책
     * @param timeoutPolicy 시도당 타임아웃 정책
     * @param io 블로킹 원격 호출용 Executor (호출자가 종료 책임)
     */
    public GuardedStageInvoker(RateLimiter rateLimiter, CircuitBreakerRegistry breakers, RetryPolicy retryPolicy,
                               TimeoutPolicy timeoutPolicy, ExecutorService io) {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (breakers == null) {
            throw new IllegalArgumentException("breakers cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (timeoutPolicy == null) {
            throw new IllegalArgumentException("timeoutPolicy cannot be null");
        }
        if (io == null) {
            throw new IllegalArgumentException("io cannot be null");
        }
        this.rateLimiter = rateLimiter;
        this.breakers = breakers;
        this.retryPolicy = retryPolicy;
        this.timeoutPolicy = timeoutPolicy;
        this.io = io;
    }

    /**
     * 보호된 원격 호출.
     *
     * @param resourceKey Rate Limiter 키
     * @param operationKey Breaker, 재시도, 타임아웃 키
     * @param call 원격 호출
     * @param <T> 결과 타입
     * <p>반환된 Future를 취소하면 토큰 대기와 재시도 루프가 함께 취소되어 더 이상 시도하지 않습니다.
     * 이미 진행 중인 시도는 끝까지 실행되고 그 결과는 버려집니다.</p>
     *
     * @return 결과 Future (재시도 소진 또는 재시도 불가 오류 시 원인 예외로 실패)
     */
    public <T> CompletableFuture<T> invoke(String resourceKey, String operationKey, Callable<T> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<T>> retrying = new AtomicReference<>();
        CompletableFuture<Void> permit = rateLimiter.acquireAsync(resourceKey, 1);

        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                permit.cancel(false);
                cancel(retrying.get());
            }
        });

        permit.whenComplete((ignored, acquireError) -> {
            if (acquireError != null) {
                result.completeExceptionally(ErrorKind.unwrap(acquireError));
                return;
            }
            if (result.isDone()) {
                return;
            }
            CompletableFuture<T> retry = retryPolicy.callAsync(operationKey,
                () -> breakers.get(operationKey).callAsync(() -> attempt(operationKey, call)));
            retrying.set(retry);
            if (result.isCancelled()) {
                retry.cancel(false);
                return;
            }
            retry.whenComplete((value, error) -> {
                if (error == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(ErrorKind.unwrap(error));
                }
            });
        });
        return result;
    }

    private static void cancel(CompletableFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private <T> CompletableFuture<T> attempt(String operationKey, Callable<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, io);

        Duration timeout = timeoutPolicy.getPerAttemptTimeout(operationKey);
        if (timeout.isZero()) {
            return future;
        }
        return future
            .orTimeout(timeout.toNanos(), TimeUnit.NANOSECONDS)
            .whenComplete((value, error) -> {
                if (error != null && ErrorKind.unwrap(error) instanceof TimeoutException) {
                    timeoutPolicy.recordTimeout(operationKey, timeout);
                }
            });
    }
}
