package com.orbit.pipeline.adapter.protection.retry;

import com.orbit.pipeline.core.error.ErrorKind;
import com.orbit.pipeline.core.protection.RetryConfig;
import com.orbit.pipeline.core.protection.RetryListener;
import com.orbit.pipeline.core.protection.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 지수 백오프 재시도 정책.
 *
 * <p><strong>동작:</strong></p>
 * <ol>
 *   <li>작업 실행</li>
 *   <li>실패 시 predicate로 재시도 대상인지 판정. 대상이 아니면 즉시 그 오류를 전파</li>
 *   <li>남은 시도가 없으면 마지막 오류를 그대로 전파 (래핑하지 않음)</li>
 *   <li>{@link BackoffCalculator}로 지연 계산, {@link RetryListener} 호출 후 지연</li>
 *   <li>1로 돌아가 다시 시도</li>
 * </ol>
 *
 * <p>비동기 경로는 지연을 {@link ScheduledExecutorService}에 맡기므로 대기 중 스레드를 점유하지 않습니다.
 * 결과 Future가 외부에서 완료(취소 포함)되면 이후 시도는 시작하지 않습니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(ExponentialBackoffRetryPolicy.class);

    private final RetryConfig config;
    private final Predicate<Throwable> retryable;
    private final RetryListener listener;
    private final ScheduledExecutorService scheduler;
    private final BackoffCalculator backoff;

    /**
     * 설정의 지연 값으로 BackoffCalculator를 만들어 생성.
     *
     * @param config 재시도 설정
     * @param retryable 재시도 대상 predicate
     * @param scheduler 비동기 지연용 스케줄러
     */
    public ExponentialBackoffRetryPolicy(RetryConfig config, Predicate<Throwable> retryable,
                                         ScheduledExecutorService scheduler) {
        this(config, retryable, RetryListener.NONE, scheduler,
            new BackoffCalculator(config.baseDelay(), config.maxDelay()));
    }

    /**
     * 모든 협력 객체를 지정하여 생성.
     *
     * @param config 재시도 설정
     * @param retryable 재시도 대상 predicate
     * @param listener 재시도 관찰자
     * @param scheduler 비동기 지연용 스케줄러
     * @param backoff 지연 계산기
     */
    public ExponentialBackoffRetryPolicy(RetryConfig config, Predicate<Throwable> retryable, RetryListener listener,
                                         ScheduledExecutorService scheduler, BackoffCalculator backoff) {
        if (config == null || retryable == null || listener == null || scheduler == null || backoff == null) {
            throw new IllegalArgumentException("config, retryable, listener, scheduler and backoff cannot be null");
        }
        this.config = config;
        this.retryable = retryable;
        this.listener = listener;
        this.scheduler = scheduler;
        this.backoff = backoff;
    }

    @Override
    public <T> T call(String operation, Callable<T> action) throws Exception {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                Duration delay = nextDelay(operation, attempt, e);
                if (delay == null) {
                    throw e;
                }
                try {
                    TimeUnit.NANOSECONDS.sleep(delay.toNanos());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    interrupted.addSuppressed(e);
                    throw interrupted;
                }
            }
        }
    }

    @Override
    public <T> CompletableFuture<T> callAsync(String operation, Supplier<CompletableFuture<T>> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attemptAsync(operation, action, 1, result);
        return result;
    }

    @Override
    public int getMaxAttempts() {
        return config.maxAttempts();
    }

    private <T> void attemptAsync(String operation, Supplier<CompletableFuture<T>> action, int attempt,
                                  CompletableFuture<T> result) {
        if (result.isDone()) {
            return;
        }
        CompletableFuture<T> future;
        try {
            future = action.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            if (result.isDone()) {
                log.debug("{} attempt {} ended after the call was cancelled", operation, attempt);
                return;
            }
            Throwable cause = ErrorKind.unwrap(error);
            Duration delay = nextDelay(operation, attempt, cause);
            if (delay == null) {
                result.completeExceptionally(cause);
                return;
            }
            try {
                scheduler.schedule(
                    () -> attemptAsync(operation, action, attempt + 1, result),
                    delay.toNanos(),
                    TimeUnit.NANOSECONDS
                );
            } catch (RejectedExecutionException rejected) {
                cause.addSuppressed(rejected);
                result.completeExceptionally(cause);
            }
        });
    }

    /**
     * 다음 시도 전 지연 계산 (재시도하지 않을 경우 null).
     */
    private Duration nextDelay(String operation, int attempt, Throwable error) {
        if (!retryable.test(error)) {
            log.debug("{} failed with non-retryable error on attempt {}: {}", operation, attempt, error.toString());
            return null;
        }
        if (attempt >= config.maxAttempts()) {
            log.error("{} failed after {} attempts", operation, attempt, error);
            return null;
        }
        Duration delay = backoff.calculate(attempt);
        log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
            operation, attempt, config.maxAttempts(), delay.toMillis(), error.toString());
        try {
            listener.onRetry(operation, attempt, delay, error);
        } catch (RuntimeException e) {
            log.warn("Retry listener failed for {}", operation, e);
        }
        return delay;
    }
}
