package com.orbit.pipeline.adapter.protection.ratelimit;

import com.orbit.pipeline.core.protection.RateLimiter;
import com.orbit.pipeline.core.protection.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 키 단위 Token Bucket Rate Limiter.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * tokens = min(capacity, tokens + elapsedSeconds × rate)   // 접근 시마다 lazy refill
 * tokens ≥ cost → tokens -= cost, 통과
 * tokens &lt; cost → (cost - tokens) / rate 초 후 다시 시도
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>버킷 맵은 {@link ConcurrentHashMap}이며 삽입만 맵 수준에서 조정됩니다</li>
 *   <li>토큰 변경은 버킷별 모니터로 직렬화되어 키 사이에 간섭이 없습니다</li>
 *   <li>블로킹 {@link #acquire}는 락을 잡지 않은 상태로 대기합니다</li>
 *   <li>{@link #acquireAsync}는 스케줄러로 재시도하므로 스레드를 점유하지 않습니다</li>
 * </ul>
 *
 * <p>대기열에 공정성 보장은 없습니다. 포화된 버킷에서 대기하는 호출은 토큰이 생길 때까지
 * 무기한 기다리며, 이것이 의도된 배압(backpressure)입니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class TokenBucketRateLimiter implements RateLimiter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final RateLimiterConfig defaultConfig;
    private final LongSupplier nanoTime;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ConcurrentHashMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    /**
     * 기본 설정(초당 5회)으로 생성.
     */
    public TokenBucketRateLimiter() {
        this(new RateLimiterConfig());
    }

    /**
     * 기본 설정을 지정하여 생성. 비동기 대기용 스케줄러를 내부에서 만듭니다.
     *
     * @param defaultConfig 처음 보는 키에 적용할 설정
     */
    public TokenBucketRateLimiter(RateLimiterConfig defaultConfig) {
        this(defaultConfig, System::nanoTime, newScheduler(), true);
    }

    /**
     * 시간 소스와 스케줄러를 주입하여 생성 (테스트용).
     *
     * @param defaultConfig 처음 보는 키에 적용할 설정
     * @param nanoTime 단조 증가 나노초 시간 소스
     * @param scheduler 비동기 대기용 스케줄러 (호출자가 종료 책임)
     */
    public TokenBucketRateLimiter(RateLimiterConfig defaultConfig, LongSupplier nanoTime,
                                  ScheduledExecutorService scheduler) {
        this(defaultConfig, nanoTime, scheduler, false);
    }

    private TokenBucketRateLimiter(RateLimiterConfig defaultConfig, LongSupplier nanoTime,
                                   ScheduledExecutorService scheduler, boolean ownsScheduler) {
        if (defaultConfig == null || nanoTime == null || scheduler == null) {
            throw new IllegalArgumentException("defaultConfig, nanoTime and scheduler cannot be null");
        }
        this.defaultConfig = defaultConfig;
        this.nanoTime = nanoTime;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    @Override
    public void acquire(String key, int cost) throws InterruptedException {
        requireCost(cost);
        TokenBucket bucket = bucket(key);
        long waitNanos;
        while ((waitNanos = bucket.tryConsume(cost, nanoTime.getAsLong())) > 0) {
            log.debug("Rate limited: key={}, cost={}, waitMs={}", key, cost, TimeUnit.NANOSECONDS.toMillis(waitNanos));
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    @Override
    public boolean tryAcquire(String key, int cost) {
        requireCost(cost);
        return bucket(key).tryConsume(cost, nanoTime.getAsLong()) == 0L;
    }

    @Override
    public CompletableFuture<Void> acquireAsync(String key, int cost) {
        requireCost(cost);
        CompletableFuture<Void> result = new CompletableFuture<>();
        attemptAsync(bucket(key), key, cost, result);
        return result;
    }

    @Override
    public void setRate(String key, RateLimiterConfig config) {
        requireKey(key);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        long now = nanoTime.getAsLong();
        buckets.compute(key, (k, existing) ->
            existing == null ? new TokenBucket(config, now) : existing.reconfigure(config, now));
        log.info("Rate limit set: key={}, permitsPerSecond={}, maxBurstSize={}",
            key, config.permitsPerSecond(), config.maxBurstSize());
    }

    @Override
    public RateLimiterConfig getConfig(String key) {
        requireKey(key);
        TokenBucket bucket = buckets.get(key);
        return bucket == null ? defaultConfig : bucket.config();
    }

    @Override
    public double availableTokens(String key) {
        return Math.floor(bucket(key).available(nanoTime.getAsLong()));
    }

    /**
     * 내부에서 만든 스케줄러 종료 (주입된 스케줄러는 건드리지 않음).
     */
    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private void attemptAsync(TokenBucket bucket, String key, int cost, CompletableFuture<Void> result) {
        if (result.isDone()) {
            return;
        }
        long waitNanos;
        try {
            waitNanos = bucket.tryConsume(cost, nanoTime.getAsLong());
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        if (waitNanos == 0L) {
            result.complete(null);
            return;
        }
        try {
            scheduler.schedule(() -> attemptAsync(bucket, key, cost, result), waitNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
    }

    private TokenBucket bucket(String key) {
        requireKey(key);
        return buckets.computeIfAbsent(key, k -> new TokenBucket(defaultConfig, nanoTime.getAsLong()));
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    private static void requireCost(int cost) {
        if (cost <= 0) {
            throw new IllegalArgumentException("cost must be positive (current: " + cost + ")");
        }
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rate-limiter-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }
}
