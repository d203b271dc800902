package com.orbit.pipeline.adapter.protection.timeout;

import com.orbit.pipeline.core.protection.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 작업 키별 고정 타임아웃 정책.
 *
 * <p>등록되지 않은 작업 키는 기본 타임아웃을 사용합니다.
 * 발생한 타임아웃은 작업 키별로 집계되고 WARN 로그로 남습니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class StageTimeoutPolicy implements TimeoutPolicy {

    private static final Logger log = LoggerFactory.getLogger(StageTimeoutPolicy.class);

    private final Map<String, Duration> timeouts;
    private final Duration defaultTimeout;
    private final ConcurrentHashMap<String, AtomicLong> timeoutCounts = new ConcurrentHashMap<>();

    /**
     * @param timeouts 작업 키 → 타임아웃 ({@link Duration#ZERO}는 타임아웃 없음)
     * @param defaultTimeout 등록되지 않은 키의 타임아웃
     */
    public StageTimeoutPolicy(Map<String, Duration> timeouts, Duration defaultTimeout) {
        if (timeouts == null || defaultTimeout == null) {
            throw new IllegalArgumentException("timeouts and defaultTimeout cannot be null");
        }
        requireNotNegative("defaultTimeout", defaultTimeout);
        timeouts.forEach((key, value) -> requireNotNegative(key, value));
        this.timeouts = Map.copyOf(timeouts);
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public Duration getPerAttemptTimeout(String operationKey) {
        return timeouts.getOrDefault(operationKey, defaultTimeout);
    }

    @Override
    public void recordTimeout(String operationKey, Duration elapsed) {
        long count = timeoutCounts.computeIfAbsent(operationKey, key -> new AtomicLong()).incrementAndGet();
        log.warn("{} timed out after {}ms (total timeouts: {})", operationKey, elapsed.toMillis(), count);
    }

    /**
     * 작업 키의 누적 타임아웃 횟수.
     *
     * @param operationKey 작업 키
     * @return 타임아웃 횟수
     */
    public long getTimeoutCount(String operationKey) {
        AtomicLong count = timeoutCounts.get(operationKey);
        return count == null ? 0L : count.get();
    }

    private static void requireNotNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " timeout must not be negative (current: " + value + ")");
        }
    }
}
