package com.orbit.pipeline.adapter.runner;

import com.orbit.pipeline.adapter.protection.timeout.StageTimeoutPolicy;
import com.orbit.pipeline.application.cache.CacheStrategy;
import com.orbit.pipeline.core.protection.TimeoutPolicy;

import java.time.Duration;
import java.util.Map;

/**
 * LivePipelineRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>cacheStrategy: 캐시 TTL과 신선도 기준 (기본 BALANCED = 1시간)</li>
 *   <li>backgroundRefreshEnabled: 성공한 실행 후 TTL 경과 시점에 자동 갱신 (기본 true)</li>
 *   <li>fetchTimeout / extractTimeout / renderTimeout: 단계별 시도당 타임아웃
 *       (기본 30초 / 60초 / 30초, {@link Duration#ZERO}는 타임아웃 없음)</li>
 *   <li>fetchResourceKey / extractResourceKey / renderResourceKey: 단계별 Rate Limiter 키
 *       (기본 "http" / "openai" / "render")</li>
 * </ul>
 *
 * <p>Circuit Breaker, 재시도, 타임아웃은 리소스 키가 아닌 작업 키({@link #FETCH_OPERATION} 등)로 구분됩니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 * @param cacheStrategy 캐시 전략
 * @param backgroundRefreshEnabled 백그라운드 갱신 여부
 * @param fetchTimeout 수집 시도당 타임아웃
 * @param extractTimeout 추출 시도당 타임아웃
 * @param renderTimeout 렌더링 시도당 타임아웃
 * @param fetchResourceKey 수집 Rate Limiter 키
 * @param extractResourceKey 추출 Rate Limiter 키
 * @param renderResourceKey 렌더링 Rate Limiter 키
 */
public record LivePipelineConfig(
    CacheStrategy cacheStrategy,
    boolean backgroundRefreshEnabled,
    Duration fetchTimeout,
    Duration extractTimeout,
    Duration renderTimeout,
    String fetchResourceKey,
    String extractResourceKey,
    String renderResourceKey
) {

    /** 수집 작업 키. */
    public static final String FETCH_OPERATION = "fetch";

    /** 추출 작업 키. */
    public static final String EXTRACT_OPERATION = "extract";

    /** 렌더링 작업 키. */
    public static final String RENDER_OPERATION = "render";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: BALANCED, backgroundRefreshEnabled=true, 30s/60s/30s, "http"/"openai"/"render"</p>
     */
    public LivePipelineConfig() {
        this(CacheStrategy.BALANCED, true,
            Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(30),
            "http", "openai", "render");
    }

    public LivePipelineConfig {
        if (cacheStrategy == null) {
            throw new IllegalArgumentException("cacheStrategy cannot be null");
        }
        requireTimeout("fetchTimeout", fetchTimeout);
        requireTimeout("extractTimeout", extractTimeout);
        requireTimeout("renderTimeout", renderTimeout);
        requireKey("fetchResourceKey", fetchResourceKey);
        requireKey("extractResourceKey", extractResourceKey);
        requireKey("renderResourceKey", renderResourceKey);
    }

    /**
     * 단계별 타임아웃으로 TimeoutPolicy 생성.
     *
     * @return 작업 키 → 타임아웃 정책 (등록되지 않은 작업은 타임아웃 없음)
     */
    public TimeoutPolicy toTimeoutPolicy() {
        return new StageTimeoutPolicy(
            Map.of(
                FETCH_OPERATION, fetchTimeout,
                EXTRACT_OPERATION, extractTimeout,
                RENDER_OPERATION, renderTimeout
            ),
            Duration.ZERO
        );
    }

    public LivePipelineConfig withCacheStrategy(CacheStrategy cacheStrategy) {
        return new LivePipelineConfig(cacheStrategy, backgroundRefreshEnabled, fetchTimeout, extractTimeout,
            renderTimeout, fetchResourceKey, extractResourceKey, renderResourceKey);
    }

    public LivePipelineConfig withBackgroundRefreshEnabled(boolean backgroundRefreshEnabled) {
        return new LivePipelineConfig(cacheStrategy, backgroundRefreshEnabled, fetchTimeout, extractTimeout,
            renderTimeout, fetchResourceKey, extractResourceKey, renderResourceKey);
    }

    public LivePipelineConfig withFetchTimeout(Duration fetchTimeout) {
        return new LivePipelineConfig(cacheStrategy, backgroundRefreshEnabled, fetchTimeout, extractTimeout,
            renderTimeout, fetchResourceKey, extractResourceKey, renderResourceKey);
    }

    public LivePipelineConfig withExtractTimeout(Duration extractTimeout) {
        return new LivePipelineConfig(cacheStrategy, backgroundRefreshEnabled, fetchTimeout, extractTimeout,
            renderTimeout, fetchResourceKey, extractResourceKey, renderResourceKey);
    }

    public LivePipelineConfig withRenderTimeout(Duration renderTimeout) {
        return new LivePipelineConfig(cacheStrategy, backgroundRefreshEnabled, fetchTimeout, extractTimeout,
            renderTimeout, fetchResourceKey, extractResourceKey, renderResourceKey);
    }

    public LivePipelineConfig withFetchResourceKey(String fetchResourceKey) {
        return new LivePipelineConfig(cacheStrategy, backgroundRefreshEnabled, fetchTimeout, extractTimeout,
            renderTimeout, fetchResourceKey, extractResourceKey, renderResourceKey);
    }

    public LivePipelineConfig withExtractResourceKey(String extractResourceKey) {
        return new LivePipelineConfig(cacheStrategy, backgroundRefreshEnabled, fetchTimeout, extractTimeout,
            renderTimeout, fetchResourceKey, extractResourceKey, renderResourceKey);
    }

    public LivePipelineConfig withRenderResourceKey(String renderResourceKey) {
        return new LivePipelineConfig(cacheStrategy, backgroundRefreshEnabled, fetchTimeout, extractTimeout,
            renderTimeout, fetchResourceKey, extractResourceKey, renderResourceKey);
    }

    private static void requireTimeout(String name, Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative (current: " + timeout + ")");
        }
    }

    private static void requireKey(String name, String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
