package com.orbit.pipeline.adapter.runner;

import com.orbit.pipeline.application.cache.CacheStrategy;
import com.orbit.pipeline.core.protection.TimeoutPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LivePipelineConfig 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class LivePipelineConfigTest {

    @Test
    void 기본값은_BALANCED와_백그라운드_갱신_활성() {
        // when
        LivePipelineConfig config = new LivePipelineConfig();

        // then
        assertThat(config.cacheStrategy()).isEqualTo(CacheStrategy.BALANCED);
        assertThat(config.backgroundRefreshEnabled()).isTrue();
        assertThat(config.fetchResourceKey()).isEqualTo("http");
        assertThat(config.extractResourceKey()).isEqualTo("openai");
        assertThat(config.renderResourceKey()).isEqualTo("render");
    }

    @Test
    void with_메서드는_해당_필드만_바꾼_새_설정을_반환함() {
        // given
        LivePipelineConfig config = new LivePipelineConfig();

        // when
        LivePipelineConfig changed = config.withCacheStrategy(CacheStrategy.NO_CACHE)
            .withFetchResourceKey("scraper");

        // then
        assertThat(changed.cacheStrategy()).isEqualTo(CacheStrategy.NO_CACHE);
        assertThat(changed.fetchResourceKey()).isEqualTo("scraper");
        assertThat(changed.extractTimeout()).isEqualTo(config.extractTimeout());
        assertThat(config.cacheStrategy()).isEqualTo(CacheStrategy.BALANCED);
    }

    @Test
    void 단계별_타임아웃이_작업_키로_매핑됨() {
        // given
        LivePipelineConfig config = new LivePipelineConfig().withExtractTimeout(Duration.ofSeconds(90));

        // when
        TimeoutPolicy policy = config.toTimeoutPolicy();

        // then
        assertThat(policy.getPerAttemptTimeout(LivePipelineConfig.FETCH_OPERATION)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.getPerAttemptTimeout(LivePipelineConfig.EXTRACT_OPERATION)).isEqualTo(Duration.ofSeconds(90));
        assertThat(policy.getPerAttemptTimeout("unknown")).isZero();
    }

    @Test
    void 음수_타임아웃과_빈_리소스_키는_거부됨() {
        LivePipelineConfig config = new LivePipelineConfig();

        assertThatThrownBy(() -> config.withRenderTimeout(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("renderTimeout must not be negative");
        assertThatThrownBy(() -> config.withExtractResourceKey(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("extractResourceKey");
    }
}
