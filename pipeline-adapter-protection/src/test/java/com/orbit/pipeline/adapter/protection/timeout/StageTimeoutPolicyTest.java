package com.orbit.pipeline.adapter.protection.timeout;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StageTimeoutPolicy 유닛 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class StageTimeoutPolicyTest {

    @Test
    void 등록된_작업은_개별_타임아웃을_나머지는_기본값을_사용함() {
        // given
        StageTimeoutPolicy policy = new StageTimeoutPolicy(
            Map.of("openai", Duration.ofSeconds(30)), Duration.ofSeconds(10));

        // then
        assertThat(policy.getPerAttemptTimeout("openai")).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.getPerAttemptTimeout("http")).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void 타임아웃_기록은_작업별로_집계됨() {
        // given
        StageTimeoutPolicy policy = new StageTimeoutPolicy(Map.of(), Duration.ZERO);

        // when
        policy.recordTimeout("openai", Duration.ofSeconds(31));
        policy.recordTimeout("openai", Duration.ofSeconds(30));
        policy.recordTimeout("http", Duration.ofSeconds(11));

        // then
        assertThat(policy.getTimeoutCount("openai")).isEqualTo(2);
        assertThat(policy.getTimeoutCount("http")).isEqualTo(1);
        assertThat(policy.getTimeoutCount("render")).isZero();
    }

    @Test
    void 음수_타임아웃은_거부됨() {
        assertThatThrownBy(() -> new StageTimeoutPolicy(Map.of("openai", Duration.ofSeconds(-1)), Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must not be negative");
    }
}
