package com.orbit.pipeline.core.spi;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ContentHasher 기본 구현 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class ContentHasherTest {

    @Test
    void sha256Prefix_IsStableSixteenHexChars() {
        // when
        String first = ContentHasher.sha256Prefix("abc");
        String second = ContentHasher.<String>sha256OfString().hash("abc");

        // then
        assertThat(first).isEqualTo("ba7816bf8f01cfea");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void sha256Prefix_DifferentContent_DifferentHash() {
        assertThat(ContentHasher.sha256Prefix("a")).isNotEqualTo(ContentHasher.sha256Prefix("b"));
    }
}
