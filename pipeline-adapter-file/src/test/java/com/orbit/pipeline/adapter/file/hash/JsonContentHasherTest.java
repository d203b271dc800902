package com.orbit.pipeline.adapter.file.hash;

import com.orbit.pipeline.adapter.file.store.CacheObjectMappers;
import com.orbit.pipeline.core.contract.Artifact;
import com.orbit.pipeline.testkit.support.TestArtifacts;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JsonContentHasher 유닛 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class JsonContentHasherTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final JsonContentHasher<Artifact> hasher = new JsonContentHasher<>(CacheObjectMappers.create());

    private static Artifact withMetadata(Map<String, String> metadata) {
        return new Artifact("acmeco", "structured", "# AcmeCo", "markdown", 85,
            List.of(), "B", NOW, metadata);
    }

    @Test
    void 해시는_16자리_16진수임() {
        assertThat(hasher.hash(TestArtifacts.artifact("acmeco", NOW))).matches("[0-9a-f]{16}");
    }

    @Test
    void Map_삽입_순서가_달라도_같은_해시를_반환함() {
        // given
        Map<String, String> first = new LinkedHashMap<>();
        first.put("pagesFetched", "3");
        first.put("fieldCount", "12");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("fieldCount", "12");
        second.put("pagesFetched", "3");

        // then
        assertThat(hasher.hash(withMetadata(first))).isEqualTo(hasher.hash(withMetadata(second)));
    }

    @Test
    void 내용이_다르면_해시가_달라짐() {
        assertThat(hasher.hash(withMetadata(Map.of("pagesFetched", "3"))))
            .isNotEqualTo(hasher.hash(withMetadata(Map.of("pagesFetched", "4"))));
    }
}
