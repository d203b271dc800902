package com.orbit.pipeline.adapter.file.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * 디스크에 기록되는 캐시 엔트리 문서.
 *
 * <p>값은 타입 정보 없이 JSON 트리로 보관하고, 로드 시 저장소의 값 타입으로 변환합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
record CacheDocument(
    String key,
    JsonNode value,
    Instant createdAt,
    Instant expiresAt,
    long hitCount,
    String qualityTag,
    String contentHash
) {
}
