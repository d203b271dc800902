package com.orbit.pipeline.adapter.file.hash;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orbit.pipeline.core.error.CacheException;
import com.orbit.pipeline.core.spi.ContentHasher;

/**
 * 정렬된 JSON 직렬화 결과의 SHA-256 앞 16자리를 쓰는 ContentHasher.
 *
 * <p>같은 내용의 값은 필드 선언 순서나 Map 삽입 순서와 무관하게 같은 해시를 가집니다.
 * 매퍼는 속성과 Map 키를 정렬하도록 설정되어 있어야 합니다.</p>
 *
 * @param <V> 값 타입
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class JsonContentHasher<V> implements ContentHasher<V> {

    private final ObjectMapper mapper;

    public JsonContentHasher(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    @Override
    public String hash(V value) {
        try {
            return ContentHasher.sha256Prefix(mapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to serialize value for hashing", e);
        }
    }
}
