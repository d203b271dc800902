package com.orbit.pipeline.adapter.file.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 캐시 파일과 콘텐츠 해시에 쓰는 ObjectMapper 팩토리.
 *
 * <ul>
 *   <li>Instant는 ISO-8601 문자열로 기록</li>
 *   <li>속성과 Map 키는 정렬되어 같은 값은 항상 같은 바이트로 직렬화</li>
 *   <li>모르는 속성은 무시</li>
 * </ul>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class CacheObjectMappers {

    private CacheObjectMappers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 새 ObjectMapper 생성.
     *
     * @return ObjectMapper
     */
    public static ObjectMapper create() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}
