package com.orbit.pipeline.core.contract;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extractor가 페이지 묶음에서 추출한 구조화 레코드.
 *
 * <p>필드 스키마는 Extractor 구현이 정의합니다. 오케스트레이터는 필드 내용을 해석하지 않고
 * Validator와 Renderer에 그대로 전달합니다.</p>
 *
 * @param subjectId 정규화된 대상 ID
 * @param fields 필드명 → 값 (불변)
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record StructuredRecord(String subjectId, Map<String, Object> fields) {

    public StructuredRecord {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId cannot be null or blank");
        }
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * 필드에 의미 있는 값이 있는지 확인.
     *
     * <p>null, 빈 문자열, 빈 컬렉션, 빈 맵은 값이 없는 것으로 취급합니다.</p>
     *
     * @param field 필드명
     * @return 값이 존재하면 true
     */
    public boolean has(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence text) {
            return !text.toString().isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    public int fieldCount() {
        return fields.size();
    }
}
