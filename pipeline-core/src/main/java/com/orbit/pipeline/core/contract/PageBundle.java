package com.orbit.pipeline.core.contract;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetcher가 수집한 페이지 묶음.
 *
 * <p>페이지 식별자(보통 URL)에서 본문 텍스트로의 매핑입니다.
 * 어떤 페이지를 어떻게 찾았는지는 Fetcher 내부 사항이며 오케스트레이터는 관여하지 않습니다.</p>
 *
 * @param subjectId 정규화된 대상 ID
 * @param pages 페이지 식별자 → 본문 (삽입 순서 유지, 불변)
 * @param fetchDuration 수집 소요 시간
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record PageBundle(String subjectId, Map<String, String> pages, Duration fetchDuration) {

    public PageBundle {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId cannot be null or blank");
        }
        pages = pages == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(pages));
        fetchDuration = fetchDuration == null ? Duration.ZERO : fetchDuration;
    }

    /**
     * 수집된 페이지 수.
     *
     * @return 페이지 수
     */
    public int pageCount() {
        return pages.size();
    }
}
