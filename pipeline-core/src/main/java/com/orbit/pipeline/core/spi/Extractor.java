package com.orbit.pipeline.core.spi;

import com.orbit.pipeline.core.contract.PageBundle;
import com.orbit.pipeline.core.contract.StructuredRecord;

import java.io.IOException;

/**
 * 구조화 레코드 추출기.
 *
 * <p>수집된 페이지에서 구조화된 필드를 추출합니다 (예: LLM 호출).
 * 응답이 스키마를 위반하면 {@link com.orbit.pipeline.core.error.ExtractionException}을 던집니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Extractor {

    /**
     * 레코드 추출.
     *
     * @param pages 수집된 페이지
     * @return 구조화 레코드
     * @throws IOException 원격 호출 실패
     */
    StructuredRecord extract(PageBundle pages) throws IOException;
}
