package com.orbit.pipeline.core.spi;

import com.orbit.pipeline.core.contract.RenderedDocument;
import com.orbit.pipeline.core.contract.StructuredRecord;
import com.orbit.pipeline.core.model.Variant;

import java.io.IOException;

/**
 * 결과 문서 렌더러.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Renderer {

    /**
     * 문서 렌더링.
     *
     * @param record 구조화 레코드
     * @param variant 변형
     * @return 렌더링된 문서
     * @throws IOException 원격 호출 실패
     */
    RenderedDocument render(StructuredRecord record, Variant variant) throws IOException;
}
