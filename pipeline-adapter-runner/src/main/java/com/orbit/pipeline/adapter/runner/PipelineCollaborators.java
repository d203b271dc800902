package com.orbit.pipeline.adapter.runner;

import com.orbit.pipeline.core.spi.Extractor;
import com.orbit.pipeline.core.spi.Fetcher;
import com.orbit.pipeline.core.spi.Renderer;
import com.orbit.pipeline.core.spi.Validator;

/**
 * 파이프라인 단계별 외부 협력 객체 묶음.
 *
 * @param fetcher 페이지 수집
 * @param extractor 구조화 추출
 * @param validator 품질 검증 (I/O 없음)
 * @param renderer 문서 렌더링
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record PipelineCollaborators(Fetcher fetcher, Extractor extractor, Validator validator, Renderer renderer) {

    public PipelineCollaborators {
        if (fetcher == null || extractor == null || validator == null || renderer == null) {
            throw new IllegalArgumentException("fetcher, extractor, validator and renderer cannot be null");
        }
    }
}
