package com.orbit.pipeline.core.spi;

import com.orbit.pipeline.core.contract.PageBundle;
import com.orbit.pipeline.core.model.SubjectKey;

import java.io.IOException;

/**
 * 원본 페이지 수집기.
 *
 * <p>대상에 대한 원본 페이지를 수집합니다. 호출 빈도 제한, Circuit Breaker, 재시도,
 * 타임아웃은 호출자가 적용하므로 구현체는 한 번의 시도만 수행하면 됩니다.</p>
 *
 * <p>일시적 실패는 {@link IOException} 또는
 * {@link com.orbit.pipeline.core.error.TransientPipelineException}으로,
 * 영구적 실패는 {@link com.orbit.pipeline.core.error.PermanentPipelineException}으로 알립니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Fetcher {

    /**
     * 페이지 수집.
     *
     * @param subject 대상
     * @return 수집된 페이지 묶음
     * @throws IOException 네트워크 오류 등 일시적 실패
     */
    PageBundle fetch(SubjectKey subject) throws IOException;
}
