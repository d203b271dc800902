package com.orbit.pipeline.core.spi;

import com.orbit.pipeline.core.contract.StructuredRecord;
import com.orbit.pipeline.core.contract.ValidationReport;

/**
 * 레코드 검증기.
 *
 * <p>부수 효과 없는 순수 함수여야 합니다. 원격 호출 보호 대상이 아닙니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Validator {

    /**
     * 레코드 검증.
     *
     * @param record 구조화 레코드
     * @return 점수와 문제 목록
     */
    ValidationReport validate(StructuredRecord record);
}
