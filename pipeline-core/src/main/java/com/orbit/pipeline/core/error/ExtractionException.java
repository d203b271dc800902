package com.orbit.pipeline.core.error;

/**
 * 구조화 추출 실패 (응답이 스키마를 위반하는 등).
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class ExtractionException extends PermanentPipelineException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
