package com.orbit.pipeline.core.error;

/**
 * 데이터 검증 실패.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class ValidationException extends PermanentPipelineException {

    public ValidationException(String message) {
        super(message);
    }
}
