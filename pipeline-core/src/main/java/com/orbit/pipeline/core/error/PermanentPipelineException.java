package com.orbit.pipeline.core.error;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p>잘못된 입력, 4xx 응답, 스키마 위반 등 재시도해도 성공할 수 없는 오류입니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class PermanentPipelineException extends PipelineException {

    public PermanentPipelineException(String message) {
        this(message, null, null);
    }

    public PermanentPipelineException(String message, Throwable cause) {
        this(message, null, cause);
    }

    protected PermanentPipelineException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, ErrorKind.PERMANENT, cause);
    }
}
