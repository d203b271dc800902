package com.orbit.pipeline.core.error;

/**
 * 일시적 실패 (재시도 가능).
 *
 * <p>네트워크 타임아웃, 업스트림 요청 한도 초과, 5xx 응답 등
 * 잠시 후 다시 시도하면 성공할 수 있는 오류입니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class TransientPipelineException extends PipelineException {

    public TransientPipelineException(String message) {
        this(message, null, null);
    }

    public TransientPipelineException(String message, Throwable cause) {
        this(message, null, cause);
    }

    protected TransientPipelineException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, ErrorKind.TRANSIENT, cause);
    }
}
