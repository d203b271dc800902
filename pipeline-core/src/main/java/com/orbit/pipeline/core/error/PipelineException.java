package com.orbit.pipeline.core.error;

/**
 * 파이프라인 예외 계층의 최상위 타입.
 *
 * <p>모든 파이프라인 예외는 오류 코드와 {@link ErrorKind}를 가집니다.
 * 오류 코드를 지정하지 않으면 구체 클래스의 단순 이름을 사용합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public abstract class PipelineException extends RuntimeException {

    private final String errorCode;
    private final ErrorKind kind;

    protected PipelineException(String message, String errorCode, ErrorKind kind, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.errorCode = (errorCode == null || errorCode.isBlank()) ? getClass().getSimpleName() : errorCode;
        this.kind = kind;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: CIRCUIT_BREAKER_OPEN)
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * 오류 종류 조회.
     *
     * @return 오류 종류
     */
    public ErrorKind getKind() {
        return kind;
    }
}
