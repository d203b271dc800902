package com.orbit.pipeline.core.outcome;

import com.orbit.pipeline.core.error.ErrorKind;
import com.orbit.pipeline.core.error.PipelineException;
import com.orbit.pipeline.core.statemachine.PipelineStage;

/**
 * 실패한 단계와 원인.
 *
 * @param stage 실패가 발생한 단계
 * @param kind 오류 종류
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 예외 (없을 수 있음)
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record StageFailure(
    PipelineStage stage,
    ErrorKind kind,
    String errorCode,
    String message,
    Throwable cause
) {

    public StageFailure {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (stage.isTerminal()) {
            throw new IllegalArgumentException("stage must not be terminal (current: " + stage + ")");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        message = message == null ? "" : message;
    }

    /**
     * 예외로부터 StageFailure 생성.
     *
     * <p>비동기 래퍼는 벗겨내고, {@link PipelineException}이면 그 오류 코드를,
     * 아니면 예외 클래스의 단순 이름을 오류 코드로 사용합니다.</p>
     *
     * @param stage 실패 단계
     * @param throwable 원인 예외
     * @return StageFailure
     */
    public static StageFailure of(PipelineStage stage, Throwable throwable) {
        Throwable cause = ErrorKind.unwrap(throwable);
        String code = cause instanceof PipelineException pipelineException
            ? pipelineException.getErrorCode()
            : errorCodeOf(cause.getClass());
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new StageFailure(stage, ErrorKind.classify(cause), code, message, cause);
    }

    /**
     * 예외 클래스의 오류 코드 (익명 클래스는 이름이 비어 있으므로 전체 이름 사용).
     */
    private static String errorCodeOf(Class<?> type) {
        String simpleName = type.getSimpleName();
        return simpleName.isBlank() ? type.getName() : simpleName;
    }
}
