package com.orbit.pipeline.core.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 오류 분류.
 *
 * <p>재시도 정책과 실패 보고에서 사용하는 오류 종류입니다.</p>
 *
 * <ul>
 *   <li>TRANSIENT: 네트워크 타임아웃, 업스트림 요청 한도 초과, 5xx 계열 (재시도 대상)</li>
 *   <li>PERMANENT: 잘못된 입력, 4xx 계열, 스키마 위반 (재시도 불가)</li>
 *   <li>BREAKER_OPEN: Circuit Breaker가 OPEN 상태라 호출 자체를 하지 않음 (재시도 불가)</li>
 *   <li>CACHE: 캐시 영속화 I/O 실패 (캐시 미스로 강등, 호출자에게 전파하지 않음)</li>
 * </ul>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public enum ErrorKind {

    TRANSIENT,

    PERMANENT,

    BREAKER_OPEN,

    CACHE;

    /**
     * 재시도로 회복될 가능성이 있는 종류인지 확인.
     *
     * @return TRANSIENT인 경우에만 true
     */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }

    /**
     * 예외를 오류 종류로 분류.
     *
     * <p>{@link CompletionException}, {@link ExecutionException} 래퍼는 먼저 벗겨냅니다.</p>
     *
     * <ul>
     *   <li>{@link PipelineException} → 자신의 kind</li>
     *   <li>{@link TimeoutException}, {@link IOException}, {@link UncheckedIOException} → TRANSIENT</li>
     *   <li>그 외 → PERMANENT</li>
     * </ul>
     *
     * @param throwable 분류할 예외
     * @return 오류 종류
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public static ErrorKind classify(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        Throwable cause = unwrap(throwable);
        if (cause instanceof PipelineException pipelineException) {
            return pipelineException.getKind();
        }
        if (cause instanceof TimeoutException
            || cause instanceof IOException
            || cause instanceof UncheckedIOException) {
            return TRANSIENT;
        }
        return PERMANENT;
    }

    /**
     * 비동기 래퍼 예외를 벗겨 원인 예외를 반환.
     *
     * @param throwable 예외
     * @return 가장 안쪽의 원인 (래퍼가 아니면 그대로)
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
