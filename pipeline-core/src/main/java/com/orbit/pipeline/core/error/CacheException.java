package com.orbit.pipeline.core.error;

/**
 * 캐시 영속화 I/O 실패.
 *
 * <p>CacheStore 구현이 던지며, 결과 캐시는 이를 로그로 남기고 캐시 미스로 강등합니다.
 * 파이프라인 실패로 호출자에게 전파되지 않습니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class CacheException extends PipelineException {

    public CacheException(String message, Throwable cause) {
        super(message, "CACHE_ERROR", ErrorKind.CACHE, cause);
    }
}
