package com.orbit.pipeline.adapter.protection.retry;

import com.orbit.pipeline.core.error.ErrorKind;

import java.util.function.Predicate;

/**
 * 재시도 대상 판정 predicate 모음.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class RetryPredicates {

    private RetryPredicates() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * {@link ErrorKind#TRANSIENT}로 분류되는 오류만 재시도.
     *
     * <p>Circuit Breaker로 보호된 호출을 재시도할 때는 이 predicate를 사용해야 합니다.
     * {@link com.orbit.pipeline.core.error.CircuitBreakerOpenException}은 BREAKER_OPEN으로 분류되어
     * 재시도하지 않습니다. 이는 재시도 정책이 자동으로 판단하는 것이 아니라 호출자가 선택하는 설정입니다.</p>
     *
     * @return predicate
     */
    public static Predicate<Throwable> transientOnly() {
        return throwable -> ErrorKind.classify(throwable).isRetryable();
    }
}
