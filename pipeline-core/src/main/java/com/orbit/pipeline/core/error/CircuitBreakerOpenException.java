package com.orbit.pipeline.core.error;

/**
 * Circuit Breaker가 OPEN 상태라 호출이 거부된 경우.
 *
 * <p>원격 호출을 시도하지 않고 합성된 오류이므로 그 자체로 재시도 대상이 아닙니다.
 * 재시도 정책의 predicate에서 이 예외를 재시도 불가로 분류하는 것은 호출자의 설정 책임입니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class CircuitBreakerOpenException extends PipelineException {

    public static final String ERROR_CODE = "CIRCUIT_BREAKER_OPEN";

    private final String breakerName;

    public CircuitBreakerOpenException(String breakerName) {
        super("Circuit breaker is OPEN for " + breakerName, ERROR_CODE, ErrorKind.BREAKER_OPEN, null);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
