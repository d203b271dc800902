package com.orbit.pipeline.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED --(연속 실패 ≥ 임계값)--> OPEN
 * OPEN --(복구 대기 시간 경과 후 첫 호출)--> HALF_OPEN
 * HALF_OPEN --(시험 호출 성공)--> CLOSED
 * HALF_OPEN --(시험 호출 실패)--> OPEN
 * </pre>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /** 정상 동작. 모든 호출 허용, 연속 실패 수 추적. */
    CLOSED,

    /** 차단. 복구 대기 시간 동안 모든 호출 즉시 거부. */
    OPEN,

    /** 복구 시험. 단 하나의 시험 호출만 허용. */
    HALF_OPEN
}
