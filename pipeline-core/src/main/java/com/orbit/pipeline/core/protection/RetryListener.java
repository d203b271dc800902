package com.orbit.pipeline.core.protection;

import java.time.Duration;

/**
 * 재시도 관찰자.
 *
 * <p>재시도 지연을 시작하기 직전에 호출됩니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryListener {

    /** 아무것도 하지 않는 관찰자. */
    RetryListener NONE = (operation, attempt, delay, error) -> { };

    /**
     * 재시도 예정 알림.
     *
     * @param operation 작업 이름
     * @param attempt 실패한 시도 번호 (1부터)
     * @param delay 다음 시도까지의 지연
     * @param error 실패 원인
     */
    void onRetry(String operation, int attempt, Duration delay, Throwable error);
}
