package com.orbit.pipeline.core.protection;

import java.time.Duration;

/**
 * Timeout Policy SPI.
 *
 * <p>원격 호출 한 번(시도 단위)의 최대 허용 시간을 정합니다.
 * 재시도를 포함한 전체 마감 시간은 다루지 않습니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public interface TimeoutPolicy {

    /**
     * 시도당 타임아웃 조회.
     *
     * @param operationKey 작업 키 (예: "fetch")
     * @return 타임아웃, {@link Duration#ZERO}는 타임아웃 없음
     */
    Duration getPerAttemptTimeout(String operationKey);

    /**
     * 타임아웃 발생 기록.
     *
     * @param operationKey 작업 키
     * @param elapsed 실제 경과 시간
     */
    void recordTimeout(String operationKey, Duration elapsed);
}
