package com.orbit.pipeline.application.cache;

import java.time.Duration;

/**
 * 결과 캐시 전략.
 *
 * <p>전략의 TTL은 쓰기 TTL이자 읽기 시 신선도 기준(maxAge)으로 함께 사용됩니다.</p>
 *
 * <ul>
 *   <li>AGGRESSIVE: 5분 (자주 바뀌는 데이터)</li>
 *   <li>BALANCED: 1시간 (기본)</li>
 *   <li>CONSERVATIVE: 24시간 (거의 바뀌지 않는 데이터)</li>
 *   <li>NO_CACHE: 캐시를 읽지도 쓰지도 않으며 백그라운드 갱신도 없음</li>
 * </ul>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public enum CacheStrategy {

    AGGRESSIVE(Duration.ofMinutes(5)),

    BALANCED(Duration.ofHours(1)),

    CONSERVATIVE(Duration.ofHours(24)),

    NO_CACHE(Duration.ZERO);

    private final Duration ttl;

    CacheStrategy(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration ttl() {
        return ttl;
    }

    public boolean isEnabled() {
        return this != NO_CACHE;
    }
}
