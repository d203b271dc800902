package com.orbit.pipeline.core.contract;

import java.time.Duration;
import java.time.Instant;

/**
 * 결과 캐시 엔트리 (불변).
 *
 * <p>메모리 캐시와 영속 저장소가 공유하는 레이아웃입니다. 적중 시 {@link #withHit()}으로
 * 새 인스턴스를 만들어 교체하므로 동일 키에 대한 읽기/쓰기가 부분적으로 관측되지 않습니다.</p>
 *
 * @param key 캐시 키
 * @param value 캐시 값
 * @param createdAt 생성 시각
 * @param expiresAt 만료 시각 (배타적)
 * @param hitCount 적중 횟수
 * @param qualityTag 품질 태그 (예: 품질 등급)
 * @param contentHash 값의 안정 해시 (변경 감지용)
 * @param <V> 값 타입
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record CacheEntry<V>(
    String key,
    V value,
    Instant createdAt,
    Instant expiresAt,
    long hitCount,
    String qualityTag,
    String contentHash
) {

    public CacheEntry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("createdAt and expiresAt cannot be null");
        }
        if (expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException(
                "expiresAt must not precede createdAt (createdAt: " + createdAt + ", expiresAt: " + expiresAt + ")"
            );
        }
        if (hitCount < 0) {
            throw new IllegalArgumentException("hitCount must not be negative (current: " + hitCount + ")");
        }
        qualityTag = qualityTag == null ? "unknown" : qualityTag;
    }

    /**
     * 주어진 시각 기준 만료 여부.
     *
     * @param now 기준 시각
     * @return {@code now >= expiresAt}이면 true
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * 주어진 시각 기준 경과 시간.
     *
     * @param now 기준 시각
     * @return now - createdAt
     */
    public Duration ageAt(Instant now) {
        return Duration.between(createdAt, now);
    }

    /**
     * 적중 횟수를 1 증가시킨 새 엔트리.
     *
     * @return 새 CacheEntry
     */
    public CacheEntry<V> withHit() {
        return new CacheEntry<>(key, value, createdAt, expiresAt, hitCount + 1, qualityTag, contentHash);
    }
}
