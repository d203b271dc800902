package com.orbit.pipeline.application.cache;

import com.orbit.pipeline.core.contract.CacheEntry;
import com.orbit.pipeline.core.error.CacheException;
import com.orbit.pipeline.core.spi.CacheStore;
import com.orbit.pipeline.core.spi.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * TTL 기반 결과 캐시 (영속 저장소 미러링).
 *
 * <p>메모리 맵이 기준이며, 모든 쓰기와 삭제는 {@link CacheStore}에 동기적으로 반영됩니다.
 * 생성 시 저장소에서 아직 만료되지 않은 엔트리를 모두 읽어 들이므로 재시작 후에도
 * 비싼 파이프라인을 다시 실행하지 않습니다.</p>
 *
 * <p><strong>신선도 규칙:</strong></p>
 * <ul>
 *   <li>{@code now >= expiresAt}: 만료. 읽는 시점에 메모리와 저장소에서 제거</li>
 *   <li>{@code maxAge} 지정 시 {@code now - createdAt > maxAge}: 이 호출에 대해서만 미스 (엔트리는 유지)</li>
 *   <li>적중 시 hitCount 1 증가 (메모리에만 반영)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 같은 키에 대한 연산은 {@link ConcurrentHashMap#compute}로 직렬화되며,
 * 저장소 쓰기도 그 안에서 수행되어 메모리와 저장소의 쓰기 순서가 일치합니다.</p>
 *
 * <p><strong>오류 처리:</strong> 저장소의 {@link CacheException}은 WARN 로그로 남기고
 * 메모리 캐시 동작을 그대로 유지합니다. 호출자에게 전파하지 않습니다.</p>
 *
 * <p>용량 제한이나 LRU 축출은 없습니다. 엔트리 수는 (대상 × 변형) 수에 비례합니다.</p>
 *
 * @param <V> 값 타입
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class ResultCache<V> {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final CacheStore<V> store;
    private final ContentHasher<V> hasher;
    private final Clock clock;
    private final ConcurrentMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();

    /**
     * 캐시 생성 및 저장소 엔트리 로드.
     *
     * @param store 영속 저장소
     * @param hasher 값 해시 함수 (contentHash 미지정 시 사용)
     * @param clock 시계
     */
    public ResultCache(CacheStore<V> store, ContentHasher<V> hasher, Clock clock) {
        if (store == null || hasher == null || clock == null) {
            throw new IllegalArgumentException("store, hasher and clock cannot be null");
        }
        this.store = store;
        this.hasher = hasher;
        this.clock = clock;
        loadFromStore();
    }

    /**
     * 캐시 조회.
     *
     * @param key 캐시 키
     * @return 만료되지 않은 값 (없으면 empty)
     */
    public Optional<V> get(String key) {
        return get(key, null);
    }

    /**
     * 신선도 기준을 지정한 캐시 조회.
     *
     * @param key 캐시 키
     * @param maxAge 허용 최대 경과 시간 (null이면 TTL만 적용)
     * @return 신선한 값 (없으면 empty)
     */
    public Optional<V> get(String key, Duration maxAge) {
        requireKey(key);
        Instant now = clock.instant();
        AtomicReference<V> hit = new AtomicReference<>();
        AtomicBoolean expired = new AtomicBoolean();

        entries.computeIfPresent(key, (k, entry) -> {
            if (entry.isExpiredAt(now)) {
                expired.set(true);
                deleteFromStore(k);
                return null;
            }
            if (maxAge != null && entry.ageAt(now).compareTo(maxAge) > 0) {
                return entry;
            }
            CacheEntry<V> updated = entry.withHit();
            hit.set(updated.value());
            return updated;
        });

        if (expired.get()) {
            log.info("Cache EXPIRED: {}", key);
        } else if (hit.get() != null) {
            log.info("Cache HIT: {}", key);
        }
        return Optional.ofNullable(hit.get());
    }

    /**
     * 값 저장 (contentHash는 해시 함수로 계산).
     *
     * @param key 캐시 키
     * @param value 값
     * @param ttl 유효 기간 (양수)
     * @param qualityTag 품질 태그 (null이면 "unknown")
     * @return 저장된 엔트리
     */
    public CacheEntry<V> set(String key, V value, Duration ttl, String qualityTag) {
        return set(key, value, ttl, qualityTag, null);
    }

    /**
     * 값 저장.
     *
     * <p>기존 엔트리를 대체하며 hitCount는 0부터 다시 시작합니다.
     * 저장소 쓰기가 실패해도 메모리에는 저장됩니다.</p>
     *
     * @param key 캐시 키
     * @param value 값
     * @param ttl 유효 기간 (양수)
     * @param qualityTag 품질 태그 (null이면 "unknown")
     * @param contentHash 값 해시 (null이면 계산)
     * @return 저장된 엔트리
     */
    public CacheEntry<V> set(String key, V value, Duration ttl, String qualityTag, String contentHash) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        Instant now = clock.instant();
        String hash = contentHash != null ? contentHash : hasher.hash(value);
        CacheEntry<V> entry = new CacheEntry<>(key, value, now, now.plus(ttl), 0, qualityTag, hash);

        entries.compute(key, (k, previous) -> {
            saveToStore(entry);
            return entry;
        });
        log.info("Cache SET: {} (ttl={}, quality={}, hash={})", key, ttl, entry.qualityTag(), hash);
        return entry;
    }

    /**
     * 키 무효화 (메모리와 저장소 모두).
     *
     * @param key 캐시 키
     * @return 메모리에 엔트리가 있었으면 true
     */
    public boolean invalidate(String key) {
        requireKey(key);
        AtomicBoolean removed = new AtomicBoolean();
        entries.compute(key, (k, previous) -> {
            removed.set(previous != null);
            deleteFromStore(k);
            return null;
        });
        if (removed.get()) {
            log.info("Cache INVALIDATED: {}", key);
        }
        return removed.get();
    }

    /**
     * 부분 문자열을 포함하는 모든 키 무효화.
     *
     * @param substring 부분 문자열 (비어 있으면 안 됨)
     * @return 삭제된 엔트리 수
     */
    public int invalidatePattern(String substring) {
        if (substring == null || substring.isEmpty()) {
            throw new IllegalArgumentException("substring cannot be null or empty");
        }
        int removed = invalidateIf(entry -> entry.key().contains(substring)).size();
        log.info("Cache INVALIDATED pattern '{}': {} entries", substring, removed);
        return removed;
    }

    /**
     * 조건에 맞는 모든 엔트리 무효화 (만료 여부와 무관).
     *
     * @param condition 엔트리 조건
     * @return 삭제된 키 목록
     */
    public List<String> invalidateIf(Predicate<CacheEntry<V>> condition) {
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        List<String> matched = new ArrayList<>();
        for (CacheEntry<V> entry : entries.values()) {
            if (condition.test(entry)) {
                matched.add(entry.key());
            }
        }
        List<String> removed = new ArrayList<>();
        for (String key : matched) {
            if (invalidate(key)) {
                removed.add(key);
            }
        }
        return removed;
    }

    /**
     * 엔트리 조회 (적중 횟수를 바꾸지 않으며 만료 여부와 무관).
     *
     * @param key 캐시 키
     * @return 엔트리 (없으면 empty)
     */
    public Optional<CacheEntry<V>> entry(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * 메모리에 있는 엔트리 수 (만료되었지만 아직 읽히지 않은 엔트리 포함).
     *
     * @return 엔트리 수
     */
    public int size() {
        return entries.size();
    }

    private void loadFromStore() {
        List<CacheEntry<V>> loaded;
        try {
            loaded = store.loadAll();
        } catch (CacheException e) {
            log.warn("Failed to load cache store, starting empty", e);
            return;
        }
        Instant now = clock.instant();
        int skipped = 0;
        for (CacheEntry<V> entry : loaded) {
            if (entry.isExpiredAt(now)) {
                skipped++;
                continue;
            }
            entries.put(entry.key(), entry);
        }
        log.info("Loaded {} cache entries from store ({} expired skipped)", entries.size(), skipped);
    }

    private void saveToStore(CacheEntry<V> entry) {
        try {
            store.save(entry);
        } catch (CacheException e) {
            log.warn("Failed to persist cache entry {}, kept in memory only", entry.key(), e);
        }
    }

    private void deleteFromStore(String key) {
        try {
            store.delete(key);
        } catch (CacheException e) {
            log.warn("Failed to delete cache entry {} from store", key, e);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }
}
