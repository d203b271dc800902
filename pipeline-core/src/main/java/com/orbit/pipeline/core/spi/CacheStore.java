package com.orbit.pipeline.core.spi;

import com.orbit.pipeline.core.contract.CacheEntry;
import com.orbit.pipeline.core.error.CacheException;

import java.util.List;

/**
 * 결과 캐시 영속 저장소 SPI.
 *
 * <p>키 하나당 엔트리 하나를 보관합니다. 결과 캐시는 시작 시 {@link #loadAll()}로
 * 엔트리를 읽어 들이고, 쓰기와 무효화를 저장소에 즉시 반영합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>save는 같은 키의 기존 엔트리를 덮어씀</li>
 *   <li>delete는 없는 키에 대해 아무 일도 하지 않음</li>
 *   <li>loadAll은 읽을 수 없는 엔트리를 건너뜀 (전체 실패 금지)</li>
 * </ul>
 *
 * @param <V> 값 타입
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public interface CacheStore<V> {

    /**
     * 엔트리 저장.
     *
     * @param entry 엔트리
     * @throws CacheException I/O 실패
     */
    void save(CacheEntry<V> entry);

    /**
     * 엔트리 삭제.
     *
     * @param key 캐시 키
     * @throws CacheException I/O 실패
     */
    void delete(String key);

    /**
     * 저장된 모든 엔트리 로드 (만료 여부와 무관).
     *
     * @return 엔트리 목록
     * @throws CacheException 저장소 자체에 접근할 수 없는 경우
     */
    List<CacheEntry<V>> loadAll();
}
