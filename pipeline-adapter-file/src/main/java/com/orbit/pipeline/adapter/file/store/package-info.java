/**
 * JSON 파일 기반 캐시 저장소.
 *
 * <p>{@link com.orbit.pipeline.adapter.file.store.JsonFileCacheStore}는 프로세스 재시작 후에도
 * 캐시를 유지하기 위한 디스크 영속화를 담당합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.adapter.file.store;
