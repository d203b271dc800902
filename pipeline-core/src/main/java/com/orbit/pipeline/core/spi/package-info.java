/**
 * 파이프라인 외부 의존성 SPI.
 *
 * <p>Fetcher, Extractor, Renderer는 원격 호출을 수행하며 보호 계층을 거쳐 호출됩니다.
 * Validator는 순수 함수입니다. CacheStore와 ContentHasher는 결과 캐시가 사용합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.core.spi;
