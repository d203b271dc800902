/**
 * 파이프라인 단계 간에 전달되는 데이터 계약 패키지.
 *
 * <p>외부 협력자(Fetcher, Extractor, Validator, Renderer)의 입출력 타입과
 * 결과 캐시 엔트리 레이아웃을 정의합니다. 모든 타입은 불변 record입니다.</p>
 *
 * <pre>
 * SubjectKey ─Fetcher→ PageBundle ─Extractor→ StructuredRecord ─Validator→ ValidationReport
 *                                                    │
 *                                                    └─Renderer→ RenderedDocument ─→ Artifact ─→ CacheEntry
 * </pre>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.core.contract;
