/**
 * 식별자 값 객체 패키지.
 *
 * <p>파이프라인 실행과 캐시를 식별하는 불변 값 객체를 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link com.orbit.pipeline.core.model.SubjectKey} - 대상 (예: 회사명)</li>
 *   <li>{@link com.orbit.pipeline.core.model.Variant} - 렌더링 변형</li>
 *   <li>{@link com.orbit.pipeline.core.model.RunId} - 실행 단위 식별자</li>
 *   <li>{@link com.orbit.pipeline.core.model.CacheKey} - (대상, 변형) 결과 캐시 키</li>
 * </ul>
 *
 * <p>모든 값 객체는 정적 팩토리 메서드({@code of})로만 생성되며, 생성 시점에 유효성을 검증합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.core.model;
