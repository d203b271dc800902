/**
 * 파이프라인 실행 단계와 전이 규칙.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.core.statemachine;
