/**
 * 파이프라인 실행 결과 타입.
 *
 * <p>{@link com.orbit.pipeline.core.outcome.RunOutcome}은 sealed interface이며
 * Completed, Failed, Cancelled 세 가지 경우만 존재합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.core.outcome;
