/**
 * 파이프라인 오케스트레이터 포트와 실행 핸들.
 *
 * <p>{@link com.orbit.pipeline.application.orchestrator.PipelineRun}이 실행 상태와 이벤트 발행을 소유하고,
 * {@link com.orbit.pipeline.application.orchestrator.RunHandle}이 호출자에게 읽기 전용 뷰를 제공합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.application.orchestrator;
