package com.orbit.pipeline.application.orchestrator;

import com.orbit.pipeline.core.contract.Artifact;
import com.orbit.pipeline.core.model.SubjectKey;
import com.orbit.pipeline.core.model.Variant;

import java.util.Optional;

/**
 * 파이프라인 오케스트레이터 포트.
 *
 * <p>대상과 변형에 대한 결과물을 만들어 냅니다. 캐시를 먼저 확인하고,
 * 미스인 경우 수집 → 추출 → 검증 → 렌더링 단계를 순서대로 실행합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * run(subject, variant)
 *   ↓
 * INITIALIZED(0%) ── 캐시 적중 ──→ COMPLETED(100%, cached=true)
 *   ↓ 미스
 * FETCHING(20/40) → EXTRACTING(50/70) → VALIDATING(75/80) → RENDERING(85/95)
 *   ↓
 * 캐시 저장 → COMPLETED(100%) → 백그라운드 갱신 예약
 *
 * 어느 단계든 실패 → FAILED (실패 단계, 오류 종류 포함)
 * </pre>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public interface PipelineOrchestrator {

    /**
     * 파이프라인 실행.
     *
     * <p>즉시 핸들을 반환하며, 실행은 비동기로 진행됩니다.
     * 캐시 적중 시 핸들은 이미 종료된 상태일 수 있습니다.</p>
     *
     * @param subject 대상
     * @param variant 변형
     * @param forceRefresh true면 캐시를 읽지 않고 항상 전체 파이프라인 실행
     * @return 실행 핸들
     */
    RunHandle run(SubjectKey subject, Variant variant, boolean forceRefresh);

    /**
     * 캐시를 우선하는 파이프라인 실행.
     *
     * @param subject 대상
     * @param variant 변형
     * @return 실행 핸들
     */
    default RunHandle run(SubjectKey subject, Variant variant) {
        return run(subject, variant, false);
    }

    /**
     * 캐시된 결과물 조회 (파이프라인을 실행하지 않음).
     *
     * @param subject 대상
     * @param variant 변형
     * @return 신선한 캐시 결과물 (없으면 empty)
     */
    Optional<Artifact> getCached(SubjectKey subject, Variant variant);

    /**
     * 대상의 모든 변형에 대한 캐시 무효화.
     *
     * @param subject 대상
     * @return 삭제된 엔트리 수
     */
    int invalidate(SubjectKey subject);
}
