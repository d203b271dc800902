package com.orbit.pipeline.core.statemachine;

/**
 * 파이프라인 실행 단계.
 *
 * <p><strong>정상 흐름:</strong></p>
 * <pre>
 * INITIALIZED → FETCHING → EXTRACTING → VALIDATING → RENDERING → COMPLETED
 * </pre>
 *
 * <ul>
 *   <li>INITIALIZED → COMPLETED: 캐시 적중</li>
 *   <li>비종료 단계 → FAILED: 단계 실패</li>
 *   <li>비종료 단계 → CANCELLED: 호출자 취소</li>
 * </ul>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public enum PipelineStage {

    /** 실행 생성 직후 (캐시 조회 전). */
    INITIALIZED,

    /** 원본 페이지 수집 중. */
    FETCHING,

    /** 구조화 레코드 추출 중. */
    EXTRACTING,

    /** 레코드 검증 중. */
    VALIDATING,

    /** 결과 문서 렌더링 중. */
    RENDERING,

    /** 성공 종료. */
    COMPLETED,

    /** 실패 종료. */
    FAILED,

    /** 취소 종료. */
    CANCELLED;

    /**
     * 종료 단계인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
