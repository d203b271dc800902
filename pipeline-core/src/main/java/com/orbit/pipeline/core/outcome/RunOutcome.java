package com.orbit.pipeline.core.outcome;

import com.orbit.pipeline.core.model.RunId;

/**
 * 파이프라인 실행 결과.
 *
 * <ul>
 *   <li>{@link Completed}: 결과물 생성 또는 캐시 적중</li>
 *   <li>{@link Failed}: 특정 단계에서 실패</li>
 *   <li>{@link Cancelled}: 호출자가 취소</li>
 * </ul>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public sealed interface RunOutcome permits Completed, Failed, Cancelled {

    /**
     * 실행 ID 조회.
     *
     * @return RunId
     */
    RunId runId();

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    default boolean isCancelled() {
        return this instanceof Cancelled;
    }
}
