package com.orbit.pipeline.core.outcome;

import com.orbit.pipeline.core.model.RunId;
import com.orbit.pipeline.core.statemachine.PipelineStage;

/**
 * 취소 결과.
 *
 * @param runId 실행 ID
 * @param stage 취소가 관측된 단계
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record Cancelled(RunId runId, PipelineStage stage) implements RunOutcome {

    public Cancelled {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
    }
}
