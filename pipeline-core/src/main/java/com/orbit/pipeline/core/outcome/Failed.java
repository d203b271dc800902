package com.orbit.pipeline.core.outcome;

import com.orbit.pipeline.core.model.RunId;

/**
 * 실패 결과.
 *
 * @param runId 실행 ID
 * @param failure 실패 단계와 원인
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record Failed(RunId runId, StageFailure failure) implements RunOutcome {

    public Failed {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
    }
}
