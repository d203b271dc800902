package com.orbit.pipeline.core.outcome;

import com.orbit.pipeline.core.contract.Artifact;
import com.orbit.pipeline.core.model.RunId;

/**
 * 성공 결과.
 *
 * @param runId 실행 ID
 * @param artifact 결과물
 * @param fromCache 캐시 적중으로 완료되었는지 여부
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record Completed(RunId runId, Artifact artifact, boolean fromCache) implements RunOutcome {

    public Completed {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (artifact == null) {
            throw new IllegalArgumentException("artifact cannot be null");
        }
    }
}
