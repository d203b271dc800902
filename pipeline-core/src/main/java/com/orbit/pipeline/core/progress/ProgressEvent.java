package com.orbit.pipeline.core.progress;

import com.orbit.pipeline.core.contract.Artifact;
import com.orbit.pipeline.core.model.RunId;
import com.orbit.pipeline.core.outcome.StageFailure;
import com.orbit.pipeline.core.statemachine.PipelineStage;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 파이프라인 진행 이벤트.
 *
 * <p>한 실행에서 발행되는 이벤트는 진행률이 감소하지 않으며,
 * 마지막 이벤트는 항상 종료 단계(COMPLETED, FAILED, CANCELLED)입니다.</p>
 *
 * <p><strong>메타데이터 키:</strong></p>
 * <ul>
 *   <li>{@value #RESULT}: COMPLETED 이벤트의 {@link Artifact}</li>
 *   <li>{@value #CACHED}: 캐시 적중 여부</li>
 *   <li>{@value #FAILURE}: FAILED 이벤트의 {@link StageFailure}</li>
 * </ul>
 *
 * @param runId 실행 ID
 * @param stage 단계
 * @param progressPct 진행률 (0~100)
 * @param message 사람이 읽을 수 있는 메시지
 * @param timestamp 발행 시각
 * @param metadata 단계별 부가 정보
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record ProgressEvent(
    RunId runId,
    PipelineStage stage,
    int progressPct,
    String message,
    Instant timestamp,
    Map<String, Object> metadata
) {

    public static final String RESULT = "result";
    public static final String CACHED = "cached";
    public static final String FAILURE = "failure";

    public ProgressEvent {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (progressPct < 0 || progressPct > 100) {
            throw new IllegalArgumentException("progressPct must be between 0 and 100 (current: " + progressPct + ")");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        message = message == null ? "" : message;
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 종료 이벤트인지 확인.
     *
     * @return 종료 단계이면 true
     */
    public boolean isTerminal() {
        return stage.isTerminal();
    }

    /**
     * COMPLETED 이벤트에 첨부된 결과물.
     *
     * @return 결과물 (없으면 empty)
     */
    public Optional<Artifact> artifact() {
        Object value = metadata.get(RESULT);
        return value instanceof Artifact artifact ? Optional.of(artifact) : Optional.empty();
    }

    /**
     * FAILED 이벤트에 첨부된 실패 정보.
     *
     * @return 실패 정보 (없으면 empty)
     */
    public Optional<StageFailure> failure() {
        Object value = metadata.get(FAILURE);
        return value instanceof StageFailure failure ? Optional.of(failure) : Optional.empty();
    }

    /**
     * 캐시 적중으로 완료된 이벤트인지 확인.
     *
     * @return cached 메타데이터가 true이면 true
     */
    public boolean isCached() {
        return Boolean.TRUE.equals(metadata.get(CACHED));
    }
}
