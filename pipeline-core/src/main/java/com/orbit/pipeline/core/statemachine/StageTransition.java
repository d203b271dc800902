package com.orbit.pipeline.core.statemachine;

/**
 * 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INITIALIZED → FETCHING → EXTRACTING → VALIDATING → RENDERING → COMPLETED (순서대로만)</li>
 *   <li>INITIALIZED → COMPLETED (캐시 적중)</li>
 *   <li>비종료 단계 → FAILED, CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 단계에서는 어떤 단계로도 전이 불가</li>
 *   <li>단계 건너뛰기 및 역방향 전이 불가</li>
 * </ul>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class StageTransition {

    private StageTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(PipelineStage from, PipelineStage to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Stages cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal stage: %s → %s", from, to)
            );
        }

        boolean valid = switch (to) {
            case FAILED, CANCELLED -> true;
            case COMPLETED -> from == PipelineStage.INITIALIZED || from == PipelineStage.RENDERING;
            case INITIALIZED -> false;
            default -> to.ordinal() == from.ordinal() + 1;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid stage transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static PipelineStage transition(PipelineStage current, PipelineStage next) {
        validate(current, next);
        return next;
    }
}
