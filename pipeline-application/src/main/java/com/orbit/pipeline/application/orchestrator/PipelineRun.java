package com.orbit.pipeline.application.orchestrator;

import com.orbit.pipeline.core.contract.Artifact;
import com.orbit.pipeline.core.error.ErrorKind;
import com.orbit.pipeline.core.model.RunId;
import com.orbit.pipeline.core.model.SubjectKey;
import com.orbit.pipeline.core.model.Variant;
import com.orbit.pipeline.core.outcome.Cancelled;
import com.orbit.pipeline.core.outcome.Completed;
import com.orbit.pipeline.core.outcome.Failed;
import com.orbit.pipeline.core.outcome.RunOutcome;
import com.orbit.pipeline.core.outcome.StageFailure;
import com.orbit.pipeline.core.progress.ProgressEvent;
import com.orbit.pipeline.core.statemachine.PipelineStage;
import com.orbit.pipeline.core.statemachine.StageTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 진행 중인 파이프라인 실행 한 건의 상태.
 *
 * <p>단계 전이와 진행 이벤트 발행을 한 곳에서 수행하여 다음을 보장합니다.</p>
 *
 * <ul>
 *   <li>단계는 {@link StageTransition} 규칙대로만 전이</li>
 *   <li>진행률은 감소하지 않음</li>
 *   <li>종료 이벤트는 정확히 한 번, 마지막에 발행되고 그와 동시에 결과 Future가 완료됨</li>
 * </ul>
 *
 * <p>실행을 만든 오케스트레이터 호출만 이 객체를 변경합니다.
 * 호출자에게는 {@link RunHandle}을 통해 읽기와 취소 요청만 노출됩니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class PipelineRun {

    private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);

    private final RunId runId;
    private final SubjectKey subject;
    private final Variant variant;
    private final Clock clock;
    private final Instant startedAt;
    private final ProgressChannel channel = new ProgressChannel();
    private final CompletableFuture<RunOutcome> outcome = new CompletableFuture<>();
    private final List<Runnable> cancelHooks = new ArrayList<>();

    private PipelineStage stage = PipelineStage.INITIALIZED;
    private int progressPct;
    private boolean cancelRequested;

    public PipelineRun(RunId runId, SubjectKey subject, Variant variant, Clock clock) {
        if (runId == null || subject == null || variant == null || clock == null) {
            throw new IllegalArgumentException("runId, subject, variant and clock cannot be null");
        }
        this.runId = runId;
        this.subject = subject;
        this.variant = variant;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * 실행 시작 이벤트(INITIALIZED, 0%) 발행.
     *
     * @param message 메시지
     */
    public synchronized void start(String message) {
        if (!channel.history().isEmpty()) {
            throw new IllegalStateException("Run already started: " + runId);
        }
        publish(PipelineStage.INITIALIZED, 0, message, Map.of());
    }

    /**
     * 비종료 단계로 진행.
     *
     * <p>같은 단계 안에서 진행률만 올리는 것도 허용됩니다 (예: FETCHING 20% → 40%).</p>
     *
     * @param next 다음 단계 (현재 단계와 같을 수 있음)
     * @param pct 진행률
     * @param message 메시지
     * @param metadata 부가 정보
     * @throws IllegalStateException 잘못된 전이이거나 진행률이 감소한 경우
     */
    public synchronized void advance(PipelineStage next, int pct, String message, Map<String, Object> metadata) {
        if (next.isTerminal()) {
            throw new IllegalArgumentException("Use complete, fail or cancelled for terminal stage: " + next);
        }
        if (next != stage) {
            StageTransition.validate(stage, next);
        } else if (stage.isTerminal()) {
            throw new IllegalStateException("Run already finished: " + runId + " (" + stage + ")");
        }
        publish(next, pct, message, metadata);
    }

    /**
     * 성공 종료 (COMPLETED, 100%).
     *
     * @param artifact 결과물
     * @param fromCache 캐시 적중 여부
     * @param message 메시지
     * @return 이 호출이 실행을 종료시켰으면 true, 이미 종료된 경우 false
     */
    public synchronized boolean complete(Artifact artifact, boolean fromCache, String message) {
        if (stage.isTerminal()) {
            log.debug("Ignoring completion of finished run: runId={}, stage={}", runId, stage);
            return false;
        }
        StageTransition.validate(stage, PipelineStage.COMPLETED);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ProgressEvent.RESULT, artifact);
        metadata.put(ProgressEvent.CACHED, fromCache);
        publish(PipelineStage.COMPLETED, 100, message, metadata);
        outcome.complete(new Completed(runId, artifact, fromCache));
        return true;
    }

    /**
     * 결과 저장과 성공 종료를 취소 요청과 원자적으로 수행.
     *
     * <p>취소가 이미 요청되었거나 실행이 끝났으면 {@code persist}를 호출하지 않고 false를 반환합니다.
     * {@code persist}가 실행되는 동안 들어온 취소 요청은 이 호출이 끝날 때까지 대기합니다.</p>
     *
     * @param artifact 결과물
     * @param persist 결과 저장 작업 (예외를 던지지 않아야 함)
     * @param message 메시지
     * @return 저장 후 실행을 종료시켰으면 true
     */
    public synchronized boolean commit(Artifact artifact, Runnable persist, String message) {
        if (cancelRequested || stage.isTerminal()) {
            return false;
        }
        persist.run();
        return complete(artifact, false, message);
    }

    /**
     * 실패 종료 (FAILED, 현재 진행률 유지).
     *
     * <p>실패 단계는 현재 단계입니다.</p>
     *
     * @param cause 원인 예외
     * @return 이 호출이 실행을 종료시켰으면 true, 이미 종료된 경우 false
     */
    public synchronized boolean fail(Throwable cause) {
        if (stage.isTerminal()) {
            log.debug("Ignoring failure of finished run: runId={}, stage={}", runId, stage);
            return false;
        }
        StageFailure failure = failureOf(cause);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("stage", failure.stage().name());
        metadata.put("errorKind", failure.kind().name());
        metadata.put("errorCode", failure.errorCode());
        metadata.put("error", failure.message());
        metadata.put(ProgressEvent.FAILURE, failure);
        publish(PipelineStage.FAILED, progressPct, "Failed at " + failure.stage() + ": " + failure.message(), metadata);
        outcome.complete(new Failed(runId, failure));
        return true;
    }

    /**
     * 취소 종료 (CANCELLED, 현재 진행률 유지).
     *
     * @return 이 호출이 실행을 종료시켰으면 true, 이미 종료된 경우 false
     */
    public synchronized boolean cancelled() {
        if (stage.isTerminal()) {
            return false;
        }
        PipelineStage at = stage;
        publish(PipelineStage.CANCELLED, progressPct, "Cancelled during " + at, Map.of("stage", at.name()));
        outcome.complete(new Cancelled(runId, at));
        return true;
    }

    /**
     * 취소 요청.
     *
     * <p>플래그를 세우고 등록된 취소 훅을 실행합니다. 실제 CANCELLED 전이는
     * 실행 주체가 다음 단계 경계에서 수행합니다.</p>
     *
     * @return 요청이 받아들여졌으면 true (이미 종료된 실행이면 false)
     */
    public boolean requestCancel() {
        List<Runnable> hooks;
        synchronized (this) {
            if (stage.isTerminal() || cancelRequested) {
                return false;
            }
            cancelRequested = true;
            hooks = List.copyOf(cancelHooks);
        }
        for (Runnable hook : hooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Cancel hook failed: runId={}", runId, e);
            }
        }
        return true;
    }

    /**
     * 취소 요청 시 실행할 훅 등록 (예: 진행 중인 원격 호출 취소).
     *
     * <p>이미 취소가 요청된 상태라면 즉시 실행됩니다.</p>
     *
     * @param hook 훅
     */
    public void onCancel(Runnable hook) {
        boolean runNow;
        synchronized (this) {
            runNow = cancelRequested;
            if (!runNow) {
                cancelHooks.add(hook);
            }
        }
        if (runNow) {
            hook.run();
        }
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    public synchronized PipelineStage stage() {
        return stage;
    }

    public synchronized int progressPct() {
        return progressPct;
    }

    public RunId runId() {
        return runId;
    }

    public SubjectKey subject() {
        return subject;
    }

    public Variant variant() {
        return variant;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public ProgressChannel channel() {
        return channel;
    }

    /**
     * 결과 Future (항상 정상 완료되며 예외로 완료되지 않음).
     *
     * @return 결과 Future
     */
    public CompletableFuture<RunOutcome> outcome() {
        return outcome;
    }

    private StageFailure failureOf(Throwable cause) {
        try {
            return StageFailure.of(stage, cause);
        } catch (RuntimeException e) {
            log.warn("Could not classify failure, recording as PERMANENT: runId={}", runId, e);
            return new StageFailure(stage, ErrorKind.PERMANENT, "UNKNOWN", String.valueOf(cause), cause);
        }
    }

    private void publish(PipelineStage next, int pct, String message, Map<String, Object> metadata) {
        if (pct < progressPct) {
            throw new IllegalStateException(
                "progressPct must not decrease (current: " + progressPct + ", requested: " + pct + ")"
            );
        }
        channel.publish(new ProgressEvent(runId, next, pct, message, clock.instant(), metadata));
        stage = next;
        progressPct = pct;
    }

    @Override
    public synchronized String toString() {
        return "PipelineRun{runId=" + runId + ", subject=" + subject.getValue() + ", variant=" + variant
            + ", stage=" + stage + ", progressPct=" + progressPct + "}";
    }
}
