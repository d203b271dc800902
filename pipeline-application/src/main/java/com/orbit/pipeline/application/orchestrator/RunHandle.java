package com.orbit.pipeline.application.orchestrator;

import com.orbit.pipeline.core.model.RunId;
import com.orbit.pipeline.core.model.SubjectKey;
import com.orbit.pipeline.core.model.Variant;
import com.orbit.pipeline.core.outcome.RunOutcome;
import com.orbit.pipeline.core.progress.ProgressListener;
import com.orbit.pipeline.core.statemachine.PipelineStage;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 파이프라인 실행 핸들.
 *
 * <p>{@link PipelineOrchestrator#run}이 즉시 반환하는 호출자용 뷰입니다.
 * 진행 상황 구독, 결과 대기, 취소 요청만 가능하며 실행 상태를 직접 바꿀 수 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RunHandle handle = orchestrator.run(SubjectKey.of("AcmeCo"), Variant.STRUCTURED);
 * handle.addListener(event -> ui.update(event.stage(), event.progressPct()));
 *
 * RunOutcome outcome = handle.await(Duration.ofMinutes(2));
 * if (outcome instanceof Completed completed) {
 *     render(completed.artifact());
 * }
 * }</pre>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class RunHandle {

    private final PipelineRun run;

    public RunHandle(PipelineRun run) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        this.run = run;
    }

    public RunId runId() {
        return run.runId();
    }

    public SubjectKey subject() {
        return run.subject();
    }

    public Variant variant() {
        return run.variant();
    }

    /**
     * 현재 단계.
     *
     * @return 단계
     */
    public PipelineStage stage() {
        return run.stage();
    }

    /**
     * 현재 진행률.
     *
     * @return 0~100
     */
    public int progressPct() {
        return run.progressPct();
    }

    /**
     * 큐 기반 진행 이벤트 구독 (이전 이벤트 재생 포함).
     *
     * @return 구독
     */
    public ProgressSubscription subscribe() {
        return run.channel().subscribe();
    }

    /**
     * 콜백 리스너 등록 (이전 이벤트 재생 포함).
     *
     * @param listener 리스너
     */
    public void addListener(ProgressListener listener) {
        run.channel().addListener(listener);
    }

    /**
     * 결과 Future.
     *
     * <p>반환된 Future를 취소하거나 완료시켜도 실행에는 영향이 없습니다.
     * 실행 취소는 {@link #cancel()}을 사용합니다.</p>
     *
     * @return 결과 Future의 사본
     */
    public CompletableFuture<RunOutcome> outcome() {
        return run.outcome().copy();
    }

    /**
     * 결과를 최대 timeout까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 실행 결과
     * @throws InterruptedException 대기 중 인터럽트 발생
     * @throws TimeoutException 시간 내 종료되지 않은 경우
     */
    public RunOutcome await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return run.outcome().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run outcome completed exceptionally: " + runId(), e.getCause());
        }
    }

    /**
     * 실행 취소 요청.
     *
     * <p>대기 중인 재시도와 토큰 대기는 즉시 취소됩니다. 이미 시작된 원격 호출은 끝까지 실행되지만
     * 그 결과는 버려지며, 실행은 다음 단계 경계에서 CANCELLED로 종료됩니다.</p>
     *
     * @return 요청이 받아들여졌으면 true (이미 종료된 실행이면 false)
     */
    public boolean cancel() {
        return run.requestCancel();
    }

    public boolean isCancelRequested() {
        return run.isCancelRequested();
    }

    @Override
    public String toString() {
        return "RunHandle{" + run + "}";
    }
}
