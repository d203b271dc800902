package com.orbit.pipeline.application.orchestrator;

import com.orbit.pipeline.core.contract.Artifact;
import com.orbit.pipeline.core.error.ExtractionException;
import com.orbit.pipeline.core.model.RunId;
import com.orbit.pipeline.core.model.SubjectKey;
import com.orbit.pipeline.core.model.Variant;
import com.orbit.pipeline.core.outcome.Cancelled;
import com.orbit.pipeline.core.outcome.Completed;
import com.orbit.pipeline.core.outcome.Failed;
import com.orbit.pipeline.core.outcome.RunOutcome;
import com.orbit.pipeline.core.progress.ProgressEvent;
import com.orbit.pipeline.core.statemachine.PipelineStage;
import com.orbit.pipeline.testkit.support.MutableClock;
import com.orbit.pipeline.testkit.support.RecordingProgressListener;
import com.orbit.pipeline.testkit.support.TestArtifacts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PipelineRun, RunHandle, ProgressChannel 유닛 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class PipelineRunTest {

    private MutableClock clock;
    private PipelineRun run;
    private RunHandle handle;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        run = new PipelineRun(RunId.of("run-1"), SubjectKey.of("AcmeCo"), Variant.STRUCTURED, clock);
        handle = new RunHandle(run);
    }

    // ============================================================
    // 1. 정상 흐름
    // ============================================================

    @Test
    void 전체_단계를_거쳐_완료하면_결과_Future가_Completed로_완료됨() throws Exception {
        // given
        RecordingProgressListener listener = new RecordingProgressListener();
        handle.addListener(listener);
        Artifact artifact = TestArtifacts.artifact("acmeco", clock.instant());

        // when
        run.start("Starting");
        run.advance(PipelineStage.FETCHING, 20, "Fetching", Map.of());
        run.advance(PipelineStage.FETCHING, 40, "Fetched", Map.of("pagesFetched", 3));
        run.advance(PipelineStage.EXTRACTING, 50, "Extracting", Map.of());
        run.advance(PipelineStage.VALIDATING, 75, "Validating", Map.of());
        run.advance(PipelineStage.RENDERING, 85, "Rendering", Map.of());
        run.complete(artifact, false, "Done");

        // then
        assertThat(listener.percentages()).containsExactly(0, 20, 40, 50, 75, 85, 100);
        assertThat(listener.last().artifact()).contains(artifact);
        RunOutcome outcome = handle.await(Duration.ofSeconds(1));
        assertThat(outcome).isEqualTo(new Completed(RunId.of("run-1"), artifact, false));
        assertThat(handle.stage()).isEqualTo(PipelineStage.COMPLETED);
    }

    @Test
    void 늦게_구독해도_이전_이벤트를_모두_재생함() throws Exception {
        // given
        run.start("Starting");
        run.advance(PipelineStage.FETCHING, 20, "Fetching", Map.of());
        run.fail(new ExtractionException("bad"));

        // when
        List<ProgressEvent> events = handle.subscribe().awaitAll(Duration.ofSeconds(1));

        // then
        assertThat(events).extracting(ProgressEvent::stage)
            .containsExactly(PipelineStage.INITIALIZED, PipelineStage.FETCHING, PipelineStage.FAILED);
    }

    // ============================================================
    // 2. 실패와 취소
    // ============================================================

    @Test
    void 실패하면_현재_단계와_진행률로_FAILED_이벤트가_발행됨() throws Exception {
        // given
        run.start("Starting");
        run.advance(PipelineStage.FETCHING, 40, "Fetched", Map.of());
        run.advance(PipelineStage.EXTRACTING, 50, "Extracting", Map.of());

        // when
        boolean finished = run.fail(new ExtractionException("schema violation"));

        // then
        assertThat(finished).isTrue();
        ProgressEvent last = run.channel().history().get(3);
        assertThat(last.stage()).isEqualTo(PipelineStage.FAILED);
        assertThat(last.progressPct()).isEqualTo(50);
        assertThat(last.metadata()).containsEntry("stage", "EXTRACTING")
            .containsEntry("errorKind", "PERMANENT")
            .containsEntry("errorCode", "ExtractionException")
            .containsEntry("error", "schema violation");
        Failed failed = (Failed) handle.await(Duration.ofSeconds(1));
        assertThat(failed.failure().stage()).isEqualTo(PipelineStage.EXTRACTING);
    }

    @Test
    void 취소_요청은_훅을_실행하고_cancelled는_CANCELLED로_종료함() throws Exception {
        // given
        AtomicInteger hookCalls = new AtomicInteger();
        run.start("Starting");
        run.advance(PipelineStage.FETCHING, 20, "Fetching", Map.of());
        run.onCancel(hookCalls::incrementAndGet);

        // when
        boolean accepted = handle.cancel();
        run.cancelled();

        // then
        assertThat(accepted).isTrue();
        assertThat(hookCalls.get()).isEqualTo(1);
        assertThat(handle.cancel()).isFalse();
        assertThat(handle.await(Duration.ofSeconds(1))).isEqualTo(new Cancelled(RunId.of("run-1"), PipelineStage.FETCHING));
        assertThat(run.channel().isClosed()).isTrue();
    }

    @Test
    void 종료_후_다른_종료는_무시됨() {
        // given
        run.start("Starting");
        run.fail(new ExtractionException("bad"));

        // when & then
        assertThat(run.cancelled()).isFalse();
        assertThat(run.fail(new ExtractionException("again"))).isFalse();
        assertThat(run.channel().history()).hasSize(2);
    }

    @Test
    void 취소가_요청된_실행은_commit에서_저장하지_않고_false를_반환함() {
        // given
        AtomicInteger persisted = new AtomicInteger();
        advanceToRendering();
        handle.cancel();

        // when
        boolean committed = run.commit(TestArtifacts.artifact("acmeco", clock.instant()),
            persisted::incrementAndGet, "Done");

        // then
        assertThat(committed).isFalse();
        assertThat(persisted).hasValue(0);
        assertThat(handle.stage()).isEqualTo(PipelineStage.RENDERING);
    }

    @Test
    void commit_중에_들어온_취소_요청은_저장과_완료가_끝난_뒤_거부됨() throws Exception {
        // given
        advanceToRendering();
        CountDownLatch persisting = new CountDownLatch(1);
        AtomicReference<Boolean> cancelAccepted = new AtomicReference<>();
        Thread canceller = new Thread(() -> {
            try {
                persisting.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            cancelAccepted.set(handle.cancel());
        });
        canceller.start();

        // when
        boolean committed = run.commit(TestArtifacts.artifact("acmeco", clock.instant()), () -> {
            persisting.countDown();
            sleepQuietly(100);
        }, "Done");
        canceller.join(5_000);

        // then
        assertThat(committed).isTrue();
        assertThat(cancelAccepted.get()).isFalse();
        assertThat(handle.stage()).isEqualTo(PipelineStage.COMPLETED);
    }

    @Test
    void 분류할_수_없는_예외로_실패해도_FAILED로_종료됨() throws Exception {
        // given
        run.start("Starting");
        run.advance(PipelineStage.FETCHING, 20, "Fetching", Map.of());

        // when
        boolean failed = run.fail(new IllegalStateException("boom") { });

        // then
        assertThat(failed).isTrue();
        assertThat(handle.await(Duration.ofSeconds(1))).isInstanceOf(Failed.class);
        assertThat(handle.stage()).isEqualTo(PipelineStage.FAILED);
    }

    private void advanceToRendering() {
        run.start("Starting");
        run.advance(PipelineStage.FETCHING, 20, "Fetching", Map.of());
        run.advance(PipelineStage.EXTRACTING, 50, "Extracting", Map.of());
        run.advance(PipelineStage.VALIDATING, 75, "Validating", Map.of());
        run.advance(PipelineStage.RENDERING, 85, "Rendering", Map.of());
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ============================================================
    // 3. 불변식 위반
    // ============================================================

    @Test
    void 단계를_건너뛰면_예외() {
        run.start("Starting");

        assertThatThrownBy(() -> run.advance(PipelineStage.EXTRACTING, 50, "skip", Map.of()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 진행률이_감소하면_예외() {
        run.start("Starting");
        run.advance(PipelineStage.FETCHING, 40, "Fetched", Map.of());

        assertThatThrownBy(() -> run.advance(PipelineStage.EXTRACTING, 30, "back", Map.of()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("must not decrease");
    }

    @Test
    void 리스너_예외는_다른_리스너와_발행에_영향을_주지_않음() {
        // given
        RecordingProgressListener healthy = new RecordingProgressListener();
        handle.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        handle.addListener(healthy);

        // when
        run.start("Starting");
        run.advance(PipelineStage.FETCHING, 20, "Fetching", Map.of());

        // then
        assertThat(healthy.stages()).containsExactly(PipelineStage.INITIALIZED, PipelineStage.FETCHING);
    }

    @Test
    void outcome_사본을_취소해도_실행에는_영향이_없음() {
        // given
        run.start("Starting");

        // when
        handle.outcome().cancel(true);

        // then
        assertThat(run.outcome()).isNotDone();
        assertThat(handle.isCancelRequested()).isFalse();
    }
}
