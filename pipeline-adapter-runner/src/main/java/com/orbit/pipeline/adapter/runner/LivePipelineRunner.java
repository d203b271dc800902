package com.orbit.pipeline.adapter.runner;

import com.orbit.pipeline.application.cache.CacheStrategy;
import com.orbit.pipeline.application.cache.ResultCache;
import com.orbit.pipeline.application.orchestrator.PipelineOrchestrator;
import com.orbit.pipeline.application.orchestrator.PipelineRun;
import com.orbit.pipeline.application.orchestrator.RunHandle;
import com.orbit.pipeline.application.runtime.BackgroundTaskRegistry;
import com.orbit.pipeline.core.contract.Artifact;
import com.orbit.pipeline.core.contract.PageBundle;
import com.orbit.pipeline.core.contract.RenderedDocument;
import com.orbit.pipeline.core.contract.StructuredRecord;
import com.orbit.pipeline.core.contract.ValidationReport;
import com.orbit.pipeline.core.error.CacheException;
import com.orbit.pipeline.core.error.ErrorKind;
import com.orbit.pipeline.core.model.CacheKey;
import com.orbit.pipeline.core.model.RunId;
import com.orbit.pipeline.core.model.SubjectKey;
import com.orbit.pipeline.core.model.Variant;
import com.orbit.pipeline.core.statemachine.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 캐시 우선 라이브 파이프라인 Runner.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(subject, variant, forceRefresh)
 *   ↓
 * INITIALIZED(0%)
 *   ↓ forceRefresh=false, 캐시 적중 → COMPLETED(100%, cached=true), 외부 호출 없음
 *   ↓ 미스
 * FETCHING(20)   → Fetcher     (RateLimiter → Retry → CircuitBreaker) → FETCHING(40, pagesFetched)
 * EXTRACTING(50) → Extractor   (RateLimiter → Retry → CircuitBreaker) → EXTRACTING(70, fieldCount)
 * VALIDATING(75) → Validator   (로컬 실행)                            → VALIDATING(80, score, issues)
 * RENDERING(85)  → Renderer    (RateLimiter → Retry → CircuitBreaker) → RENDERING(95, length)
 *   ↓
 * 캐시 저장 → COMPLETED(100%) → TTL 후 forceRefresh=true 재실행 예약
 * </pre>
 *
 * <p><strong>실패와 취소:</strong></p>
 * <ul>
 *   <li>단계 실패(재시도 소진 또는 재시도 불가 오류)는 남은 단계를 중단하고 FAILED를 발행하며 캐시에 쓰지 않음</li>
 *   <li>취소 요청은 단계 경계에서 확인되고, 캐시 저장과 완료는 취소 요청과 원자적으로 수행됨.
 *       진행 중인 단계의 남은 재시도는 즉시 취소되지만 이미 시작된 호출은 중단되지 않으며 그 결과는 버려짐</li>
 *   <li>캐시 쓰기 실패는 WARN 로그만 남기고 실행은 성공으로 끝남</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 같은 키에 대한 동시 캐시 미스는 중복 제거(single-flight)되지 않습니다.
 * 두 실행 모두 전체 파이프라인을 수행하고 나중에 끝난 쪽이 캐시에 남습니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class LivePipelineRunner implements PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LivePipelineRunner.class);

    static final String REFRESH_KEY_PREFIX = "refresh:";

    private final PipelineCollaborators collaborators;
    private final ResultCache<Artifact> cache;
    private final GuardedStageInvoker invoker;
    private final BackgroundTaskRegistry refreshes;
    private final LivePipelineConfig config;
    private final Clock clock;
    private final Set<Variant> knownVariants = ConcurrentHashMap.newKeySet();

    /**
     * 생성자.
     *
     * @param collaborators 단계별 외부 협력 객체
     * @param cache 결과 캐시
     * @param invoker 보호된 원격 호출 Invoker
     * @param refreshes 백그라운드 갱신 등록소
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LivePipelineRunner(PipelineCollaborators collaborators, ResultCache<Artifact> cache,
                              GuardedStageInvoker invoker, BackgroundTaskRegistry refreshes,
                              LivePipelineConfig config, Clock clock) {
        if (collaborators == null) {
            throw new IllegalArgumentException("collaborators cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        if (refreshes == null) {
            throw new IllegalArgumentException("refreshes cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.collaborators = collaborators;
        this.cache = cache;
        this.invoker = invoker;
        this.refreshes = refreshes;
        this.config = config;
        this.clock = clock;
        knownVariants.add(Variant.STRUCTURED);
        knownVariants.add(Variant.RAG);
    }

    @Override
    public RunHandle run(SubjectKey subject, Variant variant, boolean forceRefresh) {
        if (subject == null || variant == null) {
            throw new IllegalArgumentException("subject and variant cannot be null");
        }
        CacheKey cacheKey = CacheKey.of(subject, variant);
        knownVariants.add(variant);
        PipelineRun run = new PipelineRun(RunId.generate(), subject, variant, clock);
        RunHandle handle = new RunHandle(run);

        log.info("Pipeline run started: runId={}, subject={}, variant={}, forceRefresh={}",
            run.runId().getValue(), subject.getValue(), variant, forceRefresh);
        run.start("Starting " + variant + " pipeline for " + subject.getValue());

        if (!forceRefresh) {
            Optional<Artifact> cached = readCache(cacheKey);
            if (cached.isPresent()) {
                run.complete(cached.get(), true, "Loaded from cache");
                log.info("Pipeline run served from cache: runId={}, key={}", run.runId().getValue(), cacheKey);
                return handle;
            }
        }

        execute(new RunContext(run, cacheKey));
        return handle;
    }

    @Override
    public Optional<Artifact> getCached(SubjectKey subject, Variant variant) {
        return readCache(CacheKey.of(subject, variant));
    }

    /**
     * {@inheritDoc}
     *
     * <p>결과물의 subjectId가 대상의 정규화 ID와 정확히 같은 엔트리만 제거합니다.
     * 키 문자열의 접두사로 비교하지 않으므로 "Acme"를 무효화해도 "Acme Co"의 엔트리는 남습니다.
     * 제거된 키와 이 Runner가 알고 있는 모든 변형의 키에 대해 대기 중인 갱신도 취소합니다.</p>
     */
    @Override
    public int invalidate(SubjectKey subject) {
        if (subject == null) {
            throw new IllegalArgumentException("subject cannot be null");
        }
        String subjectId = subject.normalizedId();
        Set<String> exactKeys = new LinkedHashSet<>();
        for (Variant variant : knownVariants) {
            exactKeys.add(CacheKey.of(subject, variant).getValue());
        }
        List<String> removed = cache.invalidateIf(
            entry -> exactKeys.contains(entry.key()) || subjectId.equals(entry.value().subjectId()));

        Set<String> refreshKeys = new LinkedHashSet<>(exactKeys);
        refreshKeys.addAll(removed);
        for (String key : refreshKeys) {
            refreshes.cancel(REFRESH_KEY_PREFIX + key);
        }
        log.info("Invalidated {} cache entries for subject={}", removed.size(), subject.getValue());
        return removed.size();
    }

    // ============================================================
    // 단계 실행
    // ============================================================

    private void execute(RunContext ctx) {
        ctx.run().onCancel(ctx::cancelInFlight);
        CompletableFuture.completedFuture(ctx)
            .thenCompose(this::fetch)
            .thenCompose(pages -> extract(ctx, pages))
            .thenApply(record -> validate(ctx, record))
            .thenCompose(validated -> render(ctx, validated))
            .thenAccept(artifact -> finish(ctx, artifact))
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    abort(ctx, error);
                }
            });
    }

    private CompletableFuture<PageBundle> fetch(RunContext ctx) {
        SubjectKey subject = ctx.run().subject();
        return remoteStage(ctx, PipelineStage.FETCHING, 20, "Fetching pages for " + subject.getValue(),
            config.fetchResourceKey(), LivePipelineConfig.FETCH_OPERATION,
            () -> collaborators.fetcher().fetch(subject))
            .thenApply(pages -> {
                ctx.pagesFetched = pages.pageCount();
                ctx.fetchDuration = pages.fetchDuration();
                ctx.run().advance(PipelineStage.FETCHING, 40, "Fetched " + pages.pageCount() + " pages",
                    Map.of("pagesFetched", pages.pageCount()));
                return pages;
            });
    }

    private CompletableFuture<StructuredRecord> extract(RunContext ctx, PageBundle pages) {
        return remoteStage(ctx, PipelineStage.EXTRACTING, 50, "Extracting structured data",
            config.extractResourceKey(), LivePipelineConfig.EXTRACT_OPERATION,
            () -> collaborators.extractor().extract(pages))
            .thenApply(record -> {
                ctx.fieldCount = record.fieldCount();
                ctx.run().advance(PipelineStage.EXTRACTING, 70, "Extracted " + record.fieldCount() + " fields",
                    Map.of("fieldCount", record.fieldCount()));
                return record;
            });
    }

    private Validated validate(RunContext ctx, StructuredRecord record) {
        enterStage(ctx, PipelineStage.VALIDATING, 75, "Validating extracted data");
        long started = System.nanoTime();
        ValidationReport report = collaborators.validator().validate(record);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("score", report.score());
        metadata.put("issues", report.issues());
        ctx.run().advance(PipelineStage.VALIDATING, 80, "Quality score: " + report.score() + "/100", metadata);
        logStageTiming(ctx, PipelineStage.VALIDATING, started, null);
        return new Validated(record, report);
    }

    private CompletableFuture<Artifact> render(RunContext ctx, Validated validated) {
        Variant variant = ctx.run().variant();
        return remoteStage(ctx, PipelineStage.RENDERING, 85, "Rendering " + variant + " document",
            config.renderResourceKey(), LivePipelineConfig.RENDER_OPERATION,
            () -> collaborators.renderer().render(validated.record(), variant))
            .thenApply(document -> {
                ctx.run().advance(PipelineStage.RENDERING, 95, "Rendered " + document.length() + " characters",
                    Map.of("length", document.length()));
                return toArtifact(ctx, document, validated.report());
            });
    }

    private void finish(RunContext ctx, Artifact artifact) {
        boolean committed = ctx.run().commit(artifact, () -> writeCache(ctx.cacheKey(), artifact),
            "Pipeline completed");
        if (!committed) {
            if (ctx.run().isCancelRequested()) {
                throw new CancellationException("Cancelled before caching result");
            }
            return;
        }
        log.info("Pipeline run completed: runId={}, key={}, score={}, elapsedMs={}",
            ctx.runId(), ctx.cacheKey(), artifact.score(), ctx.elapsedMillis());
        scheduleRefresh(ctx);
    }

    private void abort(RunContext ctx, Throwable error) {
        PipelineRun run = ctx.run();
        if (run.isCancelRequested()) {
            PipelineStage stage = run.stage();
            if (run.cancelled()) {
                log.info("Pipeline run cancelled: runId={}, stage={}", ctx.runId(), stage);
            }
            return;
        }
        Throwable cause = ErrorKind.unwrap(error);
        PipelineStage stage = run.stage();
        if (run.fail(cause)) {
            log.error("Pipeline run failed at {}: runId={}, kind={}, elapsedMs={}",
                stage, ctx.runId(), ErrorKind.classify(cause), ctx.elapsedMillis(), cause);
        }
    }

    private <T> CompletableFuture<T> remoteStage(RunContext ctx, PipelineStage stage, int startPct, String message,
                                                 String resourceKey, String operationKey, Callable<T> call) {
        enterStage(ctx, stage, startPct, message);
        long started = System.nanoTime();
        CompletableFuture<T> future = invoker.invoke(resourceKey, operationKey, call);
        ctx.track(future);
        return future.whenComplete((value, error) -> logStageTiming(ctx, stage, started, error));
    }

    private void enterStage(RunContext ctx, PipelineStage stage, int pct, String message) {
        if (ctx.run().isCancelRequested()) {
            throw new CancellationException("Cancelled before " + stage);
        }
        ctx.run().advance(stage, pct, message, Map.of());
    }

    private void logStageTiming(RunContext ctx, PipelineStage stage, long startedNanos, Throwable error) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        if (error == null) {
            log.info("{} finished in {}ms: runId={}", stage, elapsedMs, ctx.runId());
        } else {
            log.info("{} ended after {}ms: runId={}, error={}", stage, elapsedMs, ctx.runId(),
                ErrorKind.unwrap(error).toString());
        }
    }

    private Artifact toArtifact(RunContext ctx, RenderedDocument document, ValidationReport report) {
        PipelineRun run = ctx.run();
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("subject", run.subject().getValue());
        metadata.put("runId", ctx.runId());
        metadata.put("pagesFetched", String.valueOf(ctx.pagesFetched));
        metadata.put("fieldCount", String.valueOf(ctx.fieldCount));
        metadata.put("fetchDurationMs", String.valueOf(ctx.fetchDuration.toMillis()));
        return Artifact.of(run.subject().normalizedId(), run.variant().getValue(), document, report,
            clock.instant(), metadata);
    }

    // ============================================================
    // 캐시와 백그라운드 갱신
    // ============================================================

    private Optional<Artifact> readCache(CacheKey cacheKey) {
        CacheStrategy strategy = config.cacheStrategy();
        if (!strategy.isEnabled()) {
            return Optional.empty();
        }
        return cache.get(cacheKey.getValue(), strategy.ttl());
    }

    private void writeCache(CacheKey cacheKey, Artifact artifact) {
        CacheStrategy strategy = config.cacheStrategy();
        if (!strategy.isEnabled()) {
            return;
        }
        try {
            cache.set(cacheKey.getValue(), artifact, strategy.ttl(), artifact.qualityGrade());
        } catch (CacheException e) {
            log.warn("Cache write failed, returning uncached result: key={}", cacheKey, e);
        }
    }

    private void scheduleRefresh(RunContext ctx) {
        CacheStrategy strategy = config.cacheStrategy();
        if (!strategy.isEnabled() || !config.backgroundRefreshEnabled()) {
            return;
        }
        SubjectKey subject = ctx.run().subject();
        Variant variant = ctx.run().variant();
        String key = REFRESH_KEY_PREFIX + ctx.cacheKey().getValue();
        try {
            refreshes.schedule(key, strategy.ttl(), () -> run(subject, variant, true).outcome());
        } catch (RejectedExecutionException e) {
            log.warn("Background refresh not scheduled: key={}, reason={}", key, e.getMessage());
        }
    }

    // ============================================================
    // 실행 컨텍스트
    // ============================================================

    private record Validated(StructuredRecord record, ValidationReport report) {
    }

    /**
     * 실행 한 건의 단계 간 상태.
     *
     * <p>단계는 CompletableFuture 체인으로 순차 실행되므로 필드 접근은 직렬화됩니다.</p>
     */
    private static final class RunContext {

        private final PipelineRun run;
        private final CacheKey cacheKey;
        private final long startedNanos = System.nanoTime();
        private final AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>();

        private int pagesFetched;
        private int fieldCount;
        private Duration fetchDuration = Duration.ZERO;

        RunContext(PipelineRun run, CacheKey cacheKey) {
            this.run = run;
            this.cacheKey = cacheKey;
        }

        PipelineRun run() {
            return run;
        }

        CacheKey cacheKey() {
            return cacheKey;
        }

        String runId() {
            return run.runId().getValue();
        }

        long elapsedMillis() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        }

        void track(CompletableFuture<?> future) {
            inFlight.set(future);
            if (run.isCancelRequested()) {
                future.cancel(false);
            }
        }

        void cancelInFlight() {
            CompletableFuture<?> future = inFlight.get();
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
