/**
 * 파이프라인 Runner 구현.
 *
 * <p>{@link com.orbit.pipeline.adapter.runner.LivePipelineRunner}가 캐시 조회, 단계 실행, 진행 이벤트 발행,
 * 백그라운드 갱신 예약을 수행합니다. 원격 호출은
 * {@link com.orbit.pipeline.adapter.runner.GuardedStageInvoker}를 통해 Rate Limiter, 재시도,
 * Circuit Breaker, 타임아웃으로 보호됩니다.</p>
 *
 * <p><strong>조립 예시:</strong></p>
 * <pre>{@code
 * ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
 * ExecutorService io = Executors.newFixedThreadPool(8);
 * LivePipelineConfig config = new LivePipelineConfig();
 *
 * GuardedStageInvoker invoker = new GuardedStageInvoker(
 *     new TokenBucketRateLimiter(),
 *     new CircuitBreakerRegistry(),
 *     new ExponentialBackoffRetryPolicy(new RetryConfig(), RetryPredicates.transientOnly(), scheduler),
 *     config.toTimeoutPolicy(),
 *     io);
 *
 * PipelineOrchestrator orchestrator = new LivePipelineRunner(
 *     new PipelineCollaborators(fetcher, extractor, new WeightedFieldValidator(), renderer),
 *     new ResultCache<>(store, hasher, Clock.systemUTC()),
 *     invoker,
 *     new ScheduledBackgroundTaskRegistry(),
 *     config,
 *     Clock.systemUTC());
 * }</pre>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
package com.orbit.pipeline.adapter.runner;
