package com.orbit.pipeline.adapter.runner;

import com.orbit.pipeline.application.runtime.BackgroundTask;
import com.orbit.pipeline.application.runtime.BackgroundTaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * ScheduledExecutorService 기반 백그라운드 작업 등록소.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>키당 대기 작업은 최대 하나. 같은 키로 다시 예약하면 기존 예약을 취소하고 대체</li>
 *   <li>실행이 시작된 작업은 대기 목록에서 빠지고, 반환된 Future가 끝날 때까지 실행 중으로 추적</li>
 *   <li>{@link #shutdown(Duration)}은 대기 작업을 모두 취소하고 실행 중인 작업을 기다림</li>
 * </ul>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class ScheduledBackgroundTaskRegistry implements BackgroundTaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScheduledBackgroundTaskRegistry.class);

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Clock clock;
    private final ConcurrentHashMap<String, Pending> pending = new ConcurrentHashMap<>();
    private final Set<CompletableFuture<?>> running = ConcurrentHashMap.newKeySet();

    private volatile boolean shutdown;

    /**
     * 내부 데몬 스케줄러로 생성. {@link #shutdown(Duration)} 시 스케줄러도 종료합니다.
     */
    public ScheduledBackgroundTaskRegistry() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-background-refresh");
            thread.setDaemon(true);
            return thread;
        }), true, Clock.systemUTC());
    }

    /**
     * 스케줄러와 시계를 주입하여 생성 (스케줄러 종료는 호출자 책임).
     *
     * @param scheduler 스케줄러
     * @param clock 예약 시각 기록용 시계
     */
    public ScheduledBackgroundTaskRegistry(ScheduledExecutorService scheduler, Clock clock) {
        this(scheduler, false, clock);
    }

    private ScheduledBackgroundTaskRegistry(ScheduledExecutorService scheduler, boolean ownsScheduler, Clock clock) {
        if (scheduler == null || clock == null) {
            throw new IllegalArgumentException("scheduler and clock cannot be null");
        }
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.clock = clock;
    }

    @Override
    public BackgroundTask schedule(String key, Duration delay, Supplier<? extends CompletableFuture<?>> task) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative (current: " + delay + ")");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (shutdown) {
            throw new RejectedExecutionException("Background task registry is shut down");
        }

        BackgroundTask info = new BackgroundTask(key, clock.instant(), clock.instant().plus(delay));
        pending.compute(key, (k, previous) -> {
            if (previous != null) {
                previous.future().cancel(false);
                log.debug("Replacing pending background task: key={}", key);
            }
            ScheduledFuture<?> future = scheduler.schedule(() -> fire(info, task), delay.toNanos(), TimeUnit.NANOSECONDS);
            return new Pending(info, future);
        });
        log.info("Background task scheduled: key={}, dueAt={}", key, info.dueAt());
        return info;
    }

    @Override
    public List<BackgroundTask> pending() {
        return pending.values().stream()
            .map(Pending::task)
            .sorted(Comparator.comparing(BackgroundTask::dueAt))
            .collect(Collectors.toList());
    }

    @Override
    public boolean cancel(String key) {
        Pending removed = pending.remove(key);
        if (removed == null) {
            return false;
        }
        removed.future().cancel(false);
        log.info("Background task cancelled: key={}", key);
        return true;
    }

    @Override
    public boolean shutdown(Duration timeout) throws InterruptedException {
        shutdown = true;
        pending.keySet().forEach(this::cancel);

        CompletableFuture<?>[] inFlight = running.toArray(new CompletableFuture<?>[0]);
        boolean drained = true;
        try {
            CompletableFuture.allOf(inFlight)
                .handle((ignored, error) -> null)
                .get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("{} background tasks still running after {}ms", running.size(), timeout.toMillis());
            drained = false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unexpected failure while draining background tasks", e);
        }

        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        return drained;
    }

    /**
     * 실행 중인 작업 수.
     *
     * @return 반환된 Future가 아직 끝나지 않은 작업 수
     */
    public int runningCount() {
        return running.size();
    }

    private void fire(BackgroundTask info, Supplier<? extends CompletableFuture<?>> task) {
        if (!removeIfSame(info)) {
            return;
        }
        log.info("Background task firing: key={}", info.key());

        CompletableFuture<?> future;
        try {
            future = task.get();
        } catch (RuntimeException e) {
            log.warn("Background task failed to start: key={}", info.key(), e);
            return;
        }
        running.add(future);
        future.whenComplete((result, error) -> {
            running.remove(future);
            if (error != null) {
                log.warn("Background task failed: key={}", info.key(), error);
            }
        });
    }

    private boolean removeIfSame(BackgroundTask info) {
        boolean[] removed = new boolean[1];
        pending.computeIfPresent(info.key(), (k, existing) -> {
            if (existing.task() == info) {
                removed[0] = true;
                return null;
            }
            return existing;
        });
        return removed[0];
    }

    private record Pending(BackgroundTask task, ScheduledFuture<?> future) {
    }
}
