package com.orbit.pipeline.application.orchestrator;

import com.orbit.pipeline.core.progress.ProgressEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 한 구독자의 진행 이벤트 큐.
 *
 * <p>구독 시점 이전에 발행된 이벤트도 순서대로 받습니다.
 * 종료 이벤트를 꺼낸 뒤에는 더 이상 이벤트가 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ProgressSubscription subscription = handle.subscribe();
 * List<ProgressEvent> events = subscription.awaitAll(Duration.ofSeconds(30));
 * }</pre>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class ProgressSubscription {

    private final BlockingQueue<ProgressEvent> queue = new LinkedBlockingQueue<>();
    private volatile boolean terminated;

    ProgressSubscription() {
    }

    void offer(ProgressEvent event) {
        queue.offer(event);
    }

    /**
     * 다음 이벤트를 최대 timeout까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 이벤트 (시간 초과 또는 이미 종료 이벤트를 꺼낸 경우 empty)
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    public Optional<ProgressEvent> poll(Duration timeout) throws InterruptedException {
        if (terminated) {
            return Optional.empty();
        }
        ProgressEvent event = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (event != null && event.isTerminal()) {
            terminated = true;
        }
        return Optional.ofNullable(event);
    }

    /**
     * 종료 이벤트까지 남은 모든 이벤트 수집.
     *
     * @param timeout 전체 최대 대기 시간
     * @return 종료 이벤트를 포함한 이벤트 목록
     * @throws InterruptedException 대기 중 인터럽트 발생
     * @throws TimeoutException 시간 내 종료 이벤트가 도착하지 않은 경우
     */
    public List<ProgressEvent> awaitAll(Duration timeout) throws InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<ProgressEvent> events = new ArrayList<>();
        while (!terminated) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TimeoutException("No terminal event within " + timeout + " (received: " + events.size() + ")");
            }
            poll(Duration.ofNanos(remaining)).ifPresent(events::add);
        }
        return events;
    }

    /**
     * 종료 이벤트를 이미 꺼냈는지 확인.
     *
     * @return 종료 이벤트 수신 완료 시 true
     */
    public boolean isTerminated() {
        return terminated;
    }
}
