package com.orbit.pipeline.application.orchestrator;

import com.orbit.pipeline.core.progress.ProgressEvent;
import com.orbit.pipeline.core.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 실행의 진행 이벤트 방송 채널.
 *
 * <p>발행된 이벤트를 모두 기록해 두었다가 늦게 구독한 쪽에도 처음부터 재생합니다.
 * 종료 이벤트 이후에는 닫히며 추가 발행은 거부됩니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>publish, subscribe, addListener는 같은 모니터로 직렬화되어 구독자마다 동일한 순서를 봅니다</li>
 *   <li>리스너 예외는 WARN 로그로 남기고 다른 리스너와 파이프라인에는 전파하지 않습니다</li>
 * </ul>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class ProgressChannel {

    private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);

    private final List<ProgressEvent> history = new ArrayList<>();
    private final List<ProgressListener> listeners = new ArrayList<>();
    private final List<ProgressSubscription> subscriptions = new ArrayList<>();
    private boolean closed;

    /**
     * 이벤트 발행.
     *
     * @param event 이벤트
     * @throws IllegalStateException 종료 이벤트 이후 발행한 경우
     */
    public synchronized void publish(ProgressEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (closed) {
            throw new IllegalStateException("Channel already closed, rejected: " + event.stage());
        }
        history.add(event);
        for (ProgressSubscription subscription : subscriptions) {
            subscription.offer(event);
        }
        for (ProgressListener listener : listeners) {
            deliver(listener, event);
        }
        if (event.isTerminal()) {
            closed = true;
            subscriptions.clear();
            listeners.clear();
        }
    }

    /**
     * 큐 기반 구독.
     *
     * @return 지금까지의 이벤트가 채워진 구독
     */
    public synchronized ProgressSubscription subscribe() {
        ProgressSubscription subscription = new ProgressSubscription();
        history.forEach(subscription::offer);
        if (!closed) {
            subscriptions.add(subscription);
        }
        return subscription;
    }

    /**
     * 콜백 리스너 등록.
     *
     * <p>이미 발행된 이벤트는 등록 즉시 호출 스레드에서 재생됩니다.</p>
     *
     * @param listener 리스너
     */
    public synchronized void addListener(ProgressListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        for (ProgressEvent event : history) {
            deliver(listener, event);
        }
        if (!closed) {
            listeners.add(listener);
        }
    }

    /**
     * 지금까지 발행된 이벤트 스냅샷.
     *
     * @return 이벤트 목록 (불변)
     */
    public synchronized List<ProgressEvent> history() {
        return List.copyOf(history);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private void deliver(ProgressListener listener, ProgressEvent event) {
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed: runId={}, stage={}", event.runId(), event.stage(), e);
        }
    }
}
