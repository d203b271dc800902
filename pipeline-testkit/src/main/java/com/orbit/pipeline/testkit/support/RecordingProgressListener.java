package com.orbit.pipeline.testkit.support;

import com.orbit.pipeline.core.progress.ProgressEvent;
import com.orbit.pipeline.core.progress.ProgressListener;
import com.orbit.pipeline.core.statemachine.PipelineStage;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Progress listener that records every event it receives.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class RecordingProgressListener implements ProgressListener {

    private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
    private final CountDownLatch terminal = new CountDownLatch(1);

    @Override
    public void onProgress(ProgressEvent event) {
        events.add(event);
        if (event.isTerminal()) {
            terminal.countDown();
        }
    }

    /**
     * Waits until a terminal event has been recorded.
     *
     * @param timeoutMillis maximum time to wait
     * @return true if a terminal event arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTerminal(long timeoutMillis) throws InterruptedException {
        return terminal.await(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    public List<ProgressEvent> events() {
        return List.copyOf(events);
    }

    public List<PipelineStage> stages() {
        return events.stream().map(ProgressEvent::stage).toList();
    }

    public List<Integer> percentages() {
        return events.stream().map(ProgressEvent::progressPct).toList();
    }

    public ProgressEvent last() {
        if (events.isEmpty()) {
            throw new IllegalStateException("No events recorded");
        }
        return events.get(events.size() - 1);
    }
}
