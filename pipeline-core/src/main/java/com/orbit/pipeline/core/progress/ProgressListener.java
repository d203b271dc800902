package com.orbit.pipeline.core.progress;

/**
 * 진행 이벤트 수신자.
 *
 * <p>발행 스레드에서 동기적으로 호출되므로 오래 걸리는 작업을 수행하면 안 됩니다.
 * 수신자가 던진 예외는 로그로 남고 파이프라인에는 영향을 주지 않습니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * 진행 이벤트 수신.
     *
     * @param event 진행 이벤트
     */
    void onProgress(ProgressEvent event);
}
