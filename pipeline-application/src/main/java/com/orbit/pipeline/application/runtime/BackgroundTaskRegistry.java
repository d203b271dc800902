package com.orbit.pipeline.application.runtime;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 백그라운드 작업 등록소 포트.
 *
 * <p>결과 캐시 갱신처럼 호출자 요청과 무관하게 나중에 실행할 작업을 추적합니다.
 * 작업이 조용히 사라지지 않도록 대기 중인 작업을 조회하고 종료 시 정리할 수 있어야 합니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>같은 키로 다시 예약하면 기존 대기 작업은 취소되고 새 작업으로 대체</li>
 *   <li>작업이 실행을 시작하면 대기 목록에서 빠짐</li>
 *   <li>{@link #shutdown(Duration)} 이후 예약은 거부</li>
 * </ul>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public interface BackgroundTaskRegistry {

    /**
     * 작업 예약.
     *
     * @param key 작업 키
     * @param delay 실행 지연
     * @param task 실행할 작업 (완료 Future 반환)
     * @return 예약 정보
     * @throws java.util.concurrent.RejectedExecutionException 종료된 등록소에 예약한 경우
     */
    BackgroundTask schedule(String key, Duration delay, Supplier<? extends CompletableFuture<?>> task);

    /**
     * 대기 중인 작업 목록.
     *
     * @return 예약 정보 목록
     */
    List<BackgroundTask> pending();

    /**
     * 대기 중인 작업 취소.
     *
     * @param key 작업 키
     * @return 취소된 작업이 있으면 true
     */
    boolean cancel(String key);

    /**
     * 대기 중인 작업을 모두 취소하고 실행 중인 작업의 종료를 기다림.
     *
     * @param timeout 최대 대기 시간
     * @return 시간 내 모두 종료되었으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean shutdown(Duration timeout) throws InterruptedException;
}
