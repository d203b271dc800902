package com.orbit.pipeline.core.protection;

import com.orbit.pipeline.core.error.CircuitBreakerOpenException;
import com.orbit.pipeline.core.error.ErrorKind;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>원격 호출의 연속 실패를 추적하고, 임계값에 도달하면 빠르게 실패(Fail-Fast)하여
 * 장애가 난 의존성에 부하가 계속 쌓이는 것을 막습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.get("openai");
 * Result result = cb.call(() -> externalApi.call());
 * }</pre>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 이름 조회 (보호 대상 리소스 키).
     *
     * @return 이름
     */
    String getName();

    /**
     * 호출 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: 복구 대기 시간 경과 전 false, 경과 후 HALF_OPEN으로 전이하고 true</li>
     *   <li>HALF_OPEN: 진행 중인 시험 호출이 있으면 false</li>
     * </ul>
     *
     * @return true: 호출 허용, false: 차단
     */
    boolean tryAcquire();

    /**
     * 호출 성공 기록.
     */
    void recordSuccess();

    /**
     * 호출 실패 기록.
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 현재 연속 실패 수.
     *
     * @return 연속 실패 수
     */
    int getConsecutiveFailures();

    /**
     * CLOSED 상태로 강제 리셋.
     */
    void reset();

    /**
     * Breaker로 보호된 동기 호출.
     *
     * @param action 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws CircuitBreakerOpenException 차단된 경우 (action은 호출되지 않음)
     * @throws Exception action이 던진 예외 (실패로 기록된 후 그대로 전파, {@link Error}도 동일)
     */
    default <T> T call(Callable<T> action) throws Exception {
        if (!tryAcquire()) {
            throw new CircuitBreakerOpenException(getName());
        }
        T result;
        try {
            result = action.call();
        } catch (Exception e) {
            recordFailure(e);
            throw e;
        } catch (Error e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }

    /**
     * Breaker로 보호된 비동기 호출.
     *
     * @param action Future를 반환하는 호출
     * @param <T> 결과 타입
     * @return 결과 Future (차단 시 {@link CircuitBreakerOpenException}으로 실패)
     */
    default <T> CompletableFuture<T> callAsync(Supplier<CompletableFuture<T>> action) {
        if (!tryAcquire()) {
            return CompletableFuture.failedFuture(new CircuitBreakerOpenException(getName()));
        }
        CompletableFuture<T> future;
        try {
            future = action.get();
        } catch (RuntimeException e) {
            recordFailure(e);
            return CompletableFuture.failedFuture(e);
        } catch (Error e) {
            recordFailure(e);
            throw e;
        }
        return future.whenComplete((result, error) -> {
            if (error == null) {
                recordSuccess();
            } else {
                recordFailure(ErrorKind.unwrap(error));
            }
        });
    }
}
