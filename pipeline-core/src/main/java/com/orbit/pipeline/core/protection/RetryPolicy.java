package com.orbit.pipeline.core.protection;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 재시도 정책 SPI.
 *
 * <p>재시도 가능한 오류가 발생하면 지연 후 작업을 다시 수행합니다.
 * 최대 시도 횟수를 소진하거나 재시도 불가 오류가 발생하면 마지막 오류를 그대로 전파합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public interface RetryPolicy {

    /**
     * 동기 재시도 실행.
     *
     * @param operation 작업 이름 (로그 및 관찰자용)
     * @param action 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 마지막 시도의 오류
     */
    <T> T call(String operation, Callable<T> action) throws Exception;

    /**
     * 비동기 재시도 실행.
     *
     * <p>매 시도마다 supplier를 다시 호출하여 새 Future를 만듭니다.
     * 재시도 지연 동안 스레드를 점유하지 않습니다.</p>
     *
     * @param operation 작업 이름
     * @param action 매 시도마다 새 Future를 반환하는 작업
     * @param <T> 결과 타입
     * @return 결과 Future (실패 시 마지막 오류로 완료)
     */
    <T> CompletableFuture<T> callAsync(String operation, Supplier<CompletableFuture<T>> action);

    /**
     * 최대 시도 횟수 조회.
     *
     * @return 최대 시도 횟수 (첫 시도 포함)
     */
    int getMaxAttempts();
}
