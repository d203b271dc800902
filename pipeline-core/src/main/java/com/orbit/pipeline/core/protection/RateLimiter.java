package com.orbit.pipeline.core.protection;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limiter SPI (키 단위 Token Bucket).
 *
 * <p>원격 리소스(호스트, API 등)마다 독립된 버킷을 두어 호출 빈도를 제한합니다.
 * 처음 보는 키는 기본 설정으로 가득 찬 버킷을 받습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>0 ≤ tokens ≤ capacity</li>
 *   <li>임의의 구간 T 동안 허용되는 비용 합 ≤ capacity + rate × T</li>
 *   <li>서로 다른 키는 간섭하지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = ...;
 * limiter.setRate("openai", RateLimiterConfig.ofRate(3.0));
 *
 * limiter.acquireAsync("openai", 1)
 *     .thenCompose(ignored -> callRemote());
 * }</pre>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 토큰을 얻을 때까지 대기 (블로킹).
     *
     * @param key 리소스 키
     * @param cost 소비할 토큰 수 (1 이상, 버킷 크기 이하)
     * @throws InterruptedException 대기 중 인터럽트 발생
     * @throws IllegalArgumentException cost가 0 이하이거나 버킷 크기를 초과하는 경우
     */
    void acquire(String key, int cost) throws InterruptedException;

    /**
     * 토큰 1개를 얻을 때까지 대기.
     *
     * @param key 리소스 키
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    default void acquire(String key) throws InterruptedException {
        acquire(key, 1);
    }

    /**
     * 토큰을 즉시 얻을 수 있으면 소비 (비블로킹).
     *
     * @param key 리소스 키
     * @param cost 소비할 토큰 수
     * @return true: 허용, false: 토큰 부족 (토큰은 소비되지 않음)
     */
    boolean tryAcquire(String key, int cost);

    /**
     * 토큰 1개를 즉시 얻을 수 있으면 소비.
     *
     * @param key 리소스 키
     * @return true: 허용, false: 토큰 부족
     */
    default boolean tryAcquire(String key) {
        return tryAcquire(key, 1);
    }

    /**
     * 토큰을 얻으면 완료되는 Future (스레드를 점유하지 않음).
     *
     * @param key 리소스 키
     * @param cost 소비할 토큰 수
     * @return 토큰 획득 시 완료되는 Future
     */
    CompletableFuture<Void> acquireAsync(String key, int cost);

    /**
     * 키의 설정 변경.
     *
     * <p>현재 토큰 수는 새 버킷 크기로 잘립니다.</p>
     *
     * @param key 리소스 키
     * @param config 새 설정
     */
    void setRate(String key, RateLimiterConfig config);

    /**
     * 키의 현재 설정 조회.
     *
     * @param key 리소스 키
     * @return 설정 (등록되지 않은 키는 기본 설정)
     */
    RateLimiterConfig getConfig(String key);

    /**
     * 키의 현재 사용 가능 토큰 수 (충전 반영 후).
     *
     * @param key 리소스 키
     * @return 사용 가능 토큰 수
     */
    double availableTokens(String key);
}
