package com.orbit.pipeline.adapter.protection.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 늘리고, 곱셈 Jitter로 여러 호출자의 재시도 시점을 흩어
 * Thundering Herd를 막습니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(attemptCount-1), maxDelay)
 * delay = exponential * (0.75 + random * 0.5)      // [0.75, 1.25] 배
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1s, maxDelay=60s):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 1s × [0.75, 1.25] = 0.75~1.25s</li>
 *   <li>attemptCount=2: 2s × [0.75, 1.25] = 1.5~2.5s</li>
 *   <li>attemptCount=3: 4s × [0.75, 1.25] = 3~5s</li>
 *   <li>attemptCount=10: 60s (상한) × [0.75, 1.25] = 45~75s</li>
 * </ul>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    static final double JITTER_MIN = 0.75;
    static final double JITTER_RANGE = 0.5;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final DoubleSupplier random;

    /**
     * 기본 난수 소스로 생성.
     *
     * @param baseDelay 기본 지연 시간 (음수 불가)
     * @param maxDelay 최대 지연 시간 (baseDelay 이상)
     */
    public BackoffCalculator(Duration baseDelay, Duration maxDelay) {
        this(baseDelay, maxDelay, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 소스를 주입하여 생성.
     *
     * @param baseDelay 기본 지연 시간 (음수 불가)
     * @param maxDelay 최대 지연 시간 (baseDelay 이상)
     * @param random [0, 1) 범위 난수 소스
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(Duration baseDelay, Duration maxDelay, DoubleSupplier random) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative (current: " + baseDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public Duration calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        long baseNanos = baseDelay.toNanos();
        long maxNanos = maxDelay.toNanos();
        int shift = attemptCount - 1;

        // overflow 방지
        long exponential;
        if (shift >= Long.SIZE - 2 || baseNanos > (maxNanos >> shift)) {
            exponential = maxNanos;
        } else {
            exponential = Math.min(baseNanos << shift, maxNanos);
        }

        double factor = JITTER_MIN + random.getAsDouble() * JITTER_RANGE;
        return Duration.ofNanos((long) (exponential * factor));
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
