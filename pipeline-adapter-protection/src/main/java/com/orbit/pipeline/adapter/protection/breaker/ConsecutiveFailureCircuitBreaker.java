package com.orbit.pipeline.adapter.protection.breaker;

import com.orbit.pipeline.core.protection.CircuitBreaker;
import com.orbit.pipeline.core.protection.CircuitBreakerConfig;
import com.orbit.pipeline.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 연속 실패 수 기반 Circuit Breaker.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>CLOSED: 실패마다 consecutiveFailures 증가, 임계값 도달 시 OPEN (openedAt 기록)</li>
 *   <li>OPEN: {@code now - openedAt >= recoveryTimeout}이 되기 전까지 모든 호출 거부.
 *       이후 첫 호출이 HALF_OPEN 시험 호출로 통과</li>
 *   <li>HALF_OPEN: 시험 호출 하나만 허용. 성공 시 CLOSED, 실패 시 OPEN (openedAt 갱신)</li>
 *   <li>모든 성공은 consecutiveFailures를 0으로 초기화</li>
 * </ul>
 *
 * <p>하나의 인스턴스는 하나의 논리적 작업만 보호합니다.
 * 작업별 인스턴스는 {@link CircuitBreakerRegistry}로 얻습니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public ConsecutiveFailureCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null || clock == null) {
            throw new IllegalArgumentException("config and clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized boolean tryAcquire() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                Duration elapsed = Duration.between(openedAt, clock.instant());
                if (elapsed.compareTo(config.recoveryTimeout()) < 0) {
                    return false;
                }
                transitionTo(CircuitBreakerState.HALF_OPEN);
                trialInFlight = true;
                return true;
            case HALF_OPEN:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
            default:
                throw new IllegalStateException("Unknown state: " + state);
        }
    }

    @Override
    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        if (state == CircuitBreakerState.HALF_OPEN) {
            trialInFlight = false;
            openedAt = null;
            transitionTo(CircuitBreakerState.CLOSED);
        }
    }

    @Override
    public synchronized void recordFailure(Throwable throwable) {
        consecutiveFailures++;
        if (state == CircuitBreakerState.HALF_OPEN) {
            trialInFlight = false;
            open(throwable);
        } else if (state == CircuitBreakerState.CLOSED && consecutiveFailures >= config.failureThreshold()) {
            open(throwable);
        }
    }

    @Override
    public synchronized CircuitBreakerState getState() {
        return state;
    }

    @Override
    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    @Override
    public synchronized void reset() {
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
        if (state != CircuitBreakerState.CLOSED) {
            transitionTo(CircuitBreakerState.CLOSED);
        }
    }

    /**
     * OPEN으로 전이된 시각.
     *
     * @return openedAt (OPEN/HALF_OPEN이 아니면 null)
     */
    public synchronized Instant getOpenedAt() {
        return openedAt;
    }

    private void open(Throwable cause) {
        openedAt = clock.instant();
        transitionTo(CircuitBreakerState.OPEN);
        log.warn("Circuit breaker '{}' opened after {} consecutive failures (last: {})",
            name, consecutiveFailures, cause == null ? "unknown" : cause.toString());
    }

    private void transitionTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = next;
        log.info("Circuit breaker '{}': {} → {}", name, previous, next);
    }

    @Override
    public synchronized String toString() {
        return "ConsecutiveFailureCircuitBreaker{name=" + name + ", state=" + state
            + ", consecutiveFailures=" + consecutiveFailures + "}";
    }
}
