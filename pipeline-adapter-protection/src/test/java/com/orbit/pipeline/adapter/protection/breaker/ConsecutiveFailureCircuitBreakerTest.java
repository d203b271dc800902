package com.orbit.pipeline.adapter.protection.breaker;

import com.orbit.pipeline.core.error.CircuitBreakerOpenException;
import com.orbit.pipeline.core.error.ScrapingException;
import com.orbit.pipeline.core.protection.CircuitBreaker;
import com.orbit.pipeline.core.protection.CircuitBreakerConfig;
import com.orbit.pipeline.core.protection.CircuitBreakerState;
import com.orbit.pipeline.testkit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ConsecutiveFailureCircuitBreaker 유닛 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class ConsecutiveFailureCircuitBreakerTest {

    private static final RuntimeException FAILURE = new ScrapingException("503 Service Unavailable");

    private MutableClock clock;
    private ConsecutiveFailureCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        breaker = new ConsecutiveFailureCircuitBreaker(
            "openai",
            new CircuitBreakerConfig().withFailureThreshold(3).withRecoveryTimeout(Duration.ofSeconds(60)),
            clock
        );
    }

    private void failTimes(int count) {
        for (int i = 0; i < count; i++) {
            assertThat(breaker.tryAcquire()).isTrue();
            breaker.recordFailure(FAILURE);
        }
    }

    // ============================================================
    // 1. CLOSED → OPEN
    // ============================================================

    @Test
    void 임계값_미만의_실패는_CLOSED를_유지함() {
        // when
        failTimes(2);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isEqualTo(2);
    }

    @Test
    void 임계값만큼_연속_실패하면_OPEN으로_전이함() {
        // when
        failTimes(3);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.getOpenedAt()).isEqualTo(clock.instant());
    }

    @Test
    void 성공은_연속_실패_수를_초기화함() {
        // given
        failTimes(2);

        // when
        breaker.recordSuccess();
        failTimes(2);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isEqualTo(2);
    }

    // ============================================================
    // 2. OPEN → HALF_OPEN → CLOSED/OPEN
    // ============================================================

    @Test
    void OPEN_상태에서는_복구_시간_전까지_호출을_거부함() {
        // given
        failTimes(3);

        // when
        clock.advance(Duration.ofSeconds(59));

        // then
        assertThat(breaker.tryAcquire()).isFalse();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 복구_시간이_지나면_시험_호출_하나만_허용함() {
        // given
        failTimes(3);
        clock.advance(Duration.ofSeconds(60));

        // when
        boolean first = breaker.tryAcquire();
        boolean second = breaker.tryAcquire();

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void 시험_호출이_성공하면_CLOSED로_돌아감() {
        // given
        failTimes(3);
        clock.advance(Duration.ofSeconds(61));
        breaker.tryAcquire();

        // when
        breaker.recordSuccess();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isZero();
        assertThat(breaker.getOpenedAt()).isNull();
    }

    @Test
    void 시험_호출이_실패하면_다시_OPEN이_되고_복구_시간이_새로_시작됨() {
        // given
        failTimes(3);
        clock.advance(Duration.ofSeconds(61));
        breaker.tryAcquire();

        // when
        breaker.recordFailure(FAILURE);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.getOpenedAt()).isEqualTo(clock.instant());
        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.tryAcquire()).isFalse();
    }

    @Test
    void reset은_CLOSED로_강제_전이함() {
        // given
        failTimes(3);

        // when
        breaker.reset();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.tryAcquire()).isTrue();
    }

    // ============================================================
    // 3. 보호된 호출
    // ============================================================

    @Test
    void OPEN_상태의_call은_작업을_실행하지_않고_예외를_던짐() {
        // given
        failTimes(3);
        AtomicInteger invocations = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> breaker.call(invocations::incrementAndGet))
            .isInstanceOf(CircuitBreakerOpenException.class)
            .hasMessageContaining("openai");
        assertThat(invocations).hasValue(0);
    }

    @Test
    void callAsync_실패는_연속_실패로_기록됨() {
        // when
        for (int i = 0; i < 3; i++) {
            CompletableFuture<String> future = breaker.callAsync(() -> CompletableFuture.failedFuture(FAILURE));
            assertThatThrownBy(future::get).isInstanceOf(ExecutionException.class).hasCause(FAILURE);
        }

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.callAsync(() -> CompletableFuture.completedFuture("ok")))
            .isCompletedExceptionally();
    }

    // ============================================================
    // 4. Registry
    // ============================================================

    @Test
    void 등록소는_작업_키별로_독립된_Breaker를_제공함() {
        // given
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(
            new CircuitBreakerConfig().withFailureThreshold(1), clock);

        // when
        CircuitBreaker openai = registry.get("openai");
        openai.tryAcquire();
        openai.recordFailure(FAILURE);

        // then
        assertThat(registry.get("openai")).isSameAs(openai);
        assertThat(openai.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(registry.get("http").getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(registry.snapshot()).containsOnlyKeys("http", "openai");

        registry.resetAll();
        assertThat(openai.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 시험_호출이_Error를_던져도_OPEN으로_돌아가고_다음_시험을_허용함() {
        // given
        failTimes(3);
        clock.advance(Duration.ofSeconds(60));

        // when
        assertThatThrownBy(() -> breaker.call(() -> {
            throw new AssertionError("fatal");
        })).isInstanceOf(AssertionError.class);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        clock.advance(Duration.ofSeconds(60));
        assertThat(breaker.tryAcquire()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
    }

    // ============================================================
    // 5. 동시성
    // ============================================================

    @Test
    void HALF_OPEN_경쟁에서는_정확히_하나의_시험_호출만_허용함() throws Exception {
        // given
        failTimes(3);
        clock.advance(Duration.ofSeconds(60));
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CyclicBarrier barrier = new CyclicBarrier(threads);
        AtomicInteger admitted = new AtomicInteger();
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            tasks.add(() -> {
                barrier.await(5, TimeUnit.SECONDS);
                if (breaker.tryAcquire()) {
                    admitted.incrementAndGet();
                }
                return null;
            });
        }

        // when
        try {
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // then
        assertThat(admitted).hasValue(1);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void 동시_실패_기록은_유실되지_않고_임계값에서_OPEN이_됨() throws Exception {
        // given
        ConsecutiveFailureCircuitBreaker wide = new ConsecutiveFailureCircuitBreaker(
            "http", new CircuitBreakerConfig().withFailureThreshold(200), clock);
        int threads = 8;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            tasks.add(() -> {
                start.await(5, TimeUnit.SECONDS);
                for (int j = 0; j < perThread; j++) {
                    wide.recordFailure(FAILURE);
                }
                return null;
            });
        }

        // when
        try {
            List<Future<Void>> futures = new ArrayList<>();
            for (Callable<Void> task : tasks) {
                futures.add(executor.submit(task));
            }
            start.countDown();
            for (Future<Void> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // then
        assertThat(wide.getConsecutiveFailures()).isEqualTo(threads * perThread);
        assertThat(wide.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }
}
