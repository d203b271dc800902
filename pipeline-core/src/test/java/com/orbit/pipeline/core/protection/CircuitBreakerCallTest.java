package com.orbit.pipeline.core.protection;

import com.orbit.pipeline.core.error.CircuitBreakerOpenException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CircuitBreaker 기본 메서드(call, callAsync) 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class CircuitBreakerCallTest {

    private CountingBreaker breaker;

    @BeforeEach
    void setUp() {
        breaker = new CountingBreaker();
    }

    @Test
    void call_Success_RecordsSuccess() throws Exception {
        // when
        String result = breaker.call(() -> "ok");

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(breaker.successes.get()).isEqualTo(1);
        assertThat(breaker.failures.get()).isZero();
    }

    @Test
    void call_Failure_RecordsFailureAndRethrows() {
        // when & then
        assertThatThrownBy(() -> breaker.call(() -> {
            throw new IOException("boom");
        })).isInstanceOf(IOException.class).hasMessage("boom");
        assertThat(breaker.failures.get()).isEqualTo(1);
    }

    @Test
    void call_Error_RecordsFailureAndRethrows() {
        // when & then
        assertThatThrownBy(() -> breaker.call(() -> {
            throw new AssertionError("fatal");
        })).isInstanceOf(AssertionError.class).hasMessage("fatal");
        assertThat(breaker.failures.get()).isEqualTo(1);
        assertThat(breaker.lastFailure).isInstanceOf(AssertionError.class);
    }

    @Test
    void callAsync_SupplierError_RecordsFailureAndRethrows() {
        // when & then
        assertThatThrownBy(() -> breaker.callAsync(() -> {
            throw new AssertionError("fatal");
        })).isInstanceOf(AssertionError.class);
        assertThat(breaker.failures.get()).isEqualTo(1);
    }

    @Test
    void call_Rejected_DoesNotInvokeAction() {
        // given
        breaker.open = true;
        AtomicInteger invocations = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> breaker.call(invocations::incrementAndGet))
            .isInstanceOf(CircuitBreakerOpenException.class);
        assertThat(invocations.get()).isZero();
    }

    @Test
    void callAsync_Failure_RecordsUnwrappedCause() {
        // when
        CompletableFuture<String> future = breaker.callAsync(
            () -> CompletableFuture.failedFuture(new IOException("reset")));

        // then
        assertThatThrownBy(future::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(IOException.class);
        assertThat(breaker.lastFailure).isInstanceOf(IOException.class);
    }

    @Test
    void callAsync_Rejected_ReturnsFailedFuture() {
        // given
        breaker.open = true;

        // when
        CompletableFuture<String> future = breaker.callAsync(() -> CompletableFuture.completedFuture("x"));

        // then
        assertThatThrownBy(future::join).hasCauseInstanceOf(CircuitBreakerOpenException.class);
    }

    private static final class CountingBreaker implements CircuitBreaker {
        final AtomicInteger successes = new AtomicInteger();
        final AtomicInteger failures = new AtomicInteger();
        volatile boolean open;
        volatile Throwable lastFailure;

        @Override
        public String getName() {
            return "test";
        }

        @Override
        public boolean tryAcquire() {
            return !open;
        }

        @Override
        public void recordSuccess() {
            successes.incrementAndGet();
        }

        @Override
        public void recordFailure(Throwable throwable) {
            failures.incrementAndGet();
            lastFailure = throwable;
        }

        @Override
        public CircuitBreakerState getState() {
            return open ? CircuitBreakerState.OPEN : CircuitBreakerState.CLOSED;
        }

        @Override
        public int getConsecutiveFailures() {
            return failures.get();
        }

        @Override
        public void reset() {
            open = false;
        }
    }
}
