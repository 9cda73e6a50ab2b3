package com.serviceclient.service;

import com.serviceclient.exception.CircuitOpenException;
import com.serviceclient.exception.GatewayErrorResponseException;
import com.serviceclient.exception.MaxRetriesExceededException;
import com.serviceclient.exception.ServiceClientException;
import com.serviceclient.exception.ServiceUnavailableException;
import com.serviceclient.model.BackoffStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class RetryHandlerTest {
    private ServiceClientProperties.Retry policy;
    private ServiceClientMetrics metrics;
    private RetryHandler handler;

    @BeforeEach
    void setup() {
        policy = new ServiceClientProperties.Retry();
        policy.setMaxAttempts(3);
        policy.setBackoffStrategy(BackoffStrategy.EXPONENTIAL);
        policy.setInitialDelay(Duration.ofMillis(1));
        policy.setMaxDelay(Duration.ofMillis(10));
        metrics = new ServiceClientMetrics("test-service", new SimpleMeterRegistry());
        handler = new RetryHandler(policy, metrics);
    }

    @Test
    void exponentialDelayIncludesJitter() {
        policy.setInitialDelay(Duration.ofSeconds(1));
        policy.setMaxDelay(Duration.ofSeconds(10));

        for (int i = 0; i < 50; i++) {
            double seconds = handler.calculateDelay(1).toNanos() / 1_000_000_000.0;
            assertThat(seconds).isBetween(1.099, 1.3);
        }
        assertThat(handler.baseDelaySeconds(3)).isCloseTo(4.0, within(1e-9));
        assertThat(handler.calculateDelay(3).toMillis()).isBetween(4399L, 5200L);
    }

    @Test
    void linearAndConstantBaseDelays() {
        policy.setInitialDelay(Duration.ofMillis(500));
        policy.setBackoffStrategy(BackoffStrategy.LINEAR);
        assertThat(handler.baseDelaySeconds(3)).isCloseTo(1.5, within(1e-9));

        policy.setBackoffStrategy(BackoffStrategy.CONSTANT);
        assertThat(handler.baseDelaySeconds(3)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void delayIsClampedToMaxDelay() {
        policy.setInitialDelay(Duration.ofSeconds(1));
        policy.setMaxDelay(Duration.ofSeconds(3));

        assertThat(handler.calculateDelay(5)).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void returnsFirstSuccessWithoutFurtherAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        String result = handler.executeWithRetry(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture("ok");
        }, "orders", "/orders").join();

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(1);
        assertThat(metrics.snapshot().getRetriesTotal()).isZero();
    }

    @Test
    void clientErrorIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = handler.executeWithRetry(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new ServiceClientException("Client error 400: bad", 400));
        }, "orders", "/orders");

        assertThatThrownBy(result::join)
            .isInstanceOf(CompletionException.class)
            .cause()
            .isInstanceOf(ServiceClientException.class)
            .hasMessageContaining("400");
        assertThat(attempts).hasValue(1);
    }

    @Test
    void structuredGatewayErrorIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = handler.executeWithRetry(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(
                new GatewayErrorResponseException("ValidationError", "bad input", "c-1", 422));
        }, "orders", "/orders");

        assertThatThrownBy(result::join).hasCauseInstanceOf(GatewayErrorResponseException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void rateLimitIsRetried() {
        AtomicInteger attempts = new AtomicInteger();

        String result = handler.executeWithRetry(() -> {
            if (attempts.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new ServiceClientException("Client error 429: slow down", 429));
            }
            return CompletableFuture.completedFuture("ok");
        }, "orders", "/orders").join();

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(2);
        assertThat(metrics.snapshot().getRetriesTotal()).isEqualTo(1);
    }

    @Test
    void serverErrorExhaustsAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        ServiceUnavailableException last = new ServiceUnavailableException("orders", "Service returned 500: boom");

        CompletableFuture<String> result = handler.executeWithRetry(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(last);
        }, "orders", "/orders");

        assertThatThrownBy(result::join)
            .isInstanceOf(CompletionException.class)
            .cause()
            .isInstanceOf(MaxRetriesExceededException.class)
            .hasMessage("Max retries (3) exceeded for orders: /orders")
            .hasCause(last);
        assertThat(attempts).hasValue(3);
        assertThat(metrics.snapshot().getRetriesTotal()).isEqualTo(2);
    }

    @Test
    void connectionFailuresAreRetried() {
        AtomicInteger attempts = new AtomicInteger();

        String result = handler.executeWithRetry(() -> {
            if (attempts.incrementAndGet() < 3) {
                return CompletableFuture.failedFuture(new ConnectException("refused"));
            }
            return CompletableFuture.completedFuture("ok");
        }, "orders", "/orders").join();

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void synchronousThrowIsTreatedAsFailedAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        String result = handler.<String>executeWithRetry(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
            return CompletableFuture.completedFuture("ok");
        }, "orders", "/orders").join();

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void circuitOpenIsNeverRetried() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = handler.executeWithRetry(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new CircuitOpenException("orders", "orders-circuit"));
        }, "orders", "/orders");

        assertThatThrownBy(result::join).hasCauseInstanceOf(CircuitOpenException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void cancellationStopsFurtherAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        AtomicBoolean cancelled = new AtomicBoolean();

        CompletableFuture<String> result = handler.executeWithRetry(() -> {
            attempts.incrementAndGet();
            cancelled.set(true);
            return CompletableFuture.failedFuture(new ServiceUnavailableException("orders", "Service returned 503"));
        }, "orders", "/orders", cancelled::get);

        assertThatThrownBy(result::join).hasCauseInstanceOf(CancellationException.class);
        assertThat(attempts).hasValue(1);
        assertThat(metrics.snapshot().getRetriesTotal()).isZero();
    }

    @Test
    void alreadyCancelledCallNeverRuns() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = handler.executeWithRetry(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture("ok");
        }, "orders", "/orders", () -> true);

        assertThatThrownBy(result::join).isInstanceOf(CancellationException.class);
        assertThat(attempts).hasValue(0);
    }
}
