package com.serviceclient.service;

import com.serviceclient.exception.CircuitOpenException;
import com.serviceclient.exception.InvalidConfigurationException;
import com.serviceclient.exception.MaxRetriesExceededException;
import com.serviceclient.exception.ServiceClientException;
import com.serviceclient.exception.ServiceDiscoveryException;
import com.serviceclient.service.ServiceClientProperties.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Supplier;

public class RetryHandler {
    private static final Logger log = LoggerFactory.getLogger(RetryHandler.class);

    private final Retry policy;
    private final ServiceClientMetrics metrics;

    public RetryHandler(Retry policy, ServiceClientMetrics metrics) {
        this.policy = policy;
        this.metrics = metrics;
    }

    public <T> CompletableFuture<T> executeWithRetry(Supplier<CompletableFuture<T>> operation, String operationName,
                                                     String endpoint) {
        return executeWithRetry(operation, operationName, endpoint, () -> false);
    }

    /**
     * Same as {@link #executeWithRetry(Supplier, String, String)}, but stops as soon as
     * {@code cancelled} reports true: no further attempt is started and the pending one fails
     * with a {@link CancellationException}.
     */
    public <T> CompletableFuture<T> executeWithRetry(Supplier<CompletableFuture<T>> operation, String operationName,
                                                     String endpoint, BooleanSupplier cancelled) {
        return attempt(operation, operationName, endpoint, cancelled, 1);
    }

    private <T> CompletableFuture<T> attempt(Supplier<CompletableFuture<T>> operation, String operationName,
                                             String endpoint, BooleanSupplier cancelled, int attempt) {
        if (cancelled.getAsBoolean()) {
            return CompletableFuture.failedFuture(cancellation(operationName, endpoint));
        }
        return invoke(operation).<CompletableFuture<T>>handle((result, failure) -> {
            if (cancelled.getAsBoolean()) {
                return CompletableFuture.<T>failedFuture(cancellation(operationName, endpoint));
            }
            if (failure == null) {
                if (attempt > 1) {
                    log.info("Operation {} succeeded on attempt {}", operationName, attempt);
                }
                return CompletableFuture.completedFuture(result);
            }
            Throwable error = unwrap(failure);
            if (shouldNotRetry(error)) {
                return CompletableFuture.<T>failedFuture(error);
            }
            if (attempt >= policy.getMaxAttempts()) {
                return CompletableFuture.<T>failedFuture(
                    new MaxRetriesExceededException(operationName, endpoint, policy.getMaxAttempts(), error));
            }

            Duration delay = calculateDelay(attempt);
            if (isRateLimited(error)) {
                log.warn("Rate limited (429) for {}. Retrying in {} ms. Error: {}",
                    operationName, delay.toMillis(), error.getMessage());
            } else {
                log.warn("Attempt {} failed for {}. Retrying in {} ms. Error: {}",
                    attempt, operationName, delay.toMillis(), error.getMessage());
            }
            metrics.recordRetry(operationName);
            Executor delayed = CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS);
            return CompletableFuture.runAsync(() -> { }, delayed)
                .thenCompose(ignored -> attempt(operation, operationName, endpoint, cancelled, attempt + 1));
        }).thenCompose(Function.identity());
    }

    public Duration calculateDelay(int attempt) {
        double base = baseDelaySeconds(attempt);
        double jitter = ThreadLocalRandom.current().nextDouble(0.1, 0.3) * base;
        double seconds = Math.min(base + jitter, toSeconds(policy.getMaxDelay()));
        return Duration.ofNanos((long) (seconds * 1_000_000_000L));
    }

    double baseDelaySeconds(int attempt) {
        double initial = toSeconds(policy.getInitialDelay());
        switch (policy.getBackoffStrategy()) {
            case EXPONENTIAL:
                return initial * Math.pow(2, attempt - 1);
            case LINEAR:
                return initial * attempt;
            case CONSTANT:
            default:
                return initial;
        }
    }

    boolean shouldNotRetry(Throwable error) {
        if (error instanceof CircuitOpenException
            || error instanceof ServiceDiscoveryException
            || error instanceof InvalidConfigurationException) {
            return true;
        }
        if (error instanceof ServiceClientException) {
            Integer code = ((ServiceClientException) error).getErrorCode();
            return code != null && code >= 400 && code < 500 && code != 429;
        }
        return false;
    }

    private static CancellationException cancellation(String operationName, String endpoint) {
        return new CancellationException("Call to " + operationName + endpoint + " was cancelled");
    }

    private static boolean isRateLimited(Throwable error) {
        return error instanceof ServiceClientException
            && Integer.valueOf(429).equals(((ServiceClientException) error).getErrorCode());
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> operation) {
        try {
            return operation.get();
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
