package com.serviceclient.service;

import com.serviceclient.model.CircuitBreakerSnapshot;
import com.serviceclient.model.CircuitState;
import com.serviceclient.service.ServiceClientProperties.CircuitBreakerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerSettings settings;
    private final GatewayCircuitStatusClient statusClient;
    private final Duration syncInterval;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private Instant lastStateChange;
    private Instant lastGatewaySync = Instant.EPOCH;

    public CircuitBreaker(String name, CircuitBreakerSettings settings, GatewayCircuitStatusClient statusClient,
                          Duration syncInterval, Clock clock) {
        this.name = name;
        this.settings = settings;
        this.statusClient = statusClient;
        this.syncInterval = syncInterval;
        this.clock = clock;
        this.lastStateChange = clock.instant();
    }

    public CompletableFuture<Boolean> canExecute() {
        return reconcileIfDue().thenApply(ignored -> evaluate());
    }

    public void recordSuccess() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                successCount++;
                if (successCount >= settings.getSuccessThreshold()) {
                    closeCircuit();
                }
            } else if (state == CircuitState.CLOSED && failureCount > 0) {
                failureCount = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure() {
        lock.lock();
        try {
            failureCount++;
            lastFailureTime = clock.instant();
            if (state == CircuitState.CLOSED && failureCount >= settings.getFailureThreshold()) {
                openCircuit();
            } else if (state == CircuitState.HALF_OPEN) {
                openCircuit();
            }
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            if (state != CircuitState.CLOSED) {
                log.info("Circuit {} reset to CLOSED", name);
            }
            closeCircuit();
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(name, state, failureCount, successCount, lastStateChange,
                lastFailureTime);
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        return state;
    }

    private boolean evaluate() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                case HALF_OPEN:
                    return true;
                case OPEN:
                    if (Duration.between(lastStateChange, clock.instant()).compareTo(settings.getRecoveryTimeout()) > 0) {
                        halfOpenCircuit();
                        return true;
                    }
                    return false;
                default:
                    return false;
            }
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<Void> reconcileIfDue() {
        if (statusClient == null) {
            return CompletableFuture.completedFuture(null);
        }
        lock.lock();
        try {
            Instant now = clock.instant();
            if (Duration.between(lastGatewaySync, now).compareTo(syncInterval) < 0) {
                return CompletableFuture.completedFuture(null);
            }
            lastGatewaySync = now;
        } finally {
            lock.unlock();
        }
        return statusClient.fetchState(name).thenAccept(this::applyRemoteState);
    }

    private void applyRemoteState(Optional<CircuitState> remote) {
        if (remote.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            if (remote.get() == CircuitState.OPEN && state != CircuitState.OPEN) {
                log.info("Gateway reports circuit {} OPEN, forcing local state", name);
                openCircuit();
            } else if (remote.get() == CircuitState.CLOSED && state != CircuitState.CLOSED) {
                log.info("Gateway reports circuit {} CLOSED, forcing local state", name);
                closeCircuit();
            }
        } finally {
            lock.unlock();
        }
    }

    private void openCircuit() {
        changeState(CircuitState.OPEN);
    }

    private void halfOpenCircuit() {
        failureCount = 0;
        successCount = 0;
        changeState(CircuitState.HALF_OPEN);
    }

    private void closeCircuit() {
        failureCount = 0;
        successCount = 0;
        changeState(CircuitState.CLOSED);
    }

    private void changeState(CircuitState next) {
        CircuitState previous = state;
        state = next;
        lastStateChange = clock.instant();
        if (previous != next) {
            log.info("Circuit {} state changed to {}", name, next);
        }
    }
}
