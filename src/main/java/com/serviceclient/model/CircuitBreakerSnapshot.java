package com.serviceclient.model;

import java.time.Instant;

public class CircuitBreakerSnapshot {
    private final String name;
    private final CircuitState state;
    private final int failureCount;
    private final int successCount;
    private final Instant lastStateChange;
    private final Instant lastFailureTime;

    public CircuitBreakerSnapshot(String name, CircuitState state, int failureCount, int successCount,
                                  Instant lastStateChange, Instant lastFailureTime) {
        this.name = name;
        this.state = state;
        this.failureCount = failureCount;
        this.successCount = successCount;
        this.lastStateChange = lastStateChange;
        this.lastFailureTime = lastFailureTime;
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        return state;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public Instant getLastStateChange() {
        return lastStateChange;
    }

    public Instant getLastFailureTime() {
        return lastFailureTime;
    }
}
