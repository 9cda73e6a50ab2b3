package com.serviceclient.exception;

public class MaxRetriesExceededException extends ServiceClientException {
    private final String serviceName;
    private final String endpoint;
    private final int attempts;

    public MaxRetriesExceededException(String serviceName, String endpoint, int attempts, Throwable lastFailure) {
        super("Max retries (" + attempts + ") exceeded for " + serviceName + ": " + endpoint, null, lastFailure);
        this.serviceName = serviceName;
        this.endpoint = endpoint;
        this.attempts = attempts;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getAttempts() {
        return attempts;
    }
}
