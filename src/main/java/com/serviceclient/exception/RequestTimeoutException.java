package com.serviceclient.exception;

import java.time.Duration;

public class RequestTimeoutException extends ServiceClientException {
    private final String serviceName;
    private final String endpoint;
    private final Duration timeout;

    public RequestTimeoutException(String serviceName, String endpoint, Duration timeout, Throwable cause) {
        super("Request to " + serviceName + endpoint + " timed out after " + timeout.toMillis() / 1000.0 + " seconds",
            null, cause);
        this.serviceName = serviceName;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
