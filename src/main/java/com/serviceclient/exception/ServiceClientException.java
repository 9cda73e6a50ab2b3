package com.serviceclient.exception;

/**
 * Base type for every error raised by the service client.
 *
 * <p>{@code errorCode} carries the HTTP status when the failure came from a gateway response,
 * and is {@code null} for transport-level and local failures.
 */
public class ServiceClientException extends RuntimeException {
    private final Integer errorCode;

    public ServiceClientException(String message) {
        this(message, null, null);
    }

    public ServiceClientException(String message, Integer errorCode) {
        this(message, errorCode, null);
    }

    public ServiceClientException(String message, Integer errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public Integer getErrorCode() {
        return errorCode;
    }
}
