package com.serviceclient.exception;

/**
 * Structured 4xx error body returned by the gateway ({@code {"error": {"type", "message", "correlation_id"}}}).
 */
public class GatewayErrorResponseException extends ServiceClientException {
    private final String errorType;
    private final String correlationId;

    public GatewayErrorResponseException(String errorType, String message, String correlationId, int statusCode) {
        super(buildMessage(errorType, message, correlationId), statusCode);
        this.errorType = errorType;
        this.correlationId = correlationId;
    }

    private static String buildMessage(String errorType, String message, String correlationId) {
        String result = errorType + ": " + message;
        if (correlationId != null) {
            result += " (correlation_id: " + correlationId + ")";
        }
        return result;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getCorrelationId() {
        return correlationId;
    }
}
