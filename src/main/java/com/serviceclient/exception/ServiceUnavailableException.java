package com.serviceclient.exception;

public class ServiceUnavailableException extends ServiceClientException {
    private final String serviceName;
    private final String reason;

    public ServiceUnavailableException(String serviceName, String reason) {
        this(serviceName, reason, null);
    }

    public ServiceUnavailableException(String serviceName, String reason, Throwable cause) {
        super(buildMessage(serviceName, reason), null, cause);
        this.serviceName = serviceName;
        this.reason = reason;
    }

    private static String buildMessage(String serviceName, String reason) {
        String message = "Service '" + serviceName + "' is unavailable";
        if (reason != null) {
            message += ": " + reason;
        }
        return message;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getReason() {
        return reason;
    }
}
