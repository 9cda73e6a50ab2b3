package com.serviceclient.exception;

public class ServiceDiscoveryException extends ServiceClientException {
    private final String serviceName;
    private final String errorDetails;

    public ServiceDiscoveryException(String serviceName, String errorDetails) {
        super(buildMessage(serviceName, errorDetails));
        this.serviceName = serviceName;
        this.errorDetails = errorDetails;
    }

    private static String buildMessage(String serviceName, String errorDetails) {
        String message = "Failed to resolve gateway route for service '" + serviceName + "'";
        if (errorDetails != null) {
            message += ": " + errorDetails;
        }
        return message;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getErrorDetails() {
        return errorDetails;
    }
}
