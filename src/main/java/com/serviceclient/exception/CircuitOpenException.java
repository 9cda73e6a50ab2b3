package com.serviceclient.exception;

public class CircuitOpenException extends ServiceClientException {
    private final String serviceName;
    private final String circuitName;

    public CircuitOpenException(String serviceName, String circuitName) {
        super("Circuit " + circuitName + " for service " + serviceName + " is OPEN");
        this.serviceName = serviceName;
        this.circuitName = circuitName;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getCircuitName() {
        return circuitName;
    }
}
