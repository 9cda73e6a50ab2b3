package com.serviceclient.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Duration;
import java.util.Map;

@Schema(description = "A call to another service routed through the API gateway")
public class ServiceRequest {
    @NotBlank
    @Schema(description = "Target service name", example = "property-service")
    private String targetService;

    @NotBlank
    @Schema(description = "Endpoint path on the target service", example = "/api/v1/properties")
    private String endpoint;

    @NotNull
    @Schema(description = "HTTP method", example = "GET",
            allowableValues = {"GET", "POST", "PUT", "PATCH", "DELETE"})
    private HttpMethod method = HttpMethod.GET;

    @Schema(description = "Request body, JSON-encoded for non-GET calls (optional)")
    private Object data;

    @Schema(description = "Query string parameters (optional)")
    private Map<String, Object> params;

    @Schema(description = "Extra headers merged over the identification headers (optional)")
    private Map<String, String> headers;

    @Schema(description = "Per-call timeout override (ISO-8601)", example = "PT5S")
    private Duration timeout;

    @Schema(description = "Serve and populate the response cache for GET calls", example = "true")
    private boolean useCache = true;

    @Schema(description = "Gate the call through the target's circuit breaker", example = "true")
    private boolean useCircuitBreaker = true;

    @Schema(description = "Retry retryable failures with backoff", example = "true")
    private boolean useRetry = true;

    public ServiceRequest() {
    }

    public ServiceRequest(String targetService, String endpoint, HttpMethod method) {
        this.targetService = targetService;
        this.endpoint = endpoint;
        this.method = method;
    }

    public String getTargetService() {
        return targetService;
    }

    public void setTargetService(String targetService) {
        this.targetService = targetService;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public void setMethod(HttpMethod method) {
        this.method = method;
    }

    public Object getData() {
        return data;
    }

    public void setData(Object data) {
        this.data = data;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public void setParams(Map<String, Object> params) {
        this.params = params;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public boolean isUseCache() {
        return useCache;
    }

    public void setUseCache(boolean useCache) {
        this.useCache = useCache;
    }

    public boolean isUseCircuitBreaker() {
        return useCircuitBreaker;
    }

    public void setUseCircuitBreaker(boolean useCircuitBreaker) {
        this.useCircuitBreaker = useCircuitBreaker;
    }

    public boolean isUseRetry() {
        return useRetry;
    }

    public void setUseRetry(boolean useRetry) {
        this.useRetry = useRetry;
    }
}
