package com.serviceclient.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.serviceclient.cache.CacheStore;
import com.serviceclient.cache.ResponseCache;
import com.serviceclient.exception.CircuitOpenException;
import com.serviceclient.exception.GatewayErrorResponseException;
import com.serviceclient.exception.RequestTimeoutException;
import com.serviceclient.exception.ServiceClientException;
import com.serviceclient.exception.ServiceDiscoveryException;
import com.serviceclient.exception.ServiceUnavailableException;
import com.serviceclient.model.BatchResult;
import com.serviceclient.model.CacheStats;
import com.serviceclient.model.CircuitBreakerSnapshot;
import com.serviceclient.model.CircuitState;
import com.serviceclient.model.HttpMethod;
import com.serviceclient.model.MetricsSnapshot;
import com.serviceclient.model.ServiceRequest;
import com.serviceclient.transport.HttpResponseData;
import com.serviceclient.transport.HttpTransport;
import com.serviceclient.transport.JavaHttpTransport;
import com.serviceclient.transport.TransportRequest;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Service
public class ServiceClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ServiceClient.class);

    private final ServiceClientProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpTransport transport;
    private final ResponseCache cache;
    private final RetryHandler retryHandler;
    private final ServiceClientMetrics metrics;
    private final GatewayCircuitStatusClient statusClient;
    private final GatewayHealthMonitor gatewayHealth;
    private final Clock clock;
    private final String gatewayUrl;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final Map<String, InFlightCall> activeRequests = new ConcurrentHashMap<>();
    private volatile boolean closed;

    @Autowired
    public ServiceClient(ServiceClientProperties properties, ObjectMapper objectMapper, CacheStore cacheStore,
                         MeterRegistry meterRegistry) {
        this(properties, objectMapper, new JavaHttpTransport(properties.getGatewayTimeout()), cacheStore,
            new ServiceClientMetrics(properties.getServiceName(), meterRegistry), Clock.systemUTC());
    }

    public ServiceClient(ServiceClientProperties properties, ObjectMapper objectMapper, HttpTransport transport,
                         CacheStore cacheStore, ServiceClientMetrics metrics, Clock clock) {
        properties.validate();
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.transport = transport;
        this.metrics = metrics;
        this.clock = clock;
        this.gatewayUrl = GatewayCircuitStatusClient.stripTrailingSlash(properties.getGatewayUrl());
        this.cache = new ResponseCache(properties.getCache(), cacheStore, objectMapper, clock);
        this.retryHandler = new RetryHandler(properties.getRetry(), metrics);
        this.statusClient = new GatewayCircuitStatusClient(transport, objectMapper, gatewayUrl,
            properties.getServiceToken(), properties.getGatewayStatusTimeout());
        this.gatewayHealth = new GatewayHealthMonitor(transport, gatewayUrl, properties.getGatewayHealthCheck());
    }

    public CompletableFuture<JsonNode> call(ServiceRequest request) {
        if (closed) {
            return CompletableFuture.failedFuture(new ServiceClientException("Service client is closed"));
        }
        String requestId = UUID.randomUUID().toString();
        long start = System.nanoTime();
        String target = request.getTargetService();
        String endpoint = request.getEndpoint();
        String method = request.getMethod().name();
        metrics.recordRequest(target, method);

        TransportRequest transportRequest;
        try {
            transportRequest = buildTransportRequest(request, requestId);
        } catch (ServiceClientException ex) {
            metrics.recordFailure(target, method, ex);
            return CompletableFuture.failedFuture(ex);
        }

        InFlightCall inFlight = new InFlightCall();
        boolean cacheable = request.isUseCache() && request.getMethod() == HttpMethod.GET;
        CircuitBreaker breaker = request.isUseCircuitBreaker() ? getCircuitBreaker(target) : null;
        CompletableFuture<Boolean> permission = breaker == null
            ? CompletableFuture.completedFuture(true)
            : breaker.canExecute();

        CompletableFuture<JsonNode> result = permission.thenCompose(allowed -> {
            if (inFlight.isCancelled()) {
                return CompletableFuture.<JsonNode>failedFuture(new CancellationException());
            }
            if (!allowed) {
                CircuitOpenException rejected = new CircuitOpenException(target, breaker.getName());
                metrics.recordCircuitOpen(breaker.getName());
                metrics.recordFailure(target, method, rejected);
                return CompletableFuture.<JsonNode>failedFuture(rejected);
            }
            if (cacheable) {
                Optional<JsonNode> cached = cache.get(target, endpoint, method, request.getParams());
                if (cached.isPresent()) {
                    metrics.recordCacheHit(target);
                    return CompletableFuture.completedFuture(cached.get());
                }
                metrics.recordCacheMiss(target);
            }
            return execute(request, transportRequest, inFlight)
                .thenApply(response -> {
                    if (inFlight.isCancelled()) {
                        throw new CancellationException();
                    }
                    if (breaker != null) {
                        breaker.recordSuccess();
                    }
                    metrics.recordSuccess(target, method, Duration.ofNanos(System.nanoTime() - start));
                    if (cacheable) {
                        cache.set(target, endpoint, method, request.getParams(), response);
                    }
                    return response;
                })
                .exceptionallyCompose(error -> inFlight.isCancelled()
                    ? CompletableFuture.<JsonNode>failedFuture(new CancellationException())
                    : handleFailure(request, breaker, cacheable, error));
        });

        inFlight.result = result;
        activeRequests.put(requestId, inFlight);
        result.whenComplete((response, error) -> activeRequests.remove(requestId));
        if (closed) {
            inFlight.cancel();
        }
        return result;
    }

    public CompletableFuture<JsonNode> get(String targetService, String endpoint, Map<String, Object> params) {
        ServiceRequest request = new ServiceRequest(targetService, endpoint, HttpMethod.GET);
        request.setParams(params);
        return call(request);
    }

    public CompletableFuture<JsonNode> post(String targetService, String endpoint, Object data) {
        ServiceRequest request = new ServiceRequest(targetService, endpoint, HttpMethod.POST);
        request.setData(data);
        return call(request);
    }

    public CompletableFuture<JsonNode> put(String targetService, String endpoint, Object data) {
        ServiceRequest request = new ServiceRequest(targetService, endpoint, HttpMethod.PUT);
        request.setData(data);
        return call(request);
    }

    public CompletableFuture<JsonNode> delete(String targetService, String endpoint) {
        return call(new ServiceRequest(targetService, endpoint, HttpMethod.DELETE));
    }

    public CompletableFuture<List<BatchResult>> batchCall(List<ServiceRequest> requests) {
        List<CompletableFuture<BatchResult>> calls = requests.stream()
            .map(request -> invokeSafely(() -> call(request))
                .handle((body, error) -> error == null
                    ? BatchResult.success(body)
                    : BatchResult.failure(RetryHandler.unwrap(error))))
            .collect(Collectors.toList());
        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> calls.stream().map(CompletableFuture::join).collect(Collectors.toList()));
    }

    public CircuitState getCircuitState(String targetService) {
        return getCircuitBreaker(targetService).getState();
    }

    public CircuitBreakerSnapshot getCircuitSnapshot(String targetService) {
        return getCircuitBreaker(targetService).snapshot();
    }

    public void resetCircuit(String targetService) {
        getCircuitBreaker(targetService).reset();
    }

    public void clearCache(String targetService) {
        cache.clear(targetService);
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    public MetricsSnapshot getMetrics() {
        return metrics.snapshot();
    }

    public void resetMetrics() {
        metrics.reset();
    }

    public boolean isGatewayAvailable() {
        return gatewayHealth.isAvailable();
    }

    @Scheduled(fixedDelayString = "#{@serviceClientProperties.gatewayHealthCheck.interval.toMillis()}")
    public void scheduledGatewayHealthCheck() {
        gatewayHealth.refresh();
    }

    public CompletableFuture<Boolean> refreshGatewayHealth() {
        return gatewayHealth.refresh();
    }

    /**
     * Cancels every call still in flight and rejects new ones. A cancelled call starts no further
     * attempt and leaves breaker, metrics and cache untouched, even if its response still arrives.
     */
    @Override
    public void close() {
        closed = true;
        int inFlight = activeRequests.size();
        activeRequests.values().forEach(InFlightCall::cancel);
        activeRequests.clear();
        if (inFlight > 0) {
            log.info("Cancelled {} in-flight service calls on close", inFlight);
        }
    }

    int activeRequestCount() {
        return activeRequests.size();
    }

    CircuitBreaker getCircuitBreaker(String targetService) {
        return circuitBreakers.computeIfAbsent(targetService, key -> {
            CircuitBreaker breaker = new CircuitBreaker(key + "-circuit", properties.circuitBreakerFor(key),
                statusClient, properties.getGatewaySyncInterval(), clock);
            metrics.registerCircuit(breaker);
            return breaker;
        });
    }

    private CompletableFuture<JsonNode> execute(ServiceRequest request, TransportRequest transportRequest,
                                                InFlightCall inFlight) {
        Supplier<CompletableFuture<JsonNode>> singleAttempt = () -> executeRequest(request, transportRequest, inFlight);
        if (request.isUseRetry()) {
            return retryHandler.executeWithRetry(singleAttempt, request.getTargetService(), request.getEndpoint(),
                inFlight::isCancelled);
        }
        return invokeSafely(singleAttempt);
    }

    private CompletableFuture<JsonNode> handleFailure(ServiceRequest request, CircuitBreaker breaker,
                                                      boolean cacheable, Throwable failure) {
        Throwable error = RetryHandler.unwrap(failure);
        String target = request.getTargetService();
        metrics.recordFailure(target, request.getMethod().name(), error);
        if (breaker != null) {
            breaker.recordFailure();
        }
        if (cacheable) {
            Optional<JsonNode> cached = cache.get(target, request.getEndpoint(), request.getMethod().name(),
                request.getParams());
            if (cached.isPresent()) {
                log.warn("Returning cached response for {}{} due to error: {}",
                    target, request.getEndpoint(), error.getMessage());
                return CompletableFuture.completedFuture(cached.get());
            }
        }
        return CompletableFuture.failedFuture(error);
    }

    private CompletableFuture<JsonNode> executeRequest(ServiceRequest request, TransportRequest transportRequest,
                                                       InFlightCall inFlight) {
        if (!gatewayHealth.isAvailable()) {
            return CompletableFuture.failedFuture(
                new ServiceUnavailableException("gateway", "API Gateway is unavailable"));
        }
        String target = request.getTargetService();
        return inFlight.track(invokeSafely(() -> transport.execute(transportRequest)))
            .<CompletableFuture<JsonNode>>handle((response, failure) -> {
                if (failure != null) {
                    return CompletableFuture.failedFuture(
                        mapTransportFailure(RetryHandler.unwrap(failure), request, transportRequest.getTimeout()));
                }
                try {
                    return CompletableFuture.completedFuture(handleResponse(response, target));
                } catch (ServiceClientException ex) {
                    return CompletableFuture.failedFuture(ex);
                }
            })
            .thenCompose(Function.identity());
    }

    private JsonNode handleResponse(HttpResponseData response, String target) {
        int status = response.getStatusCode();
        String body = response.getBody();
        if (response.isSuccessful()) {
            if (!response.hasBody()) {
                return NullNode.getInstance();
            }
            try {
                return objectMapper.readTree(body);
            } catch (JsonProcessingException ex) {
                throw new ServiceClientException("Invalid JSON response from " + target, null, ex);
            }
        }
        if (response.isClientError()) {
            throw parseClientError(status, body);
        }
        throw new ServiceUnavailableException(target, "Service returned " + status + ": " + body);
    }

    private ServiceClientException parseClientError(int status, String body) {
        try {
            JsonNode error = body == null ? null : objectMapper.readTree(body).get("error");
            if (error != null && error.isObject()) {
                JsonNode correlationId = error.get("correlation_id");
                return new GatewayErrorResponseException(
                    error.path("type").asText("Unknown"),
                    error.path("message").asText("Unknown error"),
                    correlationId == null || correlationId.isNull() ? null : correlationId.asText(),
                    status);
            }
        } catch (JsonProcessingException ex) {
            log.debug("Gateway error body is not JSON: {}", ex.getOriginalMessage());
        }
        return new ServiceClientException("Client error " + status + ": " + body, status);
    }

    private ServiceClientException mapTransportFailure(Throwable error, ServiceRequest request, Duration timeout) {
        if (error instanceof ServiceClientException) {
            return (ServiceClientException) error;
        }
        if (error instanceof HttpTimeoutException) {
            return new RequestTimeoutException(request.getTargetService(), request.getEndpoint(), timeout, error);
        }
        return new ServiceUnavailableException(request.getTargetService(),
            error.getClass().getSimpleName() + ": " + error.getMessage(), error);
    }

    private TransportRequest buildTransportRequest(ServiceRequest request, String requestId) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Service-Name", properties.getServiceName());
        headers.put("X-Service-Token", properties.getServiceToken());
        headers.put("X-Request-ID", requestId);
        headers.put("Content-Type", "application/json");
        if (request.getHeaders() != null) {
            headers.putAll(request.getHeaders());
        }

        String body = null;
        if (request.getMethod() != HttpMethod.GET && request.getData() != null) {
            try {
                body = objectMapper.writeValueAsString(request.getData());
            } catch (JsonProcessingException ex) {
                throw new ServiceClientException("Request body for " + request.getTargetService()
                    + " is not serializable", null, ex);
            }
        }

        Duration timeout = request.getTimeout() != null
            ? request.getTimeout()
            : properties.timeoutFor(request.getTargetService());
        return new TransportRequest(request.getMethod(), buildUri(request), headers, body, timeout);
    }

    URI buildUri(ServiceRequest request) {
        String target = request.getTargetService();
        if (target == null || target.isBlank() || target.contains("/")) {
            throw new ServiceDiscoveryException(target, "target service must be a non-empty name without '/'");
        }
        String endpoint = request.getEndpoint() == null ? "" : request.getEndpoint();
        if (!endpoint.startsWith("/")) {
            endpoint = "/" + endpoint;
        }
        StringBuilder url = new StringBuilder(gatewayUrl).append("/gateway/").append(target).append(endpoint);
        if (request.getParams() != null && !request.getParams().isEmpty()) {
            url.append('?').append(request.getParams().entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(String.valueOf(entry.getValue())))
                .collect(Collectors.joining("&")));
        }
        try {
            return URI.create(url.toString());
        } catch (IllegalArgumentException ex) {
            throw new ServiceDiscoveryException(target, "invalid endpoint '" + request.getEndpoint() + "'");
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static <T> CompletableFuture<T> invokeSafely(Supplier<CompletableFuture<T>> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private static final class InFlightCall {
        private volatile boolean cancelled;
        private volatile CompletableFuture<?> result;
        private volatile CompletableFuture<?> transportCall;

        boolean isCancelled() {
            return cancelled;
        }

        <T> CompletableFuture<T> track(CompletableFuture<T> call) {
            transportCall = call;
            if (cancelled) {
                call.cancel(true);
            }
            return call;
        }

        void cancel() {
            cancelled = true;
            CompletableFuture<?> pending = transportCall;
            if (pending != null) {
                pending.cancel(true);
            }
            if (result != null) {
                result.cancel(true);
            }
        }
    }
}
