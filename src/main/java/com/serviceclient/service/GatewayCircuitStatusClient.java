package com.serviceclient.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.serviceclient.model.CircuitState;
import com.serviceclient.transport.HttpResponseData;
import com.serviceclient.transport.HttpTransport;
import com.serviceclient.transport.TransportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public class GatewayCircuitStatusClient {
    private static final Logger log = LoggerFactory.getLogger(GatewayCircuitStatusClient.class);

    private final HttpTransport transport;
    private final ObjectMapper objectMapper;
    private final String gatewayUrl;
    private final String serviceToken;
    private final Duration timeout;

    public GatewayCircuitStatusClient(HttpTransport transport, ObjectMapper objectMapper, String gatewayUrl,
                                      String serviceToken, Duration timeout) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.gatewayUrl = stripTrailingSlash(gatewayUrl);
        this.serviceToken = serviceToken;
        this.timeout = timeout;
    }

    public CompletableFuture<Optional<CircuitState>> fetchState(String circuitName) {
        CompletableFuture<HttpResponseData> response;
        try {
            URI uri = URI.create(gatewayUrl + "/internal/circuit-breaker/status/"
                + URLEncoder.encode(circuitName, StandardCharsets.UTF_8));
            response = transport.execute(TransportRequest.get(uri, Map.of("X-Service-Token", serviceToken), timeout));
        } catch (RuntimeException ex) {
            response = CompletableFuture.failedFuture(ex);
        }
        return response
            .thenApply(this::parseState)
            .completeOnTimeout(Optional.empty(), timeout.toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(ex -> {
                log.debug("Skipping gateway reconciliation for {}: {}", circuitName, ex.toString());
                return Optional.empty();
            });
    }

    private Optional<CircuitState> parseState(HttpResponseData response) {
        if (response.getStatusCode() != 200 || !response.hasBody()) {
            return Optional.empty();
        }
        try {
            JsonNode state = objectMapper.readTree(response.getBody()).path("state");
            if ("OPEN".equals(state.asText())) {
                return Optional.of(CircuitState.OPEN);
            }
            if ("CLOSED".equals(state.asText())) {
                return Optional.of(CircuitState.CLOSED);
            }
            return Optional.empty();
        } catch (Exception ex) {
            log.debug("Unreadable gateway circuit status: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
