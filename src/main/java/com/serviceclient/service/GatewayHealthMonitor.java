package com.serviceclient.service;

import com.serviceclient.service.ServiceClientProperties.GatewayHealthCheck;
import com.serviceclient.transport.HttpTransport;
import com.serviceclient.transport.TransportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public class GatewayHealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(GatewayHealthMonitor.class);

    private final HttpTransport transport;
    private final URI healthUri;
    private final GatewayHealthCheck settings;
    private volatile boolean available = true;

    public GatewayHealthMonitor(HttpTransport transport, String gatewayUrl, GatewayHealthCheck settings) {
        this.transport = transport;
        this.healthUri = URI.create(GatewayCircuitStatusClient.stripTrailingSlash(gatewayUrl) + "/health");
        this.settings = settings;
    }

    public boolean isAvailable() {
        return available;
    }

    public CompletableFuture<Boolean> refresh() {
        if (!settings.isEnabled()) {
            return CompletableFuture.completedFuture(available);
        }
        CompletableFuture<Boolean> check;
        try {
            check = transport.execute(TransportRequest.get(healthUri, Map.of(), settings.getTimeout()))
                .thenApply(response -> response.getStatusCode() == 200);
        } catch (RuntimeException ex) {
            check = CompletableFuture.failedFuture(ex);
        }
        return check
            .completeOnTimeout(false, settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(ex -> false)
            .thenApply(this::update);
    }

    private boolean update(boolean live) {
        if (live != available) {
            if (live) {
                log.info("API gateway at {} is reachable again", healthUri);
            } else {
                log.warn("API gateway health check failed at {}, marking gateway unavailable", healthUri);
            }
        }
        available = live;
        return live;
    }
}
