package com.serviceclient.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.serviceclient.model.BatchResult;
import com.serviceclient.model.CacheStats;
import com.serviceclient.model.CircuitBreakerSnapshot;
import com.serviceclient.model.MetricsSnapshot;
import com.serviceclient.model.ServiceRequest;
import com.serviceclient.service.ServiceClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api")
@Tag(name = "Service Client API", description = "Call other services through the gateway and manage resilience state")
public class ServiceClientController {
    private final ServiceClient client;

    public ServiceClientController(ServiceClient client) {
        this.client = client;
    }

    @PostMapping("/calls")
    @Operation(summary = "Call a service through the gateway",
               description = "Applies circuit breaker, cache (GET only) and retry as requested")
    @ApiResponse(responseCode = "200", description = "Decoded response body")
    @ApiResponse(responseCode = "503", description = "Circuit open for the target service")
    @ApiResponse(responseCode = "502", description = "Target unavailable or retries exhausted")
    public CompletableFuture<ResponseEntity<JsonNode>> call(@Valid @RequestBody ServiceRequest request) {
        return client.call(request).thenApply(ResponseEntity::ok);
    }

    @PostMapping("/calls/batch")
    @Operation(summary = "Call several services concurrently",
               description = "Results follow request order; failures are reported per entry")
    @ApiResponse(responseCode = "200", description = "One result per request")
    public CompletableFuture<ResponseEntity<List<BatchResult>>> batchCall(@RequestBody List<ServiceRequest> requests) {
        return client.batchCall(requests).thenApply(ResponseEntity::ok);
    }

    @GetMapping("/circuits/{targetService}")
    @Operation(summary = "Get circuit breaker state for a target service")
    @ApiResponse(responseCode = "200", description = "Circuit breaker snapshot")
    public ResponseEntity<CircuitBreakerSnapshot> getCircuit(@PathVariable String targetService) {
        return ResponseEntity.ok(client.getCircuitSnapshot(targetService));
    }

    @PostMapping("/circuits/{targetService}/reset")
    @Operation(summary = "Force a target's circuit back to CLOSED")
    @ApiResponse(responseCode = "200", description = "Circuit reset")
    public ResponseEntity<CircuitBreakerSnapshot> resetCircuit(@PathVariable String targetService) {
        client.resetCircuit(targetService);
        return ResponseEntity.ok(client.getCircuitSnapshot(targetService));
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Clear cached responses",
               description = "Clears one target service's entries, or everything when targetService is omitted")
    @ApiResponse(responseCode = "204", description = "Cache cleared")
    public ResponseEntity<Void> clearCache(@RequestParam(required = false) String targetService) {
        client.clearCache(targetService);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/cache/stats")
    @Operation(summary = "Get cache store statistics")
    @ApiResponse(responseCode = "200", description = "Cache statistics")
    public ResponseEntity<CacheStats> getCacheStats() {
        return ResponseEntity.ok(client.getCacheStats());
    }

    @GetMapping("/metrics")
    @Operation(summary = "Get client metrics snapshot")
    @ApiResponse(responseCode = "200", description = "Counters, rates and latency percentiles")
    public ResponseEntity<MetricsSnapshot> getMetrics() {
        return ResponseEntity.ok(client.getMetrics());
    }

    @PostMapping("/metrics/reset")
    @Operation(summary = "Reset client metrics")
    @ApiResponse(responseCode = "204", description = "Metrics reset")
    public ResponseEntity<Void> resetMetrics() {
        client.resetMetrics();
        return ResponseEntity.noContent().build();
    }
}
