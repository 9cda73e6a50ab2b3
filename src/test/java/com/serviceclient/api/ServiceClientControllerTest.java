package com.serviceclient.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.serviceclient.exception.CircuitOpenException;
import com.serviceclient.exception.GatewayErrorResponseException;
import com.serviceclient.exception.MaxRetriesExceededException;
import com.serviceclient.exception.RequestTimeoutException;
import com.serviceclient.exception.ServiceUnavailableException;
import com.serviceclient.model.BatchResult;
import com.serviceclient.model.CacheStats;
import com.serviceclient.model.CircuitBreakerSnapshot;
import com.serviceclient.model.CircuitState;
import com.serviceclient.model.HttpMethod;
import com.serviceclient.model.MetricsSnapshot;
import com.serviceclient.model.ServiceRequest;
import com.serviceclient.service.ServiceClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ServiceClientController.class)
public class ServiceClientControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ServiceClient client;

    @Autowired
    private ObjectMapper objectMapper;

    private ServiceRequest ordersRequest() {
        ServiceRequest request = new ServiceRequest("orders", "/orders/42", HttpMethod.GET);
        request.setTimeout(Duration.ofSeconds(2));
        return request;
    }

    private MvcResult startCall(Object body) throws Exception {
        return mockMvc.perform(post("/api/calls")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(request().asyncStarted())
            .andReturn();
    }

    @Test
    void callReturnsDecodedBody() throws Exception {
        when(client.call(any(ServiceRequest.class))).thenReturn(
            CompletableFuture.completedFuture(objectMapper.readTree("{\"id\":42,\"status\":\"shipped\"}")));

        mockMvc.perform(asyncDispatch(startCall(ordersRequest())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id", is(42)))
            .andExpect(jsonPath("$.status", is("shipped")));
    }

    @Test
    void isoTimeoutOverrideIsAccepted() throws Exception {
        when(client.call(any(ServiceRequest.class))).thenReturn(
            CompletableFuture.completedFuture(objectMapper.readTree("{}")));

        mockMvc.perform(post("/api/calls")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetService\":\"orders\",\"endpoint\":\"/orders/42\",\"timeout\":\"PT5S\"}"))
            .andExpect(request().asyncStarted());

        verify(client).call(argThat(sent -> Duration.ofSeconds(5).equals(sent.getTimeout())));
    }

    @Test
    void missingTargetIsRejected() throws Exception {
        ServiceRequest request = ordersRequest();
        request.setTargetService("");

        mockMvc.perform(post("/api/calls")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code", is("VALIDATION_ERROR")));

        verify(client, never()).call(any(ServiceRequest.class));
    }

    @Test
    void openCircuitMapsToServiceUnavailable() throws Exception {
        when(client.call(any(ServiceRequest.class))).thenReturn(
            CompletableFuture.failedFuture(new CircuitOpenException("orders", "orders-circuit")));

        mockMvc.perform(asyncDispatch(startCall(ordersRequest())))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.code", is("CIRCUIT_OPEN")))
            .andExpect(jsonPath("$.message", containsString("orders-circuit")));
    }

    @Test
    void exhaustedRetriesMapToBadGateway() throws Exception {
        when(client.call(any(ServiceRequest.class))).thenReturn(CompletableFuture.failedFuture(
            new MaxRetriesExceededException("orders", "/orders/42", 5,
                new ServiceUnavailableException("orders", "Service returned 500: boom"))));

        mockMvc.perform(asyncDispatch(startCall(ordersRequest())))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.code", is("UPSTREAM_UNAVAILABLE")));
    }

    @Test
    void timeoutMapsToGatewayTimeout() throws Exception {
        when(client.call(any(ServiceRequest.class))).thenReturn(CompletableFuture.failedFuture(
            new RequestTimeoutException("orders", "/orders/42", Duration.ofSeconds(2), null)));

        mockMvc.perform(asyncDispatch(startCall(ordersRequest())))
            .andExpect(status().isGatewayTimeout())
            .andExpect(jsonPath("$.code", is("TIMEOUT")));
    }

    @Test
    void gatewayClientErrorKeepsItsStatus() throws Exception {
        when(client.call(any(ServiceRequest.class))).thenReturn(CompletableFuture.failedFuture(
            new GatewayErrorResponseException("NotFound", "no such order", "c-9", 404)));

        mockMvc.perform(asyncDispatch(startCall(ordersRequest())))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code", is("NotFound")))
            .andExpect(jsonPath("$.message", containsString("c-9")));
    }

    @Test
    void batchReturnsResultPerRequest() throws Exception {
        when(client.batchCall(anyList())).thenReturn(CompletableFuture.completedFuture(List.of(
            BatchResult.success(objectMapper.readTree("{\"ok\":true}")),
            BatchResult.failure(new CircuitOpenException("billing", "billing-circuit")))));

        MvcResult started = mockMvc.perform(post("/api/calls/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(List.of(ordersRequest(), ordersRequest()))))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(started))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].success", is(true)))
            .andExpect(jsonPath("$[0].body.ok", is(true)))
            .andExpect(jsonPath("$[1].success", is(false)))
            .andExpect(jsonPath("$[1].errorType", is("CircuitOpenException")))
            .andExpect(jsonPath("$[1].error").doesNotExist());
    }

    @Test
    void getCircuitReturnsSnapshot() throws Exception {
        when(client.getCircuitSnapshot("orders")).thenReturn(new CircuitBreakerSnapshot("orders-circuit",
            CircuitState.OPEN, 3, 0, Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z")));

        mockMvc.perform(get("/api/circuits/orders"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name", is("orders-circuit")))
            .andExpect(jsonPath("$.state", is("OPEN")))
            .andExpect(jsonPath("$.failureCount", is(3)));
    }

    @Test
    void resetCircuitReturnsClosedSnapshot() throws Exception {
        when(client.getCircuitSnapshot("orders")).thenReturn(new CircuitBreakerSnapshot("orders-circuit",
            CircuitState.CLOSED, 0, 0, Instant.parse("2024-01-01T00:00:00Z"), null));

        mockMvc.perform(post("/api/circuits/orders/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state", is("CLOSED")));

        verify(client).resetCircuit("orders");
    }

    @Test
    void clearCacheForOneService() throws Exception {
        mockMvc.perform(delete("/api/cache").param("targetService", "orders"))
            .andExpect(status().isNoContent());

        verify(client).clearCache("orders");
    }

    @Test
    void clearWholeCache() throws Exception {
        mockMvc.perform(delete("/api/cache"))
            .andExpect(status().isNoContent());

        verify(client).clearCache(null);
    }

    @Test
    void cacheStatsAreExposed() throws Exception {
        when(client.getCacheStats()).thenReturn(new CacheStats(17, 1.5, 0.8, true));

        mockMvc.perform(get("/api/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalEntries", is(17)))
            .andExpect(jsonPath("$.enabled", is(true)));
    }

    @Test
    void metricsOmitUndefinedRates() throws Exception {
        MetricsSnapshot snapshot = new MetricsSnapshot();
        snapshot.setRequestsTotal(0);
        when(client.getMetrics()).thenReturn(snapshot);

        mockMvc.perform(get("/api/metrics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.requestsTotal", is(0)))
            .andExpect(jsonPath("$.successRate").doesNotExist());
    }

    @Test
    void resetMetrics() throws Exception {
        mockMvc.perform(post("/api/metrics/reset"))
            .andExpect(status().isNoContent());

        verify(client).resetMetrics();
    }
}
