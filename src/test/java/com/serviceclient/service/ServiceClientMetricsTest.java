package com.serviceclient.service;

import com.serviceclient.exception.CircuitOpenException;
import com.serviceclient.model.MetricsSnapshot;
import com.serviceclient.service.ServiceClientProperties.CircuitBreakerSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class ServiceClientMetricsTest {
    private SimpleMeterRegistry registry;
    private ServiceClientMetrics metrics;

    @BeforeEach
    void setup() {
        registry = new SimpleMeterRegistry();
        metrics = new ServiceClientMetrics("checkout", registry);
    }

    @Test
    void emptySnapshotHasNoDerivedValues() {
        MetricsSnapshot snapshot = metrics.snapshot();

        assertThat(snapshot.getRequestsTotal()).isZero();
        assertThat(snapshot.getLatencyP50()).isNull();
        assertThat(snapshot.getSuccessRate()).isNull();
        assertThat(snapshot.getCacheHitRate()).isNull();
    }

    @Test
    void ratesAreDerivedFromTotals() {
        for (int i = 0; i < 4; i++) {
            metrics.recordRequest("orders", "GET");
        }
        metrics.recordSuccess("orders", "GET", Duration.ofMillis(100));
        metrics.recordSuccess("orders", "GET", Duration.ofMillis(300));
        metrics.recordSuccess("orders", "GET", Duration.ofMillis(200));
        metrics.recordFailure("orders", "GET", new CircuitOpenException("orders", "orders-circuit"));
        metrics.recordCacheHit("orders");
        metrics.recordCacheMiss("orders");
        metrics.recordCacheMiss("orders");
        metrics.recordCacheMiss("orders");

        MetricsSnapshot snapshot = metrics.snapshot();

        assertThat(snapshot.getSuccessRate()).isEqualTo(0.75);
        assertThat(snapshot.getErrorRate()).isEqualTo(0.25);
        assertThat(snapshot.getCacheHitRate()).isEqualTo(0.25);
        assertThat(snapshot.getLatencyP50()).isCloseTo(0.2, within(1e-9));
        assertThat(snapshot.getLatencyAvg()).isCloseTo(0.2, within(1e-9));
        assertThat(snapshot.getLatencyP99()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void latencyWindowKeepsMostRecentSamples() {
        for (int i = 0; i < 1000; i++) {
            metrics.recordSuccess("orders", "GET", Duration.ofSeconds(10));
        }
        for (int i = 0; i < 1000; i++) {
            metrics.recordSuccess("orders", "GET", Duration.ofMillis(1));
        }

        MetricsSnapshot snapshot = metrics.snapshot();

        assertThat(snapshot.getRequestsSuccess()).isEqualTo(2000);
        assertThat(snapshot.getLatencyP99()).isCloseTo(0.001, within(1e-9));
        assertThat(snapshot.getLatencyAvg()).isCloseTo(0.001, within(1e-9));
    }

    @Test
    void percentilesUseSortedIndex() {
        for (int i = 1; i <= 100; i++) {
            metrics.recordSuccess("orders", "GET", Duration.ofMillis(i));
        }

        MetricsSnapshot snapshot = metrics.snapshot();

        assertThat(snapshot.getLatencyP50()).isCloseTo(0.051, within(1e-9));
        assertThat(snapshot.getLatencyP95()).isCloseTo(0.096, within(1e-9));
        assertThat(snapshot.getLatencyP99()).isCloseTo(0.100, within(1e-9));
    }

    @Test
    void publishesTaggedMeters() {
        metrics.recordRequest("orders", "GET");
        metrics.recordFailure("orders", "GET", new CircuitOpenException("orders", "orders-circuit"));
        metrics.recordCircuitOpen("orders-circuit");
        metrics.recordRetry("orders");

        assertThat(registry.get("requests_total").tag("service", "checkout").tag("target", "orders")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("requests_failed").tag("status", "circuitopenexception").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get("circuit_opens").tag("circuit", "orders-circuit").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("retries_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void circuitGaugeFollowsBreakerState() {
        CircuitBreakerSettings settings = new CircuitBreakerSettings();
        settings.setFailureThreshold(1);
        CircuitBreaker breaker = new CircuitBreaker("orders-circuit", settings, null, Duration.ofSeconds(10),
            Clock.systemUTC());
        metrics.registerCircuit(breaker);

        assertThat(registry.get("circuit_state").tag("circuit", "orders-circuit").gauge().value()).isZero();
        breaker.recordFailure();
        assertThat(registry.get("circuit_state").tag("circuit", "orders-circuit").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void resetClearsTotalsAndMeters() {
        metrics.recordRequest("orders", "GET");
        metrics.recordSuccess("orders", "GET", Duration.ofMillis(5));

        metrics.reset();

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.getRequestsTotal()).isZero();
        assertThat(snapshot.getLatencyP50()).isNull();
        assertThat(registry.find("requests_total").counter()).isNull();
        assertThat(registry.find("request_latency").timer()).isNull();

        metrics.recordRequest("orders", "GET");
        assertThat(registry.get("requests_total").counter().count()).isEqualTo(1.0);
    }
}
