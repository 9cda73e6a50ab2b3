package com.serviceclient.service;

import com.serviceclient.model.MetricsSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class ServiceClientMetrics {
    static final int LATENCY_WINDOW_SIZE = 1000;

    private final String serviceName;
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Meter> meters = new ConcurrentHashMap<>();

    private final AtomicLong requestsTotal = new AtomicLong();
    private final AtomicLong requestsSuccess = new AtomicLong();
    private final AtomicLong requestsFailed = new AtomicLong();
    private final AtomicLong circuitOpens = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong retriesTotal = new AtomicLong();
    private final LatencyWindow latencies = new LatencyWindow(LATENCY_WINDOW_SIZE);

    public ServiceClientMetrics(String serviceName, MeterRegistry registry) {
        this.serviceName = serviceName;
        this.registry = registry;
    }

    public void recordRequest(String targetService, String method) {
        requestsTotal.incrementAndGet();
        counter("requests_total", "target", targetService, "method", method).increment();
    }

    public void recordSuccess(String targetService, String method, Duration latency) {
        requestsSuccess.incrementAndGet();
        latencies.add(latency.toNanos() / 1_000_000_000.0);
        counter("requests_success", "target", targetService, "method", method, "status", "success").increment();
        timer(targetService, method).record(latency);
    }

    public void recordFailure(String targetService, String method, Throwable error) {
        requestsFailed.incrementAndGet();
        String status = error == null ? "unknown" : error.getClass().getSimpleName();
        counter("requests_failed", "target", targetService, "method", method, "status", status).increment();
    }

    public void recordCircuitOpen(String circuitName) {
        circuitOpens.incrementAndGet();
        counter("circuit_opens", "circuit", circuitName).increment();
    }

    public void recordCacheHit(String targetService) {
        cacheHits.incrementAndGet();
        counter("cache_hits", "target", targetService).increment();
    }

    public void recordCacheMiss(String targetService) {
        cacheMisses.incrementAndGet();
        counter("cache_misses", "target", targetService).increment();
    }

    public void recordRetry(String targetService) {
        retriesTotal.incrementAndGet();
        counter("retries_total", "target", targetService).increment();
    }

    public void registerCircuit(CircuitBreaker breaker) {
        Gauge.builder("circuit_state", breaker, b -> b.getState().getGaugeValue())
            .tag("service", safeTag(serviceName))
            .tag("circuit", safeTag(breaker.getName()))
            .register(registry);
    }

    public MetricsSnapshot snapshot() {
        MetricsSnapshot snapshot = new MetricsSnapshot();
        long total = requestsTotal.get();
        long hits = cacheHits.get();
        long misses = cacheMisses.get();
        snapshot.setRequestsTotal(total);
        snapshot.setRequestsSuccess(requestsSuccess.get());
        snapshot.setRequestsFailed(requestsFailed.get());
        snapshot.setCircuitOpens(circuitOpens.get());
        snapshot.setCacheHits(hits);
        snapshot.setCacheMisses(misses);
        snapshot.setRetriesTotal(retriesTotal.get());

        double[] sorted = latencies.toArray();
        if (sorted.length > 0) {
            Arrays.sort(sorted);
            snapshot.setLatencyP50(percentile(sorted, 0.50));
            snapshot.setLatencyP95(percentile(sorted, 0.95));
            snapshot.setLatencyP99(percentile(sorted, 0.99));
            snapshot.setLatencyAvg(Arrays.stream(sorted).average().orElse(0));
        }
        if (total > 0) {
            snapshot.setSuccessRate((double) requestsSuccess.get() / total);
            snapshot.setErrorRate((double) requestsFailed.get() / total);
        }
        if (hits + misses > 0) {
            snapshot.setCacheHitRate((double) hits / (hits + misses));
        }
        return snapshot;
    }

    /**
     * Zeroes the local totals, empties the latency window and drops the published counters and
     * timers. Circuit gauges stay registered since they read live breaker state.
     */
    public void reset() {
        requestsTotal.set(0);
        requestsSuccess.set(0);
        requestsFailed.set(0);
        circuitOpens.set(0);
        cacheHits.set(0);
        cacheMisses.set(0);
        retriesTotal.set(0);
        latencies.clear();
        meters.values().forEach(registry::remove);
        meters.clear();
    }

    private static double percentile(double[] sorted, double quantile) {
        int index = (int) (sorted.length * quantile);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    private Counter counter(String name, String... tags) {
        String cacheKey = name + "|" + String.join("|", tags);
        return (Counter) meters.computeIfAbsent(cacheKey, k -> {
            Counter.Builder builder = Counter.builder(name).tag("service", safeTag(serviceName));
            for (int i = 0; i + 1 < tags.length; i += 2) {
                builder.tag(tags[i], safeTag(tags[i + 1]));
            }
            return builder.register(registry);
        });
    }

    private Timer timer(String targetService, String method) {
        String cacheKey = "request_latency|" + targetService + "|" + method;
        return (Timer) meters.computeIfAbsent(cacheKey, k -> Timer.builder("request_latency")
            .tag("service", safeTag(serviceName))
            .tag("target", safeTag(targetService))
            .tag("method", safeTag(method))
            .register(registry));
    }

    private static String safeTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return "none";
        }
        String s = raw.trim();
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
