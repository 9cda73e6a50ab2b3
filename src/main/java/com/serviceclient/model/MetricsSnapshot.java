package com.serviceclient.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetricsSnapshot {
    private long requestsTotal;
    private long requestsSuccess;
    private long requestsFailed;
    private long circuitOpens;
    private long cacheHits;
    private long cacheMisses;
    private long retriesTotal;
    private Double latencyP50;
    private Double latencyP95;
    private Double latencyP99;
    private Double latencyAvg;
    private Double successRate;
    private Double errorRate;
    private Double cacheHitRate;

    public long getRequestsTotal() {
        return requestsTotal;
    }

    public void setRequestsTotal(long requestsTotal) {
        this.requestsTotal = requestsTotal;
    }

    public long getRequestsSuccess() {
        return requestsSuccess;
    }

    public void setRequestsSuccess(long requestsSuccess) {
        this.requestsSuccess = requestsSuccess;
    }

    public long getRequestsFailed() {
        return requestsFailed;
    }

    public void setRequestsFailed(long requestsFailed) {
        this.requestsFailed = requestsFailed;
    }

    public long getCircuitOpens() {
        return circuitOpens;
    }

    public void setCircuitOpens(long circuitOpens) {
        this.circuitOpens = circuitOpens;
    }

    public long getCacheHits() {
        return cacheHits;
    }

    public void setCacheHits(long cacheHits) {
        this.cacheHits = cacheHits;
    }

    public long getCacheMisses() {
        return cacheMisses;
    }

    public void setCacheMisses(long cacheMisses) {
        this.cacheMisses = cacheMisses;
    }

    public long getRetriesTotal() {
        return retriesTotal;
    }

    public void setRetriesTotal(long retriesTotal) {
        this.retriesTotal = retriesTotal;
    }

    public Double getLatencyP50() {
        return latencyP50;
    }

    public void setLatencyP50(Double latencyP50) {
        this.latencyP50 = latencyP50;
    }

    public Double getLatencyP95() {
        return latencyP95;
    }

    public void setLatencyP95(Double latencyP95) {
        this.latencyP95 = latencyP95;
    }

    public Double getLatencyP99() {
        return latencyP99;
    }

    public void setLatencyP99(Double latencyP99) {
        this.latencyP99 = latencyP99;
    }

    public Double getLatencyAvg() {
        return latencyAvg;
    }

    public void setLatencyAvg(Double latencyAvg) {
        this.latencyAvg = latencyAvg;
    }

    public Double getSuccessRate() {
        return successRate;
    }

    public void setSuccessRate(Double successRate) {
        this.successRate = successRate;
    }

    public Double getErrorRate() {
        return errorRate;
    }

    public void setErrorRate(Double errorRate) {
        this.errorRate = errorRate;
    }

    public Double getCacheHitRate() {
        return cacheHitRate;
    }

    public void setCacheHitRate(Double cacheHitRate) {
        this.cacheHitRate = cacheHitRate;
    }
}
