package com.serviceclient.service;

import com.serviceclient.exception.InvalidConfigurationException;
import com.serviceclient.model.BackoffStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Component
@Validated
@ConfigurationProperties(prefix = "service-client")
public class ServiceClientProperties {
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    @NotBlank
    private String gatewayUrl;
    private Duration gatewayTimeout = Duration.ofSeconds(30);
    @NotBlank
    private String serviceName;
    @NotBlank
    private String serviceToken;
    private Duration gatewayStatusTimeout = Duration.ofSeconds(2);
    private Duration gatewaySyncInterval = Duration.ofSeconds(10);

    @Valid
    private GatewayHealthCheck gatewayHealthCheck = new GatewayHealthCheck();
    @Valid
    private CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();
    @Valid
    private Retry retry = new Retry();
    @Valid
    private Cache cache = new Cache();

    private Map<String, Duration> serviceTimeouts = new HashMap<>();
    private Map<String, CircuitBreakerSettings> circuitBreakers = new HashMap<>();

    /**
     * Checks the rules bean validation cannot express. Throws on the first violation.
     */
    public void validate() {
        requireText("gateway-url", gatewayUrl);
        if (!gatewayUrl.startsWith("http://") && !gatewayUrl.startsWith("https://")) {
            throw new InvalidConfigurationException("gateway-url", gatewayUrl,
                "gateway-url must start with http:// or https://");
        }
        requireText("service-name", serviceName);
        requireText("service-token", serviceToken);
        requirePositive("gateway-timeout", gatewayTimeout);
        requirePositive("gateway-status-timeout", gatewayStatusTimeout);
        requirePositive("gateway-sync-interval", gatewaySyncInterval);
        circuitBreaker.validate("circuit-breaker");
        for (Map.Entry<String, CircuitBreakerSettings> entry : circuitBreakers.entrySet()) {
            entry.getValue().validate("circuit-breakers." + entry.getKey());
        }
        for (Map.Entry<String, Duration> entry : serviceTimeouts.entrySet()) {
            requirePositive("service-timeouts." + entry.getKey(), entry.getValue());
        }
        retry.validate();
        requirePositive("cache.ttl", cache.getTtl());
        requirePositive("cache.reconnect-interval", cache.getReconnectInterval());
    }

    public CircuitBreakerSettings circuitBreakerFor(String targetService) {
        return circuitBreakers.getOrDefault(targetService, circuitBreaker);
    }

    public Duration timeoutFor(String targetService) {
        return serviceTimeouts.getOrDefault(targetService, DEFAULT_REQUEST_TIMEOUT);
    }

    private static void requireText(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException(key, value, key + " is required");
        }
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new InvalidConfigurationException(key, value, key + " must be a positive duration");
        }
    }

    private static void requireAtLeastOne(String key, int value) {
        if (value < 1) {
            throw new InvalidConfigurationException(key, value, key + " must be at least 1");
        }
    }

    public String getGatewayUrl() {
        return gatewayUrl;
    }

    public void setGatewayUrl(String gatewayUrl) {
        this.gatewayUrl = gatewayUrl;
    }

    public Duration getGatewayTimeout() {
        return gatewayTimeout;
    }

    public void setGatewayTimeout(Duration gatewayTimeout) {
        this.gatewayTimeout = gatewayTimeout;
    }

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getServiceToken() {
        return serviceToken;
    }

    public void setServiceToken(String serviceToken) {
        this.serviceToken = serviceToken;
    }

    public Duration getGatewayStatusTimeout() {
        return gatewayStatusTimeout;
    }

    public void setGatewayStatusTimeout(Duration gatewayStatusTimeout) {
        this.gatewayStatusTimeout = gatewayStatusTimeout;
    }

    public Duration getGatewaySyncInterval() {
        return gatewaySyncInterval;
    }

    public void setGatewaySyncInterval(Duration gatewaySyncInterval) {
        this.gatewaySyncInterval = gatewaySyncInterval;
    }

    public GatewayHealthCheck getGatewayHealthCheck() {
        return gatewayHealthCheck;
    }

    public void setGatewayHealthCheck(GatewayHealthCheck gatewayHealthCheck) {
        this.gatewayHealthCheck = gatewayHealthCheck;
    }

    public CircuitBreakerSettings getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreakerSettings circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Map<String, Duration> getServiceTimeouts() {
        return serviceTimeouts;
    }

    public void setServiceTimeouts(Map<String, Duration> serviceTimeouts) {
        this.serviceTimeouts = serviceTimeouts;
    }

    public Map<String, CircuitBreakerSettings> getCircuitBreakers() {
        return circuitBreakers;
    }

    public void setCircuitBreakers(Map<String, CircuitBreakerSettings> circuitBreakers) {
        this.circuitBreakers = circuitBreakers;
    }

    public static class GatewayHealthCheck {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);
        private Duration timeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class CircuitBreakerSettings {
        private int failureThreshold = 3;
        private Duration recoveryTimeout = Duration.ofSeconds(30);
        private int successThreshold = 2;
        // Carried for configuration compatibility; failures are counted consecutively, not per window.
        private Duration monitoringWindow = Duration.ofSeconds(60);

        void validate(String prefix) {
            requireAtLeastOne(prefix + ".failure-threshold", failureThreshold);
            requireAtLeastOne(prefix + ".success-threshold", successThreshold);
            requirePositive(prefix + ".recovery-timeout", recoveryTimeout);
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Duration getMonitoringWindow() {
            return monitoringWindow;
        }

        public void setMonitoringWindow(Duration monitoringWindow) {
            this.monitoringWindow = monitoringWindow;
        }
    }

    public static class Retry {
        private int maxAttempts = 5;
        private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);

        void validate() {
            requireAtLeastOne("retry.max-attempts", maxAttempts);
            requirePositive("retry.initial-delay", initialDelay);
            requirePositive("retry.max-delay", maxDelay);
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new InvalidConfigurationException("retry.max-delay", maxDelay,
                    "retry.max-delay must not be shorter than retry.initial-delay");
            }
            if (backoffStrategy == null) {
                throw new InvalidConfigurationException("retry.backoff-strategy", null);
            }
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public BackoffStrategy getBackoffStrategy() {
            return backoffStrategy;
        }

        public void setBackoffStrategy(BackoffStrategy backoffStrategy) {
            this.backoffStrategy = backoffStrategy;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofSeconds(60);
        private Duration reconnectInterval = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getReconnectInterval() {
            return reconnectInterval;
        }

        public void setReconnectInterval(Duration reconnectInterval) {
            this.reconnectInterval = reconnectInterval;
        }
    }
}
