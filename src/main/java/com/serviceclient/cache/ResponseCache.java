package com.serviceclient.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.serviceclient.model.CacheStats;
import com.serviceclient.service.ServiceClientProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Memoizes successful GET responses and serves them as fallback when a call fails.
 *
 * <p>Nothing here ever fails the caller. When the store cannot be reached (at construction or on
 * any later operation) it is left alone for {@code cache.reconnect-interval}: every read is a
 * miss and every write is skipped without touching the store. After that the store is pinged once
 * before it is used again.
 */
public class ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final ServiceClientProperties.Cache settings;
    private final CacheStore store;
    private final ObjectMapper objectMapper;
    private final ObjectMapper keyMapper;
    private final Clock clock;
    private volatile Instant unavailableUntil;

    public ResponseCache(ServiceClientProperties.Cache settings, CacheStore store, ObjectMapper objectMapper,
                         Clock clock) {
        this.settings = settings;
        this.store = store;
        this.objectMapper = objectMapper;
        this.keyMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
        if (isEnabled() && !ping()) {
            markUnavailable("no answer to ping");
        }
    }

    public boolean isEnabled() {
        return settings.isEnabled() && store != null;
    }

    public boolean isStoreAvailable() {
        Instant until = unavailableUntil;
        if (until == null) {
            return true;
        }
        if (clock.instant().isBefore(until)) {
            return false;
        }
        if (ping()) {
            unavailableUntil = null;
            log.info("Cache store reachable again, caching resumed");
            return true;
        }
        markUnavailable("still unreachable");
        return false;
    }

    public String generateKey(String service, String endpoint, String method, Map<String, Object> params) {
        Map<String, Object> keyData = new TreeMap<>();
        keyData.put("service", service);
        keyData.put("endpoint", endpoint);
        keyData.put("method", method);
        keyData.put("params", params == null ? new TreeMap<>() : new TreeMap<>(params));
        String serialized;
        try {
            serialized = keyMapper.writeValueAsString(keyData);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Request parameters are not serializable", ex);
        }
        return "service:" + service + ":endpoint:" + endpoint + ":" + md5(serialized);
    }

    public Optional<JsonNode> get(String service, String endpoint, String method, Map<String, Object> params) {
        if (!isEnabled() || !isStoreAvailable()) {
            return Optional.empty();
        }
        String key;
        try {
            key = generateKey(service, endpoint, method, params);
        } catch (IllegalArgumentException ex) {
            log.debug("Skipping cache read for {}{}: {}", service, endpoint, ex.getMessage());
            return Optional.empty();
        }
        Optional<String> cached;
        try {
            cached = store.get(key);
        } catch (RuntimeException ex) {
            markUnavailable(ex.getMessage());
            return Optional.empty();
        }
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(cached.get()));
        } catch (JsonProcessingException ex) {
            log.debug("Ignoring corrupt cache entry {}", key);
            return Optional.empty();
        }
    }

    public void set(String service, String endpoint, String method, Map<String, Object> params, JsonNode data) {
        if (!isEnabled() || !isStoreAvailable()) {
            return;
        }
        String key;
        String value;
        try {
            key = generateKey(service, endpoint, method, params);
            value = objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Could not cache data for {}{}: {}", service, endpoint, ex.getMessage());
            return;
        }
        try {
            store.set(key, value, settings.getTtl());
        } catch (RuntimeException ex) {
            markUnavailable(ex.getMessage());
        }
    }

    /**
     * Removes every entry of one target service, or flushes the whole store when
     * {@code service} is null.
     */
    public void clear(String service) {
        if (!isEnabled() || !isStoreAvailable()) {
            return;
        }
        try {
            if (service != null) {
                List<String> keys = store.scan("service:" + service + ":*");
                store.delete(keys);
            } else {
                store.flush();
            }
        } catch (RuntimeException ex) {
            markUnavailable(ex.getMessage());
        }
    }

    public CacheStats stats() {
        if (!isEnabled() || !isStoreAvailable()) {
            return CacheStats.disabled();
        }
        try {
            return store.stats();
        } catch (RuntimeException ex) {
            markUnavailable(ex.getMessage());
            return CacheStats.disabled();
        }
    }

    private boolean ping() {
        try {
            return store.ping();
        } catch (RuntimeException ex) {
            return false;
        }
    }

    private void markUnavailable(String reason) {
        if (unavailableUntil == null) {
            log.warn("Cache store unreachable ({}), bypassing cache for {}", reason, settings.getReconnectInterval());
        }
        unavailableUntil = clock.instant().plus(settings.getReconnectInterval());
    }

    private static String md5(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 not available", ex);
        }
    }
}
