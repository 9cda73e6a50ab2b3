package com.serviceclient.cache;

import com.serviceclient.model.CacheStats;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CacheStore {
    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    List<String> scan(String pattern);

    void delete(Collection<String> keys);

    void flush();

    CacheStats stats();

    boolean ping();
}
