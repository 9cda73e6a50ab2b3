package com.serviceclient.cache;

import com.serviceclient.model.CacheStats;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

@Component
public class RedisCacheStore implements CacheStore {
    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;

    public RedisCacheStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public List<String> scan(String pattern) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        }
        return keys;
    }

    @Override
    public void delete(Collection<String> keys) {
        if (!keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }

    @Override
    public void flush() {
        redisTemplate.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushDb();
            return null;
        });
    }

    @Override
    public CacheStats stats() {
        Properties info = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info());
        Long entries = redisTemplate.execute((RedisCallback<Long>) RedisCacheStore::dbSize);
        long usedMemory = longProperty(info, "used_memory");
        long hits = longProperty(info, "keyspace_hits");
        long misses = longProperty(info, "keyspace_misses");
        double hitRate = hits + misses == 0 ? 0 : (double) hits / (hits + misses);
        return new CacheStats(entries == null ? 0 : entries, usedMemory / (1024.0 * 1024.0), hitRate, true);
    }

    @Override
    public boolean ping() {
        return "PONG".equalsIgnoreCase(redisTemplate.execute((RedisCallback<String>) RedisConnection::ping));
    }

    private static Long dbSize(RedisConnection connection) {
        return connection.serverCommands().dbSize();
    }

    private static long longProperty(Properties info, String name) {
        if (info == null) {
            return 0;
        }
        String value = info.getProperty(name);
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }
}
