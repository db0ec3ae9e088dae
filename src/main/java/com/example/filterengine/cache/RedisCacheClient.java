package com.example.filterengine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed cache. Values are stored as JSON under {@code app.cache.key-prefix}
 * so {@link #clear()} only touches this service's keys.
 */
@Component
@ConditionalOnProperty(name = "app.cache.type", havingValue = "redis", matchIfMissing = true)
public class RedisCacheClient implements CacheClient {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheClient.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisCacheClient(StringRedisTemplate redis, ObjectMapper objectMapper,
                            @Value("${app.cache.key-prefix:filter-engine:}") String keyPrefix) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        String json = redis.opsForValue().get(keyPrefix + key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unreadable cache entry {}: {}", key, e.getOriginalMessage());
            redis.delete(keyPrefix + key);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for cache key " + key + " is not serializable", e);
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(keyPrefix + key, json);
        } else {
            redis.opsForValue().set(keyPrefix + key, json, ttl);
        }
    }

    @Override
    public void delete(String key) {
        redis.delete(keyPrefix + key);
    }

    @Override
    public void clear() {
        ScanOptions options = ScanOptions.scanOptions().match(keyPrefix + "*").count(500).build();
        List<String> keys = new ArrayList<>();
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            try (Cursor<byte[]> cursor = conn.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
        }
        if (!keys.isEmpty()) {
            redis.delete(keys);
        }
        logger.info("Cleared {} cache entries under prefix {}", keys.size(), keyPrefix);
    }
}
