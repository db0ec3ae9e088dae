package com.example.filterengine.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value cache with per-entry TTL. One instance per process, injected where needed.
 */
public interface CacheClient {
    <T> Optional<T> get(String key, TypeReference<T> type);

    /**
     * @param ttl null, zero or negative means no expiry
     */
    void set(String key, Object value, Duration ttl);

    void delete(String key);

    void clear();
}
