package com.example.filterengine.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache. Expired entries are dropped on read and by a periodic sweep.
 */
@Component
@ConditionalOnProperty(name = "app.cache.type", havingValue = "memory")
public class InMemoryCacheClient implements CacheClient {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCacheClient.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheClient() {
        this(Clock.systemUTC());
    }

    public InMemoryCacheClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.ofNullable((T) entry.value);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        Instant expiresAt = (ttl == null || ttl.isZero() || ttl.isNegative()) ? null : clock.instant().plus(ttl);
        entries.put(key, new Entry(value, expiresAt));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Scheduled(fixedDelayString = "${app.cache.cleanup-interval-ms:300000}", initialDelay = 60000L)
    public void evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            logger.debug("Evicted {} expired cache entries", removed);
        }
    }

    int size() {
        return entries.size();
    }

    private static final class Entry {
        final Object value;
        final Instant expiresAt;

        Entry(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
