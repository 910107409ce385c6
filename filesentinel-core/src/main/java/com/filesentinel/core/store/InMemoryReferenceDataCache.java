package com.filesentinel.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ReferenceDataCache for development and
 * single-instance deployments.
 */
public class InMemoryReferenceDataCache implements ReferenceDataCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReferenceDataCache.class);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryReferenceDataCache() {
        this(Clock.systemUTC());
    }

    public InMemoryReferenceDataCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        CacheEntry entry = entries.get(key);
        if (entry == null)
            return null;
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return null;
        }
        if (!type.isInstance(entry.value)) {
            log.warn("[FileSentinel] Cache entry '{}' is a {}, expected {}",
                    key, entry.value.getClass().getSimpleName(), type.getSimpleName());
            return null;
        }
        return type.cast(entry.value);
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        Instant expiry = ttl != null ? clock.instant().plus(ttl) : Instant.MAX;
        entries.put(key, new CacheEntry(value, expiry));
    }

    @Override
    public void invalidate(String key) {
        entries.remove(key);
    }

    // --- Internal classes ---

    private static class CacheEntry {
        final Object value;
        final Instant expiry;

        CacheEntry(Object value, Instant expiry) {
            this.value = value;
            this.expiry = expiry;
        }

        boolean isExpired(Instant now) {
            return now.isAfter(expiry);
        }
    }
}
