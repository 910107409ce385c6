package com.filesentinel.core.store;

import java.time.Duration;

/**
 * Key-value cache for reference data (threat intelligence snapshots).
 * Implementations: a shared KV store (production) or InMemory (dev/testing).
 */
public interface ReferenceDataCache {

    /**
     * Cached value for the key, or null when absent, expired or of another type.
     */
    <T> T get(String key, Class<T> type);

    /**
     * Store a value. Expires after {@code ttl}; null means never.
     */
    void put(String key, Object value, Duration ttl);

    void invalidate(String key);
}
