package com.filesentinel.core.intel;

import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.store.ReferenceDataCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out the current {@link ThreatIntelligence} snapshot.
 *
 * <p>
 * The snapshot lives in the {@link ReferenceDataCache} with a TTL. When it
 * expires, one caller reloads it from the repository while everybody else keeps
 * reading the previous snapshot. Only the very first load makes readers wait.
 * </p>
 */
public class ThreatIntelligenceService {

    private static final Logger log = LoggerFactory.getLogger(ThreatIntelligenceService.class);

    static final String CACHE_KEY = "filesentinel:threat-intelligence";

    private final ThreatIntelligenceRepository repository;
    private final ReferenceDataCache cache;
    private final FileSentinelProperties properties;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile ThreatIntelligence lastKnown;

    public ThreatIntelligenceService(ThreatIntelligenceRepository repository, ReferenceDataCache cache,
            FileSentinelProperties properties) {
        this.repository = repository;
        this.cache = cache;
        this.properties = properties;
    }

    /**
     * The snapshot scans should run against right now.
     */
    public ThreatIntelligence current() {
        ThreatIntelligence cached = cache.get(CACHE_KEY, ThreatIntelligence.class);
        if (cached != null)
            return cached;

        ThreatIntelligence stale = lastKnown;
        if (stale != null) {
            // Someone else is already reloading; serve the previous snapshot meanwhile
            if (!refreshLock.tryLock())
                return stale;
            try {
                return reloadIfMissing();
            } catch (RuntimeException e) {
                log.error("[FileSentinel] Threat intelligence reload failed, keeping {}: {}",
                        stale.getVersion(), e.getMessage());
                return stale;
            } finally {
                refreshLock.unlock();
            }
        }

        refreshLock.lock();
        try {
            return reloadIfMissing();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Drop the cached snapshot and load a fresh one from the repository.
     */
    public ThreatIntelligence refresh() {
        refreshLock.lock();
        try {
            cache.invalidate(CACHE_KEY);
            return load();
        } finally {
            refreshLock.unlock();
        }
    }

    private ThreatIntelligence reloadIfMissing() {
        ThreatIntelligence cached = cache.get(CACHE_KEY, ThreatIntelligence.class);
        if (cached != null)
            return cached;
        return load();
    }

    private ThreatIntelligence load() {
        ThreatIntelligence snapshot = new ThreatIntelligence(
                repository.getVersion(),
                repository.findSignatures(),
                repository.findMalwareHashes(),
                repository.findPiiPatterns());
        cache.put(CACHE_KEY, snapshot, properties.getIntelligence().getCacheTtl());
        lastKnown = snapshot;
        log.info("[FileSentinel] Loaded threat intelligence {}", snapshot);
        return snapshot;
    }
}
