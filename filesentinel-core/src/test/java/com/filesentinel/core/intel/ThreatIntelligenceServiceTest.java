package com.filesentinel.core.intel;

import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.model.HashAlgorithm;
import com.filesentinel.core.model.MalwareHash;
import com.filesentinel.core.model.PiiPattern;
import com.filesentinel.core.model.Severity;
import com.filesentinel.core.model.ThreatSignature;
import com.filesentinel.core.model.ThreatType;
import com.filesentinel.core.store.InMemoryReferenceDataCache;
import com.filesentinel.core.store.ReferenceDataCache;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.filesentinel.core.support.TestFixtures.properties;
import static com.filesentinel.core.support.TestFixtures.signature;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ThreatIntelligenceServiceTest {

    private final FileSentinelProperties properties = properties();

    @Test
    void snapshotIsCachedBetweenCalls() {
        ThreatIntelligenceService service = new ThreatIntelligenceService(
                new InMemoryThreatIntelligenceRepository(), new InMemoryReferenceDataCache(), properties);

        ThreatIntelligence first = service.current();

        assertSame(first, service.current());
        assertEquals("1.0.0", first.getVersion());
        assertEquals(9, first.getSignatures().size());
    }

    @Test
    void refreshPicksUpRepositoryChanges() {
        InMemoryThreatIntelligenceRepository repository = new InMemoryThreatIntelligenceRepository();
        ThreatIntelligenceService service = new ThreatIntelligenceService(repository,
                new InMemoryReferenceDataCache(), properties);
        ThreatIntelligence before = service.current();

        repository.upsertSignature(signature("custom_001", ThreatType.PHISHING, Severity.MEDIUM, 60));
        assertSame(before, service.current());

        ThreatIntelligence after = service.refresh();
        assertNotEquals(before.getVersion(), after.getVersion());
        assertEquals(before.getSignatures().size() + 1, after.getSignatures().size());
        assertSame(after, service.current());
    }

    @Test
    void failedReloadServesPreviousSnapshot() {
        AtomicBoolean broken = new AtomicBoolean();
        InMemoryThreatIntelligenceRepository repository = new InMemoryThreatIntelligenceRepository() {
            @Override
            public synchronized List<ThreatSignature> findSignatures() {
                if (broken.get())
                    throw new IllegalStateException("database unavailable");
                return super.findSignatures();
            }
        };
        ReferenceDataCache cache = new InMemoryReferenceDataCache();
        ThreatIntelligenceService service = new ThreatIntelligenceService(repository, cache, properties);
        ThreatIntelligence loaded = service.current();

        broken.set(true);
        cache.invalidate(ThreatIntelligenceService.CACHE_KEY);

        assertSame(loaded, service.current());
    }

    @Test
    void firstLoadFailurePropagates() {
        InMemoryThreatIntelligenceRepository repository = new InMemoryThreatIntelligenceRepository() {
            @Override
            public synchronized List<PiiPattern> findPiiPatterns() {
                throw new IllegalStateException("database unavailable");
            }
        };
        ThreatIntelligenceService service = new ThreatIntelligenceService(repository,
                new InMemoryReferenceDataCache(), properties);

        assertThrows(IllegalStateException.class, service::current);
    }

    @Test
    void hashLookupIsCaseInsensitiveAndAlgorithmScoped() {
        ThreatIntelligence intelligence = new ThreatIntelligenceService(new InMemoryThreatIntelligenceRepository(),
                new InMemoryReferenceDataCache(), properties).current();
        MalwareHash eicar = intelligence.getMalwareHashes().stream()
                .filter(h -> h.algorithm() == HashAlgorithm.MD5).findFirst().orElseThrow();

        assertNotNull(intelligence.findHash(HashAlgorithm.MD5, eicar.hash().toUpperCase(Locale.ROOT)));
        assertNull(intelligence.findHash(HashAlgorithm.SHA1, eicar.hash()));
    }
}
