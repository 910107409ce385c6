package com.filesentinel.core.intel;

import com.filesentinel.core.model.MalwareHash;
import com.filesentinel.core.model.PiiPattern;
import com.filesentinel.core.model.ThreatSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of ThreatIntelligenceRepository, seeded with the
 * built-in data set. Every upsert bumps the patch version so cached snapshots
 * can tell they are stale.
 */
public class InMemoryThreatIntelligenceRepository implements ThreatIntelligenceRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryThreatIntelligenceRepository.class);

    private final Map<String, ThreatSignature> signatures = new LinkedHashMap<>();
    private final Map<String, MalwareHash> hashes = new LinkedHashMap<>();
    private final Map<String, PiiPattern> piiPatterns = new LinkedHashMap<>();
    private int revision;

    public InMemoryThreatIntelligenceRepository() {
        this(BuiltInThreatIntelligence.signatures(), BuiltInThreatIntelligence.malwareHashes(),
                BuiltInThreatIntelligence.piiPatterns());
    }

    public InMemoryThreatIntelligenceRepository(List<ThreatSignature> signatures,
            List<MalwareHash> hashes, List<PiiPattern> piiPatterns) {
        signatures.forEach(s -> this.signatures.put(s.getId(), s));
        hashes.forEach(h -> this.hashes.put(hashKey(h), h));
        piiPatterns.forEach(p -> this.piiPatterns.put(p.getId(), p));
    }

    @Override
    public synchronized String getVersion() {
        return BuiltInThreatIntelligence.VERSION_PREFIX + revision;
    }

    @Override
    public synchronized List<ThreatSignature> findSignatures() {
        return List.copyOf(signatures.values());
    }

    @Override
    public synchronized List<MalwareHash> findMalwareHashes() {
        return List.copyOf(hashes.values());
    }

    @Override
    public synchronized List<PiiPattern> findPiiPatterns() {
        return List.copyOf(piiPatterns.values());
    }

    public synchronized void upsertSignature(ThreatSignature signature) {
        signatures.put(signature.getId(), signature);
        bump("signature " + signature.getId());
    }

    public synchronized void upsertMalwareHash(MalwareHash hash) {
        hashes.put(hashKey(hash), hash);
        bump("hash " + hash.algorithm() + ":" + hash.hash());
    }

    public synchronized void upsertPiiPattern(PiiPattern pattern) {
        piiPatterns.put(pattern.getId(), pattern);
        bump("PII pattern " + pattern.getId());
    }

    public synchronized boolean removeSignature(String signatureId) {
        if (signatures.remove(signatureId) == null)
            return false;
        bump("removed signature " + signatureId);
        return true;
    }

    private void bump(String change) {
        revision++;
        log.info("[FileSentinel] Threat intelligence updated to {} ({})", getVersion(), change);
    }

    private static String hashKey(MalwareHash hash) {
        return hash.algorithm() + ":" + hash.hash();
    }
}
