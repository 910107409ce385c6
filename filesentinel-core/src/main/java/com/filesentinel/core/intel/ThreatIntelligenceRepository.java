package com.filesentinel.core.intel;

import com.filesentinel.core.model.MalwareHash;
import com.filesentinel.core.model.PiiPattern;
import com.filesentinel.core.model.ThreatSignature;

import java.util.List;

/**
 * Query side of the threat intelligence database.
 * Implementations: a relational store (production) or InMemory (dev/testing).
 */
public interface ThreatIntelligenceRepository {

    /**
     * Version of the current data set. Changes whenever any entry changes.
     */
    String getVersion();

    List<ThreatSignature> findSignatures();

    List<MalwareHash> findMalwareHashes();

    List<PiiPattern> findPiiPatterns();
}
