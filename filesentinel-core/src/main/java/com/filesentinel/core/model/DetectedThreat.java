package com.filesentinel.core.model;

import java.util.Objects;

/**
 * One match produced during a scan. Discarded once the scan result has been
 * consumed; only the aggregate result is persisted.
 *
 * @param confidence per-match confidence, may differ from the signature default
 * @param definitive true only for exact known-malware hash matches
 */
public record DetectedThreat(String id, ThreatSignature signature, ThreatLocation location,
        int confidence, String context, String mitigation, boolean definitive) {

    public DetectedThreat {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(location, "location");
        mitigation = mitigation != null ? mitigation : signature.getType().mitigation();
    }

    /** A match that takes confidence and mitigation straight from its signature. */
    public static DetectedThreat of(String id, ThreatSignature signature, ThreatLocation location,
            String context) {
        return new DetectedThreat(id, signature, location, signature.getConfidence(), context,
                null, false);
    }

    public Severity severity() {
        return signature.getSeverity();
    }

    public ThreatType type() {
        return signature.getType();
    }
}
