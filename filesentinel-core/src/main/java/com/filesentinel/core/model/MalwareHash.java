package com.filesentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A known-malware digest from the threat intelligence feed.
 */
public record MalwareHash(String hash, HashAlgorithm algorithm, String malwareFamily,
        ThreatType threatType, Severity severity, String source, String description) {

    public MalwareHash {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(algorithm, "algorithm");
        hash = hash.toLowerCase(Locale.ROOT);
        threatType = threatType != null ? threatType : ThreatType.MALWARE;
        severity = severity != null ? severity : Severity.CRITICAL;
        source = source != null ? source : "internal";
    }
}
