package com.filesentinel.core.model;

/**
 * Threat severity tiers, ordered from least to most severe.
 */
public enum Severity {

    /** Informational only. Nothing to act on. */
    INFO,

    /** Slightly suspicious. Log and monitor. */
    LOW,

    /** Suspicious content that warrants a notification. */
    MEDIUM,

    /** Likely malicious. Quarantine territory. */
    HIGH,

    /** Confirmed malicious or critically sensitive. Must be blocked. */
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
