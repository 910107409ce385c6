package com.filesentinel.core.model;

/**
 * What the detection engine recommends doing with a scanned file.
 */
public enum Recommendation {
    ALLOW,
    WARN,
    SANITIZE,
    MANUAL_REVIEW,
    QUARANTINE,
    BLOCK
}
