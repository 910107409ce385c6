package com.filesentinel.core.model;

/**
 * Sensitivity tier of a file, derived from its most severe PII finding.
 */
public enum DataClassification {
    PUBLIC,
    INTERNAL,
    CONFIDENTIAL,
    RESTRICTED
}
