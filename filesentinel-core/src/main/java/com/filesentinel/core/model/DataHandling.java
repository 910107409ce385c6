package com.filesentinel.core.model;

/**
 * How a file carrying PII should be stored, if at all.
 */
public enum DataHandling {
    ALLOW,
    REDACT,
    ENCRYPT,
    REJECT,
    SECURE_STORAGE
}
