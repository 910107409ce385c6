package com.filesentinel.core.model;

/**
 * Who may read a quarantined file.
 */
public enum AccessLevel {
    ADMIN,
    SECURITY,
    USER
}
