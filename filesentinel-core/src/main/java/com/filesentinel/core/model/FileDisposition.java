package com.filesentinel.core.model;

/**
 * State the core signals to the storage collaborator for the original upload.
 */
public enum FileDisposition {
    STORED,
    QUARANTINED,
    BLOCKED,
    DELETED
}
