package com.filesentinel.core.store;

import com.filesentinel.core.model.AuditRecord;

import java.util.List;

/**
 * Append-only store for security events, threat responses and escalation
 * tickets. Records are never updated or deleted.
 */
public interface AuditStore {

    /**
     * Append a record.
     *
     * @throws StorageException when the record was not persisted
     */
    void insert(AuditRecord record);

    /**
     * Records matching the query, oldest first.
     */
    List<AuditRecord> query(AuditQuery query);
}
