package com.filesentinel.core.model;

import java.time.Instant;

/**
 * Anything appended to the audit store. Records are facts: never updated,
 * never deleted.
 */
public interface AuditRecord {

    String getId();

    AuditRecordType getRecordType();

    /** File the record is about, or null for system-wide events. */
    String getFileId();

    Instant getTimestamp();

    /** Scan id the record belongs to, or null for system-wide events. */
    String getCorrelationId();

    enum AuditRecordType {
        SECURITY_EVENT,
        THREAT_RESPONSE,
        ESCALATION_TICKET
    }
}
