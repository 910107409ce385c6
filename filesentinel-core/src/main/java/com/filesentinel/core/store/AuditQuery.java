package com.filesentinel.core.store;

import com.filesentinel.core.model.AuditRecord;
import com.filesentinel.core.model.AuditRecord.AuditRecordType;

import java.time.Instant;

/**
 * Filter for {@link AuditStore#query(AuditQuery)}. Unset criteria match
 * everything.
 */
public final class AuditQuery {

    private final String fileId;
    private final String correlationId;
    private final AuditRecordType recordType;
    private final Instant since;

    private AuditQuery(String fileId, String correlationId, AuditRecordType recordType, Instant since) {
        this.fileId = fileId;
        this.correlationId = correlationId;
        this.recordType = recordType;
        this.since = since;
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null);
    }

    public static AuditQuery forFile(String fileId) {
        return new AuditQuery(fileId, null, null, null);
    }

    public static AuditQuery forCorrelation(String correlationId) {
        return new AuditQuery(null, correlationId, null, null);
    }

    public AuditQuery ofType(AuditRecordType type) {
        return new AuditQuery(fileId, correlationId, type, since);
    }

    public AuditQuery since(Instant instant) {
        return new AuditQuery(fileId, correlationId, recordType, instant);
    }

    public boolean matches(AuditRecord record) {
        if (fileId != null && !fileId.equals(record.getFileId()))
            return false;
        if (correlationId != null && !correlationId.equals(record.getCorrelationId()))
            return false;
        if (recordType != null && recordType != record.getRecordType())
            return false;
        return since == null || !record.getTimestamp().isBefore(since);
    }

    public String getFileId() {
        return fileId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public AuditRecordType getRecordType() {
        return recordType;
    }

    public Instant getSince() {
        return since;
    }
}
