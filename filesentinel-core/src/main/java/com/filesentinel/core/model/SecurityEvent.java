package com.filesentinel.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit event written for every scan, every detection and every failure.
 */
public final class SecurityEvent implements AuditRecord {

    public enum Type {
        THREAT_DETECTED,
        PII_DETECTED,
        MALWARE_BLOCKED,
        FILE_QUARANTINED,
        COMPLIANCE_VIOLATION,
        SCAN_FAILED,
        SYSTEM_ALERT
    }

    private final String id;
    private final Type type;
    private final Severity severity;
    private final String actor;
    private final String fileId;
    private final String correlationId;
    private final String description;
    private final Map<String, Object> context;
    private final Instant timestamp;

    public SecurityEvent(Type type, Severity severity, String actor, String fileId,
            String correlationId, String description, Map<String, Object> context) {
        this.id = UUID.randomUUID().toString();
        this.type = type;
        this.severity = severity;
        this.actor = actor;
        this.fileId = fileId;
        this.correlationId = correlationId;
        this.description = description;
        this.context = context != null ? Map.copyOf(context) : Map.of();
        this.timestamp = Instant.now();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AuditRecordType getRecordType() {
        return AuditRecordType.SECURITY_EVENT;
    }

    @Override
    public String getFileId() {
        return fileId;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    public Type getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getActor() {
        return actor;
    }

    @Override
    public String getCorrelationId() {
        return correlationId;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    @Override
    public String toString() {
        return "SecurityEvent{type=" + type + ", severity=" + severity + ", file='" + fileId
                + "', description='" + description + "'}";
    }
}
