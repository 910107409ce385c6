package com.filesentinel.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Human follow-up ticket created by the escalate action. Separate from any
 * quarantine record.
 */
public final class EscalationTicket implements AuditRecord {

    public enum Status {
        OPEN
    }

    private final String id;
    private final String correlationId;
    private final String fileId;
    private final String fileName;
    private final Severity severity;
    private final int riskScore;
    private final int threatCount;
    private final int piiCount;
    private final DataClassification classification;
    private final String actor;
    private final Status status;
    private final Instant createdAt;

    public EscalationTicket(String correlationId, String fileId, String fileName, Severity severity,
            int riskScore, int threatCount, int piiCount, DataClassification classification,
            String actor) {
        this.id = UUID.randomUUID().toString();
        this.correlationId = correlationId;
        this.fileId = fileId;
        this.fileName = fileName;
        this.severity = severity;
        this.riskScore = riskScore;
        this.threatCount = threatCount;
        this.piiCount = piiCount;
        this.classification = classification;
        this.actor = actor;
        this.status = Status.OPEN;
        this.createdAt = Instant.now();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AuditRecordType getRecordType() {
        return AuditRecordType.ESCALATION_TICKET;
    }

    @Override
    public String getFileId() {
        return fileId;
    }

    @Override
    public Instant getTimestamp() {
        return createdAt;
    }

    @Override
    public String getCorrelationId() {
        return correlationId;
    }

    public String getFileName() {
        return fileName;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getRiskScore() {
        return riskScore;
    }

    public int getThreatCount() {
        return threatCount;
    }

    public int getPiiCount() {
        return piiCount;
    }

    public DataClassification getClassification() {
        return classification;
    }

    public String getActor() {
        return actor;
    }

    public Status getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "EscalationTicket{id='" + id + "', file='" + fileName + "', severity=" + severity
                + ", status=" + status + '}';
    }
}
