package com.filesentinel.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only record of one executed (or failed) response action.
 */
public final class ThreatResponse implements AuditRecord {

    public enum Status {
        SUCCEEDED,
        FAILED
    }

    private final String id;
    private final String correlationId;
    private final ResponseOrigin origin;
    private final ThreatAction action;
    private final Status status;
    private final String failureMessage;
    private final Instant timestamp;
    private final boolean automated;
    private final String actor;
    private final String reason;
    private final ThreatResponseDetails details;

    private ThreatResponse(String correlationId, ResponseOrigin origin, ThreatAction action,
            Status status, String failureMessage, String actor, String reason,
            ThreatResponseDetails details) {
        this.id = UUID.randomUUID().toString();
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.action = Objects.requireNonNull(action, "action");
        this.status = status;
        this.failureMessage = failureMessage;
        this.timestamp = Instant.now();
        this.automated = true;
        this.actor = actor != null ? actor : "system";
        this.reason = reason;
        this.details = details;
    }

    public static ThreatResponse succeeded(String correlationId, ResponseOrigin origin,
            ThreatAction action, String actor, String reason, ThreatResponseDetails details) {
        return new ThreatResponse(correlationId, origin, action, Status.SUCCEEDED, null, actor,
                reason, details);
    }

    public static ThreatResponse failed(String correlationId, ResponseOrigin origin,
            ThreatAction action, String actor, String reason, ThreatResponseDetails details,
            String failureMessage) {
        return new ThreatResponse(correlationId, origin, action, Status.FAILED, failureMessage,
                actor, reason, details);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AuditRecordType getRecordType() {
        return AuditRecordType.THREAT_RESPONSE;
    }

    @Override
    public String getFileId() {
        return details != null && details.originalFile() != null ? details.originalFile().fileId() : null;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    /** Scan id shared by the threat and PII results this action answers to. */
    @Override
    public String getCorrelationId() {
        return correlationId;
    }

    public ResponseOrigin getOrigin() {
        return origin;
    }

    public ThreatAction getAction() {
        return action;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public boolean isAutomated() {
        return automated;
    }

    public String getActor() {
        return actor;
    }

    public String getReason() {
        return reason;
    }

    public ThreatResponseDetails getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "ThreatResponse{action=" + action + ", status=" + status + ", origin=" + origin
                + ", correlationId='" + correlationId + "'}";
    }
}
