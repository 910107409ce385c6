package com.filesentinel.core.model;

import java.util.List;

/**
 * Structured payload of a {@link ThreatResponse}.
 */
public record ThreatResponseDetails(FileDescriptor originalFile, ProcessedFile processedFile,
        List<NotificationRecord> notifications, QuarantineRecord quarantine,
        String escalationTicketId) {

    public ThreatResponseDetails {
        notifications = notifications != null ? List.copyOf(notifications) : List.of();
    }

    public static ThreatResponseDetails of(FileDescriptor originalFile) {
        return new ThreatResponseDetails(originalFile, null, List.of(), null, null);
    }

    public ThreatResponseDetails withOriginalFile(FileDescriptor file) {
        return new ThreatResponseDetails(file, processedFile, notifications, quarantine, escalationTicketId);
    }

    public ThreatResponseDetails withProcessedFile(ProcessedFile file) {
        return new ThreatResponseDetails(originalFile, file, notifications, quarantine, escalationTicketId);
    }

    public ThreatResponseDetails withNotifications(List<NotificationRecord> records) {
        return new ThreatResponseDetails(originalFile, processedFile, records, quarantine, escalationTicketId);
    }

    public ThreatResponseDetails withQuarantine(QuarantineRecord record) {
        return new ThreatResponseDetails(originalFile, processedFile, notifications, record, escalationTicketId);
    }

    public ThreatResponseDetails withEscalationTicket(String ticketId) {
        return new ThreatResponseDetails(originalFile, processedFile, notifications, quarantine, ticketId);
    }
}
