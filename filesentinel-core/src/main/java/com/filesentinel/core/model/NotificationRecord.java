package com.filesentinel.core.model;

import java.time.Instant;

public record NotificationRecord(String recipient, NotificationMethod method, Instant timestamp,
        DeliveryStatus status, String message) {
}
