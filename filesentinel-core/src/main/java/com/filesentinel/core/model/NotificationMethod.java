package com.filesentinel.core.model;

public enum NotificationMethod {
    EMAIL,
    WEBHOOK
}
