package com.filesentinel.core.model;

public enum DeliveryStatus {
    SENT,
    FAILED,
    PENDING
}
