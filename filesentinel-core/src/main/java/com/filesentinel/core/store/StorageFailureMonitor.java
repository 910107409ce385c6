package com.filesentinel.core.store;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts collaborator write failures that were logged and swallowed, so they
 * stay visible to whoever scrapes them.
 */
public class StorageFailureMonitor {

    private final AtomicLong auditFailures = new AtomicLong();
    private final AtomicLong blobFailures = new AtomicLong();

    public void recordAuditFailure() {
        auditFailures.incrementAndGet();
    }

    public void recordBlobFailure() {
        blobFailures.incrementAndGet();
    }

    public long getAuditFailures() {
        return auditFailures.get();
    }

    public long getBlobFailures() {
        return blobFailures.get();
    }

    public long getTotalFailures() {
        return auditFailures.get() + blobFailures.get();
    }
}
