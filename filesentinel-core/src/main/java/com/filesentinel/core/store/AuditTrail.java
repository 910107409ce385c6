package com.filesentinel.core.store;

import com.filesentinel.core.model.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Front door to the audit store. A failed insert is logged and counted but
 * never propagated: an audit outage must not change a scan outcome.
 */
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private final AuditStore store;
    private final StorageFailureMonitor monitor;

    public AuditTrail(AuditStore store, StorageFailureMonitor monitor) {
        this.store = store;
        this.monitor = monitor;
    }

    /**
     * @return true when the record was persisted
     */
    public boolean record(AuditRecord record) {
        try {
            store.insert(record);
            return true;
        } catch (RuntimeException e) {
            monitor.recordAuditFailure();
            log.error("[FileSentinel] Failed to persist {} '{}' for file '{}': {}",
                    record.getRecordType(), record.getId(), record.getFileId(), e.getMessage());
            return false;
        }
    }

    public List<AuditRecord> history(String fileId) {
        return store.query(AuditQuery.forFile(fileId));
    }

    public List<AuditRecord> query(AuditQuery query) {
        return store.query(query);
    }

    public StorageFailureMonitor getMonitor() {
        return monitor;
    }
}
