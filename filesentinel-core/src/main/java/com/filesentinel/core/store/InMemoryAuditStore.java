package com.filesentinel.core.store;

import com.filesentinel.core.model.AuditRecord;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of AuditStore for development and testing.
 * Keeps records in insertion order.
 */
public class InMemoryAuditStore implements AuditStore {

    private final List<AuditRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void insert(AuditRecord record) {
        records.add(record);
    }

    @Override
    public List<AuditRecord> query(AuditQuery query) {
        return records.stream()
                .filter(query::matches)
                .toList();
    }

    public int size() {
        return records.size();
    }
}
