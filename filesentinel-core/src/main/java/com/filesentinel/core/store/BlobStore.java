package com.filesentinel.core.store;

import java.util.Map;

/**
 * Abstraction over the object storage holding uploaded files and their derived
 * copies (quarantined, sanitized).
 * Implementations: the deployment's object store, or InMemory (dev/testing).
 */
public interface BlobStore {

    /**
     * Write an object. Keys are never reused by FileSentinel, so an overwrite
     * means a caller bug rather than a retry.
     *
     * @param key      Storage key, e.g. {@code quarantine/<uuid>-invoice.pdf}
     * @param content  Object bytes
     * @param metadata Free-form string metadata stored with the object
     * @throws StorageException when the write did not happen
     */
    void put(String key, byte[] content, Map<String, String> metadata);

    /**
     * Read an object back. Returns null when the key is unknown.
     */
    byte[] get(String key);

    /**
     * Remove an object. Returns false when there was nothing to remove.
     */
    boolean delete(String key);
}
