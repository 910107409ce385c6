package com.filesentinel.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of BlobStore for development and single-instance
 * deployments.
 * Not suitable for production: everything is lost on restart.
 */
public class InMemoryBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBlobStore.class);

    private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();

    @Override
    public void put(String key, byte[] content, Map<String, String> metadata) {
        objects.put(key, new StoredObject(content.clone(),
                metadata != null ? Map.copyOf(metadata) : Map.of()));
        log.debug("[FileSentinel] Stored object '{}' ({} bytes)", key, content.length);
    }

    @Override
    public byte[] get(String key) {
        StoredObject object = objects.get(key);
        return object != null ? object.content.clone() : null;
    }

    @Override
    public boolean delete(String key) {
        return objects.remove(key) != null;
    }

    /** Metadata written with an object, or an empty map when the key is unknown. */
    public Map<String, String> getMetadata(String key) {
        StoredObject object = objects.get(key);
        return object != null ? object.metadata : Map.of();
    }

    /** All keys starting with the given prefix, e.g. {@code quarantine/}. */
    public List<String> keys(String prefix) {
        return objects.keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .sorted()
                .toList();
    }

    public int size() {
        return objects.size();
    }

    // --- Internal classes ---

    private static class StoredObject {
        final byte[] content;
        final Map<String, String> metadata;

        StoredObject(byte[] content, Map<String, String> metadata) {
            this.content = content;
            this.metadata = metadata;
        }
    }
}
