package com.filesentinel.core.store;

/**
 * Raised by a collaborator store when a read or write could not be completed.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
