package com.filesentinel.core.model;

import java.util.Objects;

/**
 * What the upload pipeline tells us about a file besides its bytes.
 */
public record FileMetadata(String fileId, String fileName, String contentType, long size) {

    public FileMetadata {
        Objects.requireNonNull(fileId, "fileId");
        fileName = fileName != null ? fileName : fileId;
    }

    public static FileMetadata of(String fileId, String fileName, byte[] content) {
        return new FileMetadata(fileId, fileName, null, content.length);
    }
}
