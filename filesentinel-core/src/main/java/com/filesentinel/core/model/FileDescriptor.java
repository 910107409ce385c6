package com.filesentinel.core.model;

/**
 * Identity of the uploaded file as seen by a response action.
 */
public record FileDescriptor(String fileId, String name, long size, String sha256,
        String location, FileDisposition disposition) {

    public FileDescriptor withLocation(String newLocation) {
        return new FileDescriptor(fileId, name, size, sha256, newLocation, disposition);
    }

    public FileDescriptor withDisposition(FileDisposition newDisposition) {
        return new FileDescriptor(fileId, name, size, sha256, location, newDisposition);
    }
}
