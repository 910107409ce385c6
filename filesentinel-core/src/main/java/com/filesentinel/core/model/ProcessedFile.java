package com.filesentinel.core.model;

import java.util.List;

/**
 * A derived copy (e.g. the sanitized version) written next to the original.
 */
public record ProcessedFile(String name, long size, String sha256, String location,
        List<String> modifications) {

    public ProcessedFile {
        modifications = List.copyOf(modifications);
    }
}
