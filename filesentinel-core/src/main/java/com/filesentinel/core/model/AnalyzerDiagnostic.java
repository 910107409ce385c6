package com.filesentinel.core.model;

/**
 * Note left in a scan result when an analyzer failed and contributed nothing.
 */
public record AnalyzerDiagnostic(String analyzerId, String message) {
}
