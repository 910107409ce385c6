package com.filesentinel.core.model;

/**
 * One accepted PII match. {@code maskedValue} and {@code context} are already
 * masked; the raw value never leaves the matcher.
 */
public record PiiFinding(String id, PiiType type, String maskedValue, int confidence,
        ThreatLocation location, Severity severity, String patternId, String context) {
}
