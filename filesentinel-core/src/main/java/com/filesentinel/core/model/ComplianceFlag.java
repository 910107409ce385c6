package com.filesentinel.core.model;

/**
 * A regulation implicated by the PII found in a file. Text and severity come
 * from a static lookup, never from the scan itself.
 */
public record ComplianceFlag(ComplianceRegulation regulation, String requirement,
        boolean violated, Severity severity, String remediation) {
}
