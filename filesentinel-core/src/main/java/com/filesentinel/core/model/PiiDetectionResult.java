package com.filesentinel.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one PII scan. Immutable.
 */
public final class PiiDetectionResult {

    private final String scanId;
    private final String fileId;
    private final String fileName;
    private final List<PiiFinding> findings;
    private final DataClassification classification;
    private final DataHandling recommendedHandling;
    private final List<ComplianceFlag> complianceFlags;
    private final Instant scanTimestamp;

    public PiiDetectionResult(String scanId, String fileId, String fileName, List<PiiFinding> findings,
            DataClassification classification, DataHandling recommendedHandling,
            List<ComplianceFlag> complianceFlags, Instant scanTimestamp) {
        this.scanId = scanId;
        this.fileId = fileId;
        this.fileName = fileName;
        this.findings = List.copyOf(findings);
        this.classification = classification;
        this.recommendedHandling = recommendedHandling;
        this.complianceFlags = List.copyOf(complianceFlags);
        this.scanTimestamp = scanTimestamp != null ? scanTimestamp : Instant.now();
    }

    public String getScanId() {
        return scanId;
    }

    public String getFileId() {
        return fileId;
    }

    public String getFileName() {
        return fileName;
    }

    public List<PiiFinding> getFindings() {
        return findings;
    }

    public DataClassification getClassification() {
        return classification;
    }

    public DataHandling getRecommendedHandling() {
        return recommendedHandling;
    }

    public List<ComplianceFlag> getComplianceFlags() {
        return complianceFlags;
    }

    public Instant getScanTimestamp() {
        return scanTimestamp;
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public boolean hasCriticalFinding() {
        return findings.stream().anyMatch(f -> f.severity() == Severity.CRITICAL);
    }

    @Override
    public String toString() {
        return "PiiDetectionResult{file='" + fileName + "', findings=" + findings.size()
                + ", classification=" + classification + ", handling=" + recommendedHandling + '}';
    }
}
