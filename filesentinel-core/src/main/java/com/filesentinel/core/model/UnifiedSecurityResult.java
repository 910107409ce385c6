package com.filesentinel.core.model;

import java.time.Instant;
import java.util.List;

/**
 * The single answer handed back to the upload pipeline.
 *
 * <p>
 * {@code piiResult} is null when PII detection is disabled or the scan failed
 * before it completed.
 * </p>
 */
public final class UnifiedSecurityResult {

    private final boolean success;
    private final String scanId;
    private final String fileId;
    private final Recommendation recommendation;
    private final ThreatDetectionResult threatResult;
    private final PiiDetectionResult piiResult;
    private final List<ThreatResponse> responses;
    private final String message;
    private final Instant timestamp;

    public UnifiedSecurityResult(boolean success, String scanId, String fileId,
            Recommendation recommendation, ThreatDetectionResult threatResult,
            PiiDetectionResult piiResult, List<ThreatResponse> responses, String message) {
        this.success = success;
        this.scanId = scanId;
        this.fileId = fileId;
        this.recommendation = recommendation;
        this.threatResult = threatResult;
        this.piiResult = piiResult;
        this.responses = List.copyOf(responses);
        this.message = message;
        this.timestamp = Instant.now();
    }

    public boolean isSuccess() {
        return success;
    }

    public String getScanId() {
        return scanId;
    }

    public String getFileId() {
        return fileId;
    }

    public Recommendation getRecommendation() {
        return recommendation;
    }

    public ThreatDetectionResult getThreatResult() {
        return threatResult;
    }

    public PiiDetectionResult getPiiResult() {
        return piiResult;
    }

    public List<ThreatResponse> getResponses() {
        return responses;
    }

    public List<ThreatAction> getExecutedActions() {
        return responses.stream().map(ThreatResponse::getAction).toList();
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "UnifiedSecurityResult{success=" + success + ", file='" + fileId
                + "', recommendation=" + recommendation + ", message='" + message + "'}";
    }
}
