package com.filesentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one threat scan. Immutable.
 */
public final class ThreatDetectionResult {

    private final String scanId;
    private final String fileId;
    private final String fileName;
    private final List<DetectedThreat> threats;
    private final int riskScore;
    private final Severity overallSeverity;
    private final Recommendation recommendation;
    private final Duration scanDuration;
    private final Instant scanTimestamp;
    private final String engineName;
    private final String engineVersion;
    private final String intelligenceVersion;
    private final List<AnalyzerDiagnostic> diagnostics;

    private ThreatDetectionResult(Builder builder) {
        this.scanId = builder.scanId;
        this.fileId = builder.fileId;
        this.fileName = builder.fileName;
        this.threats = List.copyOf(builder.threats);
        this.riskScore = builder.riskScore;
        this.overallSeverity = builder.overallSeverity;
        this.recommendation = builder.recommendation;
        this.scanDuration = builder.scanDuration != null ? builder.scanDuration : Duration.ZERO;
        this.scanTimestamp = builder.scanTimestamp != null ? builder.scanTimestamp : Instant.now();
        this.engineName = builder.engineName;
        this.engineVersion = builder.engineVersion;
        this.intelligenceVersion = builder.intelligenceVersion;
        this.diagnostics = List.copyOf(builder.diagnostics);
    }

    /**
     * Placeholder used when no scan could run. Score 0 but the recommendation is
     * decided by the caller (typically manual review).
     */
    public static ThreatDetectionResult unavailable(String scanId, FileMetadata metadata,
            Recommendation recommendation, String engineName, String engineVersion) {
        return builder()
                .scanId(scanId)
                .fileId(metadata.fileId())
                .fileName(metadata.fileName())
                .riskScore(0)
                .overallSeverity(Severity.INFO)
                .recommendation(recommendation)
                .engine(engineName, engineVersion)
                .build();
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

    public List<DetectedThreat> getThreats() {
        return threats;
    }

    public int getRiskScore() {
        return riskScore;
    }

    public Severity getOverallSeverity() {
        return overallSeverity;
    }

    public Recommendation getRecommendation() {
        return recommendation;
    }

    public Duration getScanDuration() {
        return scanDuration;
    }

    public Instant getScanTimestamp() {
        return scanTimestamp;
    }

    public String getEngineName() {
        return engineName;
    }

    public String getEngineVersion() {
        return engineVersion;
    }

    public String getIntelligenceVersion() {
        return intelligenceVersion;
    }

    public List<AnalyzerDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasThreats() {
        return !threats.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ThreatDetectionResult{file='" + fileName + "', threats=" + threats.size()
                + ", riskScore=" + riskScore + ", severity=" + overallSeverity
                + ", recommendation=" + recommendation + '}';
    }

    public static class Builder {
        private String scanId;
        private String fileId;
        private String fileName;
        private List<DetectedThreat> threats = List.of();
        private int riskScore;
        private Severity overallSeverity = Severity.INFO;
        private Recommendation recommendation = Recommendation.ALLOW;
        private Duration scanDuration;
        private Instant scanTimestamp;
        private String engineName;
        private String engineVersion;
        private String intelligenceVersion;
        private List<AnalyzerDiagnostic> diagnostics = List.of();

        public Builder scanId(String scanId) {
            this.scanId = scanId;
            return this;
        }

        public Builder fileId(String fileId) {
            this.fileId = fileId;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder threats(List<DetectedThreat> threats) {
            this.threats = threats;
            return this;
        }

        public Builder riskScore(int riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder overallSeverity(Severity overallSeverity) {
            this.overallSeverity = overallSeverity;
            return this;
        }

        public Builder recommendation(Recommendation recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Builder scanDuration(Duration scanDuration) {
            this.scanDuration = scanDuration;
            return this;
        }

        public Builder scanTimestamp(Instant scanTimestamp) {
            this.scanTimestamp = scanTimestamp;
            return this;
        }

        public Builder engine(String name, String version) {
            this.engineName = name;
            this.engineVersion = version;
            return this;
        }

        public Builder intelligenceVersion(String intelligenceVersion) {
            this.intelligenceVersion = intelligenceVersion;
            return this;
        }

        public Builder diagnostics(List<AnalyzerDiagnostic> diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public ThreatDetectionResult build() {
            return new ThreatDetectionResult(this);
        }
    }
}
