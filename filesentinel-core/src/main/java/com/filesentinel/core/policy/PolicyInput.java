package com.filesentinel.core.policy;

import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.model.DataClassification;
import com.filesentinel.core.model.PiiDetectionResult;
import com.filesentinel.core.model.Severity;
import com.filesentinel.core.model.ThreatDetectionResult;

/**
 * Everything a policy rule may look at.
 *
 * @param piiResult null when PII detection did not run
 */
public record PolicyInput(ThreatDetectionResult threatResult, PiiDetectionResult piiResult,
        FileSentinelProperties settings) {

    public int riskScore() {
        return threatResult.getRiskScore();
    }

    public Severity severity() {
        return threatResult.getOverallSeverity();
    }

    public boolean atOrAboveAutoQuarantine() {
        return riskScore() >= settings.getAutoQuarantineThreshold();
    }

    public boolean hasHostileThreat() {
        return threatResult.getThreats().stream().anyMatch(t -> t.type().isHostile());
    }

    public DataClassification piiClassification() {
        return piiResult != null ? piiResult.getClassification() : DataClassification.PUBLIC;
    }

    public boolean hasPiiFindings() {
        return piiResult != null && piiResult.hasFindings();
    }

    public boolean hasCriticalPii() {
        return piiResult != null && piiResult.hasCriticalFinding();
    }
}
