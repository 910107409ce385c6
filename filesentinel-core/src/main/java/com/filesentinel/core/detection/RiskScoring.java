package com.filesentinel.core.detection;

import com.filesentinel.core.model.DetectedThreat;
import com.filesentinel.core.model.Recommendation;
import com.filesentinel.core.model.Severity;

import java.util.List;

/**
 * Turns a list of threats into a score, a severity and a recommendation.
 * Pure functions only; nothing here looks at the file itself.
 */
public class RiskScoring {

    public static final int MAX_SCORE = 100;
    static final int CRITICAL_SCORE = 90;

    private final SeverityWeights weights;

    public RiskScoring() {
        this(SeverityWeights.defaults());
    }

    public RiskScoring(SeverityWeights weights) {
        this.weights = weights;
    }

    /**
     * Sum of confidence x severity weight, capped at 100. A definitive hash
     * match pins the score to 100.
     */
    public int riskScore(List<DetectedThreat> threats) {
        double total = 0;
        for (DetectedThreat threat : threats) {
            if (threat.definitive())
                return MAX_SCORE;
            total += threat.confidence() * weights.weight(threat.severity());
        }
        return (int) Math.min(MAX_SCORE, Math.round(total));
    }

    /**
     * Highest threat severity, raised to CRITICAL when the score alone is in
     * critical territory. INFO when there are no threats.
     */
    public Severity overallSeverity(List<DetectedThreat> threats, int riskScore) {
        Severity max = Severity.INFO;
        for (DetectedThreat threat : threats) {
            max = Severity.max(max, threat.severity());
        }
        if (riskScore >= CRITICAL_SCORE)
            return Severity.CRITICAL;
        return max;
    }

    public static Recommendation recommend(int riskScore, Severity overallSeverity) {
        if (overallSeverity == Severity.CRITICAL || riskScore >= 90)
            return Recommendation.BLOCK;
        if (overallSeverity == Severity.HIGH || riskScore >= 70)
            return Recommendation.QUARANTINE;
        if (riskScore >= 40)
            return Recommendation.MANUAL_REVIEW;
        if (riskScore >= 10)
            return Recommendation.WARN;
        return Recommendation.ALLOW;
    }
}
