package com.filesentinel.module.pii;

import com.filesentinel.core.model.ComplianceFlag;
import com.filesentinel.core.model.DataClassification;
import com.filesentinel.core.model.DataHandling;
import com.filesentinel.core.model.PiiFinding;
import com.filesentinel.core.model.Severity;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns accepted findings into a classification, a handling recommendation and
 * compliance flags.
 */
@Component
public class PiiClassifier {

    private final ComplianceTable complianceTable;

    public PiiClassifier(ComplianceTable complianceTable) {
        this.complianceTable = complianceTable;
    }

    public DataClassification classify(List<PiiFinding> findings) {
        if (hasSeverity(findings, Severity.CRITICAL))
            return DataClassification.RESTRICTED;
        if (hasSeverity(findings, Severity.HIGH))
            return DataClassification.CONFIDENTIAL;
        if (hasSeverity(findings, Severity.MEDIUM))
            return DataClassification.INTERNAL;
        return DataClassification.PUBLIC;
    }

    public DataHandling recommendHandling(DataClassification classification, List<PiiFinding> findings) {
        boolean criticalFinancial = findings.stream()
                .anyMatch(f -> f.severity() == Severity.CRITICAL && f.type().isFinancialIdentity());
        if (criticalFinancial)
            return DataHandling.REJECT;

        return switch (classification) {
            case RESTRICTED -> DataHandling.REJECT;
            case CONFIDENTIAL -> DataHandling.ENCRYPT;
            case INTERNAL -> DataHandling.REDACT;
            case PUBLIC -> DataHandling.ALLOW;
        };
    }

    public List<ComplianceFlag> complianceFlags(List<PiiFinding> findings) {
        return complianceTable.flagsFor(findings);
    }

    private static boolean hasSeverity(List<PiiFinding> findings, Severity severity) {
        return findings.stream().anyMatch(f -> f.severity() == severity);
    }
}
