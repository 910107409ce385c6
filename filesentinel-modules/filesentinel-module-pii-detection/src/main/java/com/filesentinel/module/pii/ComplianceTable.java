package com.filesentinel.module.pii;

import com.filesentinel.core.model.ComplianceFlag;
import com.filesentinel.core.model.ComplianceRegulation;
import com.filesentinel.core.model.PiiFinding;
import com.filesentinel.core.model.PiiType;
import com.filesentinel.core.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static lookup from PII type to the regulations it falls under, plus the fixed
 * requirement, remediation and severity text reported for each regulation.
 */
@Component
public class ComplianceTable {

    private final Map<PiiType, List<ComplianceRegulation>> regulationsByType;
    private final Map<ComplianceRegulation, Requirement> requirements;

    public ComplianceTable() {
        this(defaultRegulations(), defaultRequirements());
    }

    public ComplianceTable(Map<PiiType, List<ComplianceRegulation>> regulationsByType,
            Map<ComplianceRegulation, Requirement> requirements) {
        this.regulationsByType = Map.copyOf(regulationsByType);
        this.requirements = Map.copyOf(requirements);
    }

    public List<ComplianceRegulation> regulationsFor(PiiType type) {
        return regulationsByType.getOrDefault(type, List.of());
    }

    /**
     * One flag per distinct regulation implicated by the findings, in the order
     * the regulations are first seen.
     */
    public List<ComplianceFlag> flagsFor(Collection<PiiFinding> findings) {
        Set<ComplianceRegulation> implicated = new LinkedHashSet<>();
        for (PiiFinding finding : findings) {
            implicated.addAll(regulationsFor(finding.type()));
        }

        List<ComplianceFlag> flags = new ArrayList<>(implicated.size());
        for (ComplianceRegulation regulation : implicated) {
            Requirement requirement = requirements.getOrDefault(regulation, Requirement.UNSPECIFIED);
            flags.add(new ComplianceFlag(regulation, requirement.text(), true,
                    requirement.severity(), requirement.remediation()));
        }
        return flags;
    }

    public static Map<PiiType, List<ComplianceRegulation>> defaultRegulations() {
        Map<PiiType, List<ComplianceRegulation>> map = new EnumMap<>(PiiType.class);
        map.put(PiiType.SSN, List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA, ComplianceRegulation.SOX));
        map.put(PiiType.CREDIT_CARD,
                List.of(ComplianceRegulation.PCI_DSS, ComplianceRegulation.GDPR, ComplianceRegulation.CCPA));
        map.put(PiiType.PHONE_NUMBER,
                List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA, ComplianceRegulation.COPPA));
        map.put(PiiType.EMAIL, List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA, ComplianceRegulation.COPPA));
        map.put(PiiType.IP_ADDRESS, List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA));
        map.put(PiiType.DRIVERS_LICENSE, List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA));
        map.put(PiiType.PASSPORT, List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA));
        map.put(PiiType.DATE_OF_BIRTH,
                List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA, ComplianceRegulation.COPPA));
        map.put(PiiType.BANK_ACCOUNT,
                List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA, ComplianceRegulation.GLBA));
        map.put(PiiType.MEDICAL_RECORD,
                List.of(ComplianceRegulation.HIPAA, ComplianceRegulation.GDPR, ComplianceRegulation.CCPA));
        map.put(PiiType.BIOMETRIC, List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA));
        map.put(PiiType.GOVERNMENT_ID, List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA));
        map.put(PiiType.TAX_ID, List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA, ComplianceRegulation.SOX));
        return map;
    }

    public static Map<ComplianceRegulation, Requirement> defaultRequirements() {
        Map<ComplianceRegulation, Requirement> map = new EnumMap<>(ComplianceRegulation.class);
        map.put(ComplianceRegulation.GDPR, new Requirement("Personal data must be processed lawfully and protected",
                Severity.HIGH, "Obtain consent, implement data minimization, enable data deletion"));
        map.put(ComplianceRegulation.CCPA, new Requirement("Consumer personal information must be disclosed and protected",
                Severity.HIGH, "Provide privacy notice, enable opt-out, implement data deletion"));
        map.put(ComplianceRegulation.HIPAA, new Requirement("Protected health information must be secured",
                Severity.CRITICAL, "Implement administrative, physical and technical safeguards"));
        map.put(ComplianceRegulation.PCI_DSS, new Requirement("Payment card data must be protected",
                Severity.CRITICAL, "Encrypt cardholder data, implement access controls"));
        map.put(ComplianceRegulation.SOX, new Requirement("Financial data must be accurately reported and secured",
                Severity.HIGH, "Implement financial controls and audit trails"));
        map.put(ComplianceRegulation.GLBA, new Requirement("Financial information must be protected",
                Severity.HIGH, "Implement information security program"));
        map.put(ComplianceRegulation.FERPA, new Requirement("Educational records must be protected",
                Severity.MEDIUM, "Limit access to educational records"));
        map.put(ComplianceRegulation.COPPA, new Requirement("Children's personal information must be protected",
                Severity.HIGH, "Obtain parental consent for children under 13"));
        return map;
    }

    // --- Internal classes ---

    public record Requirement(String text, Severity severity, String remediation) {

        static final Requirement UNSPECIFIED = new Requirement("Compliance requirement not specified",
                Severity.MEDIUM, "Consult legal team for specific remediation");
    }
}
