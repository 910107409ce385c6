package com.filesentinel.module.pii;

import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.detection.ScanErrorCode;
import com.filesentinel.core.detection.ScanException;
import com.filesentinel.core.intel.BuiltInThreatIntelligence;
import com.filesentinel.core.intel.InMemoryThreatIntelligenceRepository;
import com.filesentinel.core.intel.ThreatIntelligenceService;
import com.filesentinel.core.model.ComplianceFlag;
import com.filesentinel.core.model.ComplianceRegulation;
import com.filesentinel.core.model.DataClassification;
import com.filesentinel.core.model.DataHandling;
import com.filesentinel.core.model.PiiDetectionResult;
import com.filesentinel.core.model.PiiFinding;
import com.filesentinel.core.model.PiiType;
import com.filesentinel.core.store.InMemoryReferenceDataCache;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.filesentinel.core.support.TestFixtures.builtInIntelligence;
import static com.filesentinel.core.support.TestFixtures.metadata;
import static com.filesentinel.core.support.TestFixtures.properties;
import static com.filesentinel.core.support.TestFixtures.textTarget;
import static com.filesentinel.core.support.TestFixtures.utf8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PiiPatternMatcherTest {

    private final FileSentinelProperties properties = properties();
    private final PiiPatternMatcher matcher = matcher(properties);

    private static PiiPatternMatcher matcher(FileSentinelProperties properties) {
        ThreatIntelligenceService intelligence = new ThreatIntelligenceService(
                new InMemoryThreatIntelligenceRepository(), new InMemoryReferenceDataCache(), properties);
        return new PiiPatternMatcher(intelligence, properties, new PiiClassifier(new ComplianceTable()));
    }

    private PiiDetectionResult scan(String text) {
        return matcher.scan(textTarget("doc.txt", text), "scan-1", builtInIntelligence());
    }

    @Test
    void ssnIsRestrictedAndRejected() {
        PiiDetectionResult result = scan("ssn: 123-45-6789");

        assertEquals(1, result.getFindings().size());
        PiiFinding finding = result.getFindings().get(0);
        assertEquals(PiiType.SSN, finding.type());
        assertEquals("ssn_us:5", finding.id());
        assertEquals("***-**-6789", finding.maskedValue());
        assertEquals(95, finding.confidence());
        assertEquals(5, finding.location().offset());
        assertEquals(11, finding.location().length());
        assertEquals("ssn: ***-**-6789", finding.context());

        assertEquals(DataClassification.RESTRICTED, result.getClassification());
        assertEquals(DataHandling.REJECT, result.getRecommendedHandling());
        assertEquals(List.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA, ComplianceRegulation.SOX),
                result.getComplianceFlags().stream().map(ComplianceFlag::regulation).toList());
        assertEquals("scan-1", result.getScanId());
        assertEquals("file-doc.txt", result.getFileId());
    }

    @Test
    void structurallyImpossibleSsnIsDropped() {
        assertFalse(scan("ssn: 111-11-1111").hasFindings());
    }

    @Test
    void groupedCardPassingLuhnIsReported() {
        PiiDetectionResult result = scan("Card 4111 1111 1111 1111 on file");

        assertEquals(1, result.getFindings().size());
        PiiFinding finding = result.getFindings().get(0);
        assertEquals(PiiType.CREDIT_CARD, finding.type());
        assertEquals("credit_card_grouped", finding.patternId());
        assertEquals("**** **** **** 1111", finding.maskedValue());
        assertEquals(DataHandling.REJECT, result.getRecommendedHandling());
    }

    @Test
    void cardFailingLuhnIsDropped() {
        PiiDetectionResult result = scan("Card 4111 1111 1111 1112 on file");

        assertFalse(result.hasFindings());
        assertEquals(DataClassification.PUBLIC, result.getClassification());
        assertEquals(DataHandling.ALLOW, result.getRecommendedHandling());
        assertTrue(result.getComplianceFlags().isEmpty());
    }

    @Test
    void placeholderEmailIsIgnored() {
        PiiDetectionResult result = scan("Contact jane.doe@acme.io or test@test.com");

        assertEquals(1, result.getFindings().size());
        assertEquals("j*******@acme.io", result.getFindings().get(0).maskedValue());
        assertEquals(DataClassification.INTERNAL, result.getClassification());
        assertEquals(DataHandling.REDACT, result.getRecommendedHandling());
    }

    @Test
    void phoneNumbersRespectNumberingRules() {
        PiiDetectionResult result = scan("Call (415) 555-2671 today, not 123-456-7890");

        assertEquals(1, result.getFindings().size());
        PiiFinding finding = result.getFindings().get(0);
        assertEquals(PiiType.PHONE_NUMBER, finding.type());
        assertEquals(5, finding.location().offset());
        assertEquals("**************", finding.maskedValue());
        assertEquals(85, finding.confidence());
    }

    @Test
    void keywordAnchoredPatternReportsOnlyTheValue() {
        PiiDetectionResult result = scan("Account number: 000123456789");

        assertEquals(1, result.getFindings().size());
        PiiFinding finding = result.getFindings().get(0);
        assertEquals(PiiType.BANK_ACCOUNT, finding.type());
        assertEquals(16, finding.location().offset());
        assertEquals(12, finding.location().length());
        assertEquals("********6789", finding.maskedValue());
        assertEquals(80, finding.confidence());
        assertEquals(DataClassification.RESTRICTED, result.getClassification());
        assertTrue(result.getComplianceFlags().stream()
                .anyMatch(f -> f.regulation() == ComplianceRegulation.GLBA));
    }

    @Test
    void loopbackAddressIsNotPersonal() {
        assertFalse(scan("bind 127.0.0.1 only").hasFindings());

        PiiDetectionResult result = scan("Server at 203.0.113.42 responded");
        assertEquals(1, result.getFindings().size());
        assertEquals(PiiType.IP_ADDRESS, result.getFindings().get(0).type());
        assertEquals(DataClassification.PUBLIC, result.getClassification());
        assertEquals(DataHandling.ALLOW, result.getRecommendedHandling());
    }

    @Test
    void dateOfBirthNextToLabel() {
        PiiDetectionResult result = scan("DOB: 01/15/1990");

        assertEquals(1, result.getFindings().size());
        assertEquals(PiiType.DATE_OF_BIRTH, result.getFindings().get(0).type());
        assertEquals("**********", result.getFindings().get(0).maskedValue());
        assertEquals(DataClassification.CONFIDENTIAL, result.getClassification());
        assertEquals(DataHandling.ENCRYPT, result.getRecommendedHandling());
    }

    @Test
    void contextNeverLeaksNeighbouringValues() {
        PiiDetectionResult result = scan("ssn 123-45-6789 card 4111111111111111");

        assertEquals(List.of(PiiType.SSN, PiiType.CREDIT_CARD),
                result.getFindings().stream().map(PiiFinding::type).toList());
        for (PiiFinding finding : result.getFindings()) {
            assertFalse(finding.context().contains("123-45"), finding.context());
            assertFalse(finding.context().contains("411111"), finding.context());
            assertFalse(finding.maskedValue().contains("123-45"), finding.maskedValue());
        }
    }

    @Test
    void contextHidesWordClippedByWindow() {
        PiiDetectionResult result = scan("ssn: 123-45-6789 contact johnathan.q.smith@example.com");

        PiiFinding ssn = result.getFindings().stream().filter(f -> f.type() == PiiType.SSN).findFirst()
                .orElseThrow();
        assertEquals("ssn: ***-**-6789 contact ***********", ssn.context());
        assertFalse(ssn.context().contains("johnathan"), ssn.context());
    }

    @Test
    void locationCarriesLineAndColumn() {
        PiiFinding finding = scan("first line\nssn: 123-45-6789").getFindings().get(0);

        assertEquals(16, finding.location().offset());
        assertEquals(2, finding.location().line());
        assertEquals(6, finding.location().column());
    }

    @Test
    void interruptedScanStopsEarly() {
        Thread.currentThread().interrupt();
        try {
            List<PiiFinding> findings = matcher.detect(textTarget("doc.txt", "ssn: 123-45-6789"),
                    BuiltInThreatIntelligence.piiPatterns());
            assertTrue(findings.isEmpty());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void standaloneScanUsesCurrentIntelligence() throws ScanException {
        byte[] content = utf8("email jane.doe@acme.io");

        PiiDetectionResult result = matcher.scan(content, metadata("mail.txt", content));

        assertNotNull(result.getScanId());
        assertEquals(1, result.getFindings().size());
    }

    @Test
    void standaloneScanRefusesWhenDisabled() {
        properties.setPiiDetectionEnabled(false);
        byte[] content = utf8("ssn: 123-45-6789");

        ScanException e = assertThrows(ScanException.class, () -> matcher.scan(content, metadata("a.txt", content)));
        assertEquals(ScanErrorCode.CONFIGURATION_DISABLED, e.getCode());
    }

    @Test
    void standaloneScanRefusesOversizeContent() {
        properties.setMaxScanSizeBytes(8);
        byte[] content = utf8("ssn: 123-45-6789");

        ScanException e = assertThrows(ScanException.class, () -> matcher.scan(content, metadata("a.txt", content)));
        assertEquals(ScanErrorCode.SIZE_EXCEEDED, e.getCode());
    }

    @Test
    void confidenceTable() {
        assertEquals(95, PiiPatternMatcher.confidenceFor(PiiType.SSN));
        assertEquals(90, PiiPatternMatcher.confidenceFor(PiiType.EMAIL));
        assertEquals(70, PiiPatternMatcher.confidenceFor(PiiType.IP_ADDRESS));
        assertEquals(80, PiiPatternMatcher.confidenceFor(PiiType.PASSPORT));
    }
}
