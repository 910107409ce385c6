package com.filesentinel.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.detection.RiskScoring;
import com.filesentinel.core.detection.ScanException;
import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.detection.ThreatDetectionEngine;
import com.filesentinel.core.intel.InMemoryThreatIntelligenceRepository;
import com.filesentinel.core.intel.ThreatIntelligence;
import com.filesentinel.core.intel.ThreatIntelligenceService;
import com.filesentinel.core.model.ActorContext;
import com.filesentinel.core.model.AuditRecord;
import com.filesentinel.core.model.ComplianceFlag;
import com.filesentinel.core.model.ComplianceRegulation;
import com.filesentinel.core.model.DataClassification;
import com.filesentinel.core.model.DataHandling;
import com.filesentinel.core.model.FileMetadata;
import com.filesentinel.core.model.PiiDetectionResult;
import com.filesentinel.core.model.PiiType;
import com.filesentinel.core.model.Recommendation;
import com.filesentinel.core.model.SecurityEvent;
import com.filesentinel.core.model.Severity;
import com.filesentinel.core.model.ThreatAction;
import com.filesentinel.core.model.ThreatType;
import com.filesentinel.core.model.UnifiedSecurityResult;
import com.filesentinel.core.plugin.AnalyzerRegistry;
import com.filesentinel.core.plugin.PiiDetector;
import com.filesentinel.core.plugin.ThreatAnalyzer;
import com.filesentinel.core.policy.ResponsePolicyEngine;
import com.filesentinel.core.response.ResponseExecutor;
import com.filesentinel.core.response.Sanitizer;
import com.filesentinel.core.store.AuditQuery;
import com.filesentinel.core.store.AuditTrail;
import com.filesentinel.core.store.InMemoryAuditStore;
import com.filesentinel.core.store.InMemoryBlobStore;
import com.filesentinel.core.store.InMemoryReferenceDataCache;
import com.filesentinel.core.store.LoggingNotificationChannel;
import com.filesentinel.core.store.StorageFailureMonitor;
import com.filesentinel.core.support.StubAnalyzer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.filesentinel.core.support.TestFixtures.finding;
import static com.filesentinel.core.support.TestFixtures.metadata;
import static com.filesentinel.core.support.TestFixtures.properties;
import static com.filesentinel.core.support.TestFixtures.threat;
import static com.filesentinel.core.support.TestFixtures.utf8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SecurityOrchestratorTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final FileSentinelProperties properties = properties();
    private final InMemoryAuditStore auditStore = new InMemoryAuditStore();
    private final AuditTrail auditTrail = new AuditTrail(auditStore, new StorageFailureMonitor());
    private final AtomicInteger piiScans = new AtomicInteger();

    private PiiDetectionResult piiOutcome;

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private final PiiDetector piiDetector = new PiiDetector() {
        @Override
        public PiiDetectionResult scan(byte[] content, FileMetadata metadata) throws ScanException {
            throw new UnsupportedOperationException();
        }

        @Override
        public PiiDetectionResult scan(ScanTarget target, String scanId, ThreatIntelligence intelligence) {
            piiScans.incrementAndGet();
            if (piiOutcome != null)
                return piiOutcome;
            return new PiiDetectionResult(scanId, target.getMetadata().fileId(), target.getFileName(), List.of(),
                    DataClassification.PUBLIC, DataHandling.ALLOW, List.of(), Instant.now());
        }
    };

    private SecurityOrchestrator orchestrator(ThreatAnalyzer... analyzers) {
        return orchestrator(executor, analyzers);
    }

    private SecurityOrchestrator orchestrator(Executor executor, ThreatAnalyzer... analyzers) {
        ThreatIntelligenceService intelligence = new ThreatIntelligenceService(
                new InMemoryThreatIntelligenceRepository(), new InMemoryReferenceDataCache(), properties);
        ThreatDetectionEngine engine = new ThreatDetectionEngine(new AnalyzerRegistry(List.of(analyzers)),
                intelligence, properties, executor, new RiskScoring());
        ResponseExecutor responses = new ResponseExecutor(new InMemoryBlobStore(), auditTrail,
                new LoggingNotificationChannel(), properties, new Sanitizer(), new ObjectMapper());
        return new SecurityOrchestrator(engine, piiDetector, new ResponsePolicyEngine(), responses, intelligence,
                auditTrail, properties, executor);
    }

    private static List<AuditRecord> eventsOfType(List<AuditRecord> records, SecurityEvent.Type type) {
        return records.stream()
                .filter(r -> r instanceof SecurityEvent e && e.getType() == type)
                .toList();
    }

    @Test
    void cleanFileIsAllowedAndLogged() {
        byte[] content = utf8("quarterly numbers look fine");

        UnifiedSecurityResult result = orchestrator().scanAndRespond(content, metadata("report.txt", content),
                ActorContext.user("alice"));

        assertTrue(result.isSuccess());
        assertEquals(Recommendation.ALLOW, result.getRecommendation());
        assertEquals(List.of(ThreatAction.LOG), result.getExecutedActions());
        assertEquals(1, piiScans.get());
    }

    @Test
    void hostileThreatIsBlockedAndRecorded() {
        SecurityOrchestrator orchestrator = orchestrator(StubAnalyzer.returning("stub", 100,
                threat("mal_008", ThreatType.BACKDOOR, Severity.CRITICAL, 92)));
        byte[] content = utf8("reverse shell");

        UnifiedSecurityResult result = orchestrator.scanAndRespond(content, metadata("shell.txt", content), null);

        assertFalse(result.isSuccess());
        assertEquals(Recommendation.BLOCK, result.getRecommendation());
        assertTrue(result.getExecutedActions().contains(ThreatAction.BLOCK));
        List<AuditRecord> history = orchestrator.getFileSecurityHistory("file-shell.txt");
        assertEquals(1, eventsOfType(history, SecurityEvent.Type.THREAT_DETECTED).size());
        assertTrue(history.stream().allMatch(r -> result.getScanId().equals(r.getCorrelationId())));
    }

    @Test
    void piiFindingsRecordComplianceViolation() {
        piiOutcome = new PiiDetectionResult("x", "file-ids.txt", "ids.txt",
                List.of(finding(PiiType.SSN, Severity.CRITICAL, 5, 11)), DataClassification.RESTRICTED,
                DataHandling.REJECT, List.of(new ComplianceFlag(ComplianceRegulation.GDPR, "protect", true,
                        Severity.HIGH, "minimize")), Instant.now());
        byte[] content = utf8("ssn: 123-45-6789");

        UnifiedSecurityResult result = orchestrator().scanAndRespond(content, metadata("ids.txt", content), null);

        assertEquals(List.of(ThreatAction.LOG, ThreatAction.BLOCK, ThreatAction.SANITIZE, ThreatAction.ESCALATE),
                result.getExecutedActions());
        List<AuditRecord> history = auditTrail.history("file-ids.txt");
        assertEquals(1, eventsOfType(history, SecurityEvent.Type.PII_DETECTED).size());
        assertEquals(1, eventsOfType(history, SecurityEvent.Type.COMPLIANCE_VIOLATION).size());
    }

    @Test
    void disabledPiiDetectionSkipsDetector() {
        properties.setPiiDetectionEnabled(false);
        byte[] content = utf8("hello");

        UnifiedSecurityResult result = orchestrator().scanAndRespond(content, metadata("a.txt", content), null);

        assertTrue(result.isSuccess());
        assertNull(result.getPiiResult());
        assertEquals(0, piiScans.get());
    }

    @Test
    void oversizedFileFailsClosedIntoManualReview() {
        properties.setMaxScanSizeBytes(3);
        byte[] content = utf8("too big");

        UnifiedSecurityResult result = orchestrator().scanAndRespond(content, metadata("big.txt", content), null);

        assertFalse(result.isSuccess());
        assertEquals(Recommendation.MANUAL_REVIEW, result.getRecommendation());
        assertTrue(result.getMessage().contains("SIZE_EXCEEDED"));
        assertEquals(1, eventsOfType(auditTrail.history("file-big.txt"), SecurityEvent.Type.SCAN_FAILED).size());
    }

    @Test
    void missingMetadataFailsClosedIntoManualReview() {
        UnifiedSecurityResult result = orchestrator().scanAndRespond(utf8("hello"), null, null);

        assertFalse(result.isSuccess());
        assertEquals(Recommendation.MANUAL_REVIEW, result.getRecommendation());
        assertTrue(result.getMessage().contains("metadata"));
        assertEquals(0, piiScans.get());
        assertEquals(1, eventsOfType(auditStore.query(AuditQuery.all()), SecurityEvent.Type.SCAN_FAILED).size());
    }

    @Test
    void rejectedExecutorFailsClosedIntoManualReview() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };
        byte[] content = utf8("hello");

        UnifiedSecurityResult result = orchestrator(saturated,
                StubAnalyzer.returning("quiet", 100)).scanAndRespond(content, metadata("a.txt", content), null);

        assertFalse(result.isSuccess());
        assertEquals(Recommendation.MANUAL_REVIEW, result.getRecommendation());
        assertTrue(result.getMessage().contains("EXECUTOR_REJECTED"));
        assertEquals(0, piiScans.get());
    }

    @Test
    void emergencyLockdownStopsAutomatedScanning() {
        SecurityOrchestrator orchestrator = orchestrator();
        orchestrator.emergencyLockdown("suspected signature poisoning", ActorContext.user("secops"));
        byte[] content = utf8("hello");

        UnifiedSecurityResult result = orchestrator.scanAndRespond(content, metadata("a.txt", content), null);

        assertFalse(properties.isMalwareDetectionEnabled());
        assertFalse(properties.isPiiDetectionEnabled());
        assertFalse(result.isSuccess());
        assertEquals(Recommendation.MANUAL_REVIEW, result.getRecommendation());
        assertEquals(1, auditStore.query(AuditQuery.all()).stream()
                .filter(r -> r instanceof SecurityEvent e && e.getSeverity() == Severity.CRITICAL
                        && e.getType() == SecurityEvent.Type.SYSTEM_ALERT)
                .count());
    }

    @Test
    void refreshReportsNewVersion() {
        SecurityOrchestrator orchestrator = orchestrator();

        String version = orchestrator.refreshThreatIntelligence();

        assertEquals("1.0.0", version);
        assertEquals(1, eventsOfType(auditStore.query(AuditQuery.all()), SecurityEvent.Type.SYSTEM_ALERT).size());
    }

    @Test
    void sameInputGivesSamePlan() {
        SecurityOrchestrator orchestrator = orchestrator(StubAnalyzer.returning("stub", 100,
                threat("mal_002", ThreatType.OBFUSCATED_CODE, Severity.MEDIUM, 75)));
        byte[] content = utf8("atob('aGVsbG8=')");

        UnifiedSecurityResult first = orchestrator.scanAndRespond(content, metadata("a.js", content), null);
        UnifiedSecurityResult second = orchestrator.scanAndRespond(content, metadata("a.js", content), null);

        assertEquals(first.getExecutedActions(), second.getExecutedActions());
        assertEquals(first.getThreatResult().getRiskScore(), second.getThreatResult().getRiskScore());
    }
}
