package com.filesentinel.core;

import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.detection.ScanErrorCode;
import com.filesentinel.core.detection.ScanException;
import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.detection.ThreatDetectionEngine;
import com.filesentinel.core.intel.ThreatIntelligence;
import com.filesentinel.core.intel.ThreatIntelligenceService;
import com.filesentinel.core.model.ActorContext;
import com.filesentinel.core.model.AuditRecord;
import com.filesentinel.core.model.ComplianceFlag;
import com.filesentinel.core.model.FileMetadata;
import com.filesentinel.core.model.PiiDetectionResult;
import com.filesentinel.core.model.Recommendation;
import com.filesentinel.core.model.SecurityEvent;
import com.filesentinel.core.model.Severity;
import com.filesentinel.core.model.ThreatAction;
import com.filesentinel.core.model.ThreatDetectionResult;
import com.filesentinel.core.model.ThreatResponse;
import com.filesentinel.core.model.UnifiedSecurityResult;
import com.filesentinel.core.plugin.PiiDetector;
import com.filesentinel.core.policy.ResponsePlan;
import com.filesentinel.core.policy.ResponsePolicyEngine;
import com.filesentinel.core.response.ResponseExecutor;
import com.filesentinel.core.response.ResponseRequest;
import com.filesentinel.core.store.AuditTrail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * The one entry point the upload pipeline calls.
 *
 * <p>
 * Runs the threat scan on the calling thread while the PII scan runs on the
 * executor under the same deadline, writes the audit events, plans and executes
 * the response, and summarises everything in a {@link UnifiedSecurityResult}.
 * Nothing is thrown past this class: any failure becomes a result recommending
 * manual review.
 * </p>
 */
public class SecurityOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SecurityOrchestrator.class);

    private final ThreatDetectionEngine threatEngine;
    private final PiiDetector piiDetector;
    private final ResponsePolicyEngine policyEngine;
    private final ResponseExecutor responseExecutor;
    private final ThreatIntelligenceService intelligenceService;
    private final AuditTrail auditTrail;
    private final FileSentinelProperties properties;
    private final Executor executor;

    public SecurityOrchestrator(ThreatDetectionEngine threatEngine, PiiDetector piiDetector,
            ResponsePolicyEngine policyEngine, ResponseExecutor responseExecutor,
            ThreatIntelligenceService intelligenceService, AuditTrail auditTrail,
            FileSentinelProperties properties, Executor executor) {
        this.threatEngine = threatEngine;
        this.piiDetector = piiDetector;
        this.policyEngine = policyEngine;
        this.responseExecutor = responseExecutor;
        this.intelligenceService = intelligenceService;
        this.auditTrail = auditTrail;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Scan an upload and apply the automated response.
     */
    public UnifiedSecurityResult scanAndRespond(byte[] content, FileMetadata metadata, ActorContext actor) {
        String scanId = UUID.randomUUID().toString();
        ActorContext who = actor != null ? actor : ActorContext.system();
        FileMetadata meta = metadata != null ? metadata : unknownFile(scanId, content);
        try {
            if (!properties.isEnabled()) {
                throw new ScanException(ScanErrorCode.CONFIGURATION_DISABLED, "FileSentinel is disabled");
            }
            if (metadata == null)
                throw new IllegalArgumentException("File metadata is required");
            return doScanAndRespond(scanId, content, meta, who);
        } catch (ScanException e) {
            log.error("[FileSentinel] Scan {} of '{}' failed ({}): {}", scanId, meta.fileName(),
                    e.getCode(), e.getMessage());
            return failed(scanId, meta, who, e.getCode().name() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[FileSentinel] Scan {} of '{}' failed unexpectedly", scanId, meta.fileName(), e);
            return failed(scanId, meta, who, e.toString());
        }
    }

    private static FileMetadata unknownFile(String scanId, byte[] content) {
        return new FileMetadata("unknown-" + scanId, "unknown", null, content != null ? content.length : 0);
    }

    private UnifiedSecurityResult doScanAndRespond(String scanId, byte[] content, FileMetadata metadata,
            ActorContext actor) throws ScanException {
        long deadline = ThreatDetectionEngine.deadlineFor(properties);
        ScanTarget target = threatEngine.prepare(content, metadata, properties);
        ThreatIntelligence intelligence = intelligenceService.current();

        FutureTask<PiiDetectionResult> piiTask = null;
        if (properties.isPiiDetectionEnabled()) {
            piiTask = new FutureTask<>(() -> piiDetector.scan(target, scanId, intelligence));
            try {
                executor.execute(piiTask);
            } catch (RejectedExecutionException e) {
                throw new ScanException(ScanErrorCode.EXECUTOR_REJECTED,
                        "Scan executor refused the PII scan of '" + metadata.fileName() + "'", e);
            }
        }

        ThreatDetectionResult threatResult;
        try {
            threatResult = threatEngine.scan(target, scanId, intelligence, properties, deadline);
        } catch (ScanException | RuntimeException e) {
            if (piiTask != null)
                piiTask.cancel(true);
            throw e;
        }
        PiiDetectionResult piiResult = piiTask != null ? awaitPii(piiTask, scanId, deadline) : null;

        recordDetectionEvents(scanId, metadata, actor, threatResult, piiResult);

        ResponsePlan plan = policyEngine.decide(threatResult, piiResult, properties);
        List<ThreatResponse> responses = responseExecutor.execute(plan,
                new ResponseRequest(scanId, content, metadata, threatResult, piiResult, actor));

        boolean blocked = responses.stream()
                .anyMatch(r -> r.getAction() == ThreatAction.BLOCK && r.isSucceeded());
        Recommendation recommendation = threatResult.getRecommendation();
        String message = summarize(threatResult, piiResult, responses);

        log.info("[FileSentinel] Scan {} of '{}' complete: {} ({})", scanId, metadata.fileName(),
                recommendation, message);
        return new UnifiedSecurityResult(!blocked, scanId, metadata.fileId(), recommendation, threatResult,
                piiResult, responses, message);
    }

    private PiiDetectionResult awaitPii(FutureTask<PiiDetectionResult> task, String scanId, long deadline)
            throws ScanException {
        try {
            return task.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new ScanException(ScanErrorCode.TIMEOUT, "PII scan did not finish within "
                    + properties.getScanTimeout(), e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScanException(ScanErrorCode.INTERRUPTED, "Scan " + scanId + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("PII scan failed: " + cause.getMessage(), cause);
        }
    }

    private void recordDetectionEvents(String scanId, FileMetadata metadata, ActorContext actor,
            ThreatDetectionResult threats, PiiDetectionResult pii) {
        if (threats.hasThreats()) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("riskScore", threats.getRiskScore());
            context.put("recommendation", threats.getRecommendation().name());
            context.put("signatures", threats.getThreats().stream()
                    .map(t -> t.signature().getId()).distinct().collect(Collectors.joining(",")));
            context.put("intelligenceVersion", String.valueOf(threats.getIntelligenceVersion()));
            auditTrail.record(new SecurityEvent(SecurityEvent.Type.THREAT_DETECTED, threats.getOverallSeverity(),
                    actor.actorId(), metadata.fileId(), scanId,
                    threats.getThreats().size() + " threats detected in " + metadata.fileName(), context));
        }
        if (pii != null && pii.hasFindings()) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("classification", pii.getClassification().name());
            context.put("handling", pii.getRecommendedHandling().name());
            context.put("types", pii.getFindings().stream()
                    .map(f -> f.type().name()).distinct().collect(Collectors.joining(",")));
            auditTrail.record(new SecurityEvent(SecurityEvent.Type.PII_DETECTED,
                    pii.hasCriticalFinding() ? Severity.CRITICAL : Severity.HIGH, actor.actorId(),
                    metadata.fileId(), scanId, pii.getFindings().size() + " PII findings in " + metadata.fileName(),
                    context));

            List<ComplianceFlag> violated = pii.getComplianceFlags().stream().filter(ComplianceFlag::violated)
                    .toList();
            if (!violated.isEmpty()) {
                Severity worst = violated.stream().map(ComplianceFlag::severity)
                        .reduce(Severity.INFO, Severity::max);
                auditTrail.record(new SecurityEvent(SecurityEvent.Type.COMPLIANCE_VIOLATION, worst,
                        actor.actorId(), metadata.fileId(), scanId,
                        "Regulated data found: " + violated.stream().map(f -> f.regulation().name())
                                .collect(Collectors.joining(", ")),
                        Map.of("regulations", violated.size())));
            }
        }
    }

    private UnifiedSecurityResult failed(String scanId, FileMetadata metadata, ActorContext actor, String reason) {
        auditTrail.record(new SecurityEvent(SecurityEvent.Type.SCAN_FAILED, Severity.HIGH, actor.actorId(),
                metadata.fileId(), scanId, "Security scan failed for " + metadata.fileName(),
                Map.of("error", String.valueOf(reason))));
        ThreatDetectionResult placeholder = ThreatDetectionResult.unavailable(scanId, metadata,
                Recommendation.MANUAL_REVIEW, ThreatDetectionEngine.ENGINE_NAME, ThreatDetectionEngine.ENGINE_VERSION);
        return new UnifiedSecurityResult(false, scanId, metadata.fileId(), Recommendation.MANUAL_REVIEW,
                placeholder, null, List.of(), "Security scan failed: " + reason);
    }

    private static String summarize(ThreatDetectionResult threats, PiiDetectionResult pii,
            List<ThreatResponse> responses) {
        long failedActions = responses.stream().filter(r -> !r.isSucceeded()).count();
        StringBuilder sb = new StringBuilder()
                .append(threats.getThreats().size()).append(" threats, risk ").append(threats.getRiskScore())
                .append(", ").append(pii != null ? pii.getFindings().size() + " PII findings" : "PII scan skipped")
                .append(", actions ").append(responses.stream().map(r -> r.getAction().name())
                        .collect(Collectors.joining(",")));
        if (failedActions > 0)
            sb.append(", ").append(failedActions).append(" failed");
        return sb.toString();
    }

    /**
     * Drop the cached threat intelligence and load the latest from the repository.
     *
     * @return the version now in use
     */
    public String refreshThreatIntelligence() {
        ThreatIntelligence refreshed = intelligenceService.refresh();
        auditTrail.record(new SecurityEvent(SecurityEvent.Type.SYSTEM_ALERT, Severity.INFO, "system", null, null,
                "Threat intelligence refreshed to " + refreshed.getVersion(),
                Map.of("signatures", refreshed.getSignatures().size(),
                        "hashes", refreshed.getMalwareHashes().size(),
                        "piiPatterns", refreshed.getPiiPatterns().size())));
        return refreshed.getVersion();
    }

    /**
     * Everything the audit trail knows about one file, oldest first.
     */
    public List<AuditRecord> getFileSecurityHistory(String fileId) {
        return auditTrail.history(fileId);
    }

    /**
     * Stop trusting automated scanning: switch malware and PII detection off so
     * every later upload fails closed into manual review.
     */
    public void emergencyLockdown(String reason, ActorContext actor) {
        ActorContext who = actor != null ? actor : ActorContext.system();
        properties.setMalwareDetectionEnabled(false);
        properties.setPiiDetectionEnabled(false);
        log.error("[FileSentinel] EMERGENCY LOCKDOWN by '{}': {}", who.actorId(), reason);
        auditTrail.record(new SecurityEvent(SecurityEvent.Type.SYSTEM_ALERT, Severity.CRITICAL, who.actorId(),
                null, null, "Emergency lockdown: " + reason, Map.of("lockdown", true)));
    }
}
