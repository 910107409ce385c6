package com.filesentinel.core.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.config.FileSentinelProperties.NotificationProperties;
import com.filesentinel.core.detection.Digests;
import com.filesentinel.core.model.DeliveryStatus;
import com.filesentinel.core.model.EscalationTicket;
import com.filesentinel.core.model.FileDescriptor;
import com.filesentinel.core.model.FileDisposition;
import com.filesentinel.core.model.NotificationMethod;
import com.filesentinel.core.model.NotificationRecord;
import com.filesentinel.core.model.PiiDetectionResult;
import com.filesentinel.core.model.ProcessedFile;
import com.filesentinel.core.model.QuarantineRecord;
import com.filesentinel.core.model.SecurityEvent;
import com.filesentinel.core.model.ThreatAction;
import com.filesentinel.core.model.ThreatDetectionResult;
import com.filesentinel.core.model.ThreatResponse;
import com.filesentinel.core.model.ThreatResponseDetails;
import com.filesentinel.core.policy.PlannedAction;
import com.filesentinel.core.policy.ResponsePlan;
import com.filesentinel.core.store.AuditTrail;
import com.filesentinel.core.store.BlobStore;
import com.filesentinel.core.store.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.CharacterCodingException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Carries out a {@link ResponsePlan}, one action at a time, in plan order.
 *
 * <p>
 * Every action is its own unit of work and yields exactly one
 * {@link ThreatResponse}, appended to the audit trail. A failing action is
 * recorded as FAILED and the next one still runs.
 * </p>
 */
public class ResponseExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResponseExecutor.class);

    static final String QUARANTINE_PREFIX = "quarantine/";
    static final String SANITIZED_PREFIX = "sanitized/";

    private final BlobStore blobStore;
    private final AuditTrail auditTrail;
    private final NotificationChannel notificationChannel;
    private final FileSentinelProperties properties;
    private final Sanitizer sanitizer;
    private final ObjectMapper objectMapper;

    public ResponseExecutor(BlobStore blobStore, AuditTrail auditTrail, NotificationChannel notificationChannel,
            FileSentinelProperties properties, Sanitizer sanitizer, ObjectMapper objectMapper) {
        this.blobStore = blobStore;
        this.auditTrail = auditTrail;
        this.notificationChannel = notificationChannel;
        this.properties = properties;
        this.sanitizer = sanitizer;
        this.objectMapper = objectMapper;
    }

    public List<ThreatResponse> execute(ResponsePlan plan, ResponseRequest request) {
        FileDescriptor file = new FileDescriptor(request.metadata().fileId(), request.metadata().fileName(),
                request.content().length, Digests.sha256(request.content()), null, FileDisposition.STORED);

        List<ThreatResponse> responses = new ArrayList<>();
        for (PlannedAction step : plan.getSteps()) {
            ThreatResponseDetails before = ThreatResponseDetails.of(file);
            ThreatResponse response;
            try {
                ThreatResponseDetails details = step.action().accept(new ActionHandler(request, step, before));
                response = ThreatResponse.succeeded(request.scanId(), step.origin(), step.action(),
                        request.actor().actorId(), step.reason(), details);
                file = details.originalFile();
            } catch (RuntimeException e) {
                log.error("[FileSentinel] {} failed for file '{}': {}", step.action(),
                        request.metadata().fileId(), e.getMessage());
                response = ThreatResponse.failed(request.scanId(), step.origin(), step.action(),
                        request.actor().actorId(), step.reason(), before, e.getMessage());
            }
            auditTrail.record(response);
            responses.add(response);
        }
        return responses;
    }

    /**
     * Handles one planned action. Returns the details of what was done and
     * throws {@link ResponseActionException} when it could not be done.
     */
    private class ActionHandler implements ThreatAction.Visitor<ThreatResponseDetails> {

        private final ResponseRequest request;
        private final PlannedAction step;
        private final ThreatResponseDetails details;

        ActionHandler(ResponseRequest request, PlannedAction step, ThreatResponseDetails details) {
            this.request = request;
            this.step = step;
            this.details = details;
        }

        @Override
        public ThreatResponseDetails visitLog() {
            ThreatDetectionResult threats = request.threatResult();
            log.info("[FileSentinel] File '{}' ({}): risk {}, severity {}, {} threats, {} PII findings -> {}",
                    request.metadata().fileName(), request.metadata().fileId(), threats.getRiskScore(),
                    threats.getOverallSeverity(), threats.getThreats().size(), request.piiFindings().size(),
                    threats.getRecommendation());
            return details;
        }

        @Override
        public ThreatResponseDetails visitNotify() {
            NotificationProperties notifications = properties.getNotifications();
            if (!notifications.isEnabled()) {
                log.debug("[FileSentinel] Notifications disabled, nothing sent for '{}'",
                        request.metadata().fileId());
                return details;
            }
            List<NotificationRecord> records = new ArrayList<>();
            if (notifications.getEmail().isEnabled()) {
                String text = emailText();
                for (String recipient : notifications.getEmail().getRecipients()) {
                    records.add(deliver(recipient, NotificationMethod.EMAIL, text, Map.of()));
                }
            }
            if (notifications.getWebhook().isEnabled() && notifications.getWebhook().getUrl() != null) {
                records.add(deliver(notifications.getWebhook().getUrl(), NotificationMethod.WEBHOOK, webhookBody(),
                        notifications.getWebhook().getHeaders()));
            }
            return details.withNotifications(records);
        }

        @Override
        public ThreatResponseDetails visitSanitize() {
            Sanitizer.Result result;
            try {
                result = sanitizer.sanitize(request.content(), request.threatResult().getThreats(),
                        request.piiFindings());
            } catch (CharacterCodingException e) {
                throw new ResponseActionException(ThreatAction.SANITIZE, "Could not decode content", e);
            }
            String name = "sanitized_" + request.metadata().fileName();
            String key = SANITIZED_PREFIX + UUID.randomUUID() + "-" + safeName(request.metadata().fileName());
            Map<String, String> metadata = baseMetadata();
            metadata.put("modifications", String.valueOf(result.modifications().size()));
            store(ThreatAction.SANITIZE, key, result.content(), metadata);

            ProcessedFile processed = new ProcessedFile(name, result.content().length,
                    Digests.sha256(result.content()), key, result.modifications());
            return details.withProcessedFile(processed);
        }

        @Override
        public ThreatResponseDetails visitQuarantine() {
            String key = QUARANTINE_PREFIX + UUID.randomUUID() + "-" + safeName(request.metadata().fileName());
            store(ThreatAction.QUARANTINE, key, request.content(), baseMetadata());

            Instant now = Instant.now();
            FileSentinelProperties.QuarantineProperties quarantine = properties.getQuarantine();
            QuarantineRecord record = new QuarantineRecord(key, now.plus(quarantine.getRetention()),
                    quarantine.getAccessLevel(), true, now.plus(quarantine.getReviewWindow()));
            log.warn("[FileSentinel] Quarantined '{}' at '{}'", request.metadata().fileId(), key);
            recordEvent(SecurityEvent.Type.FILE_QUARANTINED, "Quarantined " + request.metadata().fileName(),
                    Map.of("location", key));
            return details.withQuarantine(record)
                    .withOriginalFile(details.originalFile().withDisposition(FileDisposition.QUARANTINED));
        }

        @Override
        public ThreatResponseDetails visitDelete() {
            log.warn("[FileSentinel] Marked '{}' for deletion", request.metadata().fileId());
            return details.withOriginalFile(details.originalFile().withDisposition(FileDisposition.DELETED));
        }

        @Override
        public ThreatResponseDetails visitBlock() {
            log.warn("[FileSentinel] BLOCKED '{}' ({}): {}", request.metadata().fileName(),
                    request.metadata().fileId(), step.reason());
            ThreatDetectionResult threats = request.threatResult();
            if (threats.hasThreats()) {
                recordEvent(SecurityEvent.Type.MALWARE_BLOCKED, "Blocked " + request.metadata().fileName(),
                        Map.of("riskScore", threats.getRiskScore(), "threats", threats.getThreats().size()));
            }
            FileDisposition current = details.originalFile().disposition();
            // A file already marked for deletion stays deleted
            if (current == FileDisposition.DELETED)
                return details;
            return details.withOriginalFile(details.originalFile().withDisposition(FileDisposition.BLOCKED));
        }

        @Override
        public ThreatResponseDetails visitEscalate() {
            ThreatDetectionResult threats = request.threatResult();
            PiiDetectionResult pii = request.piiResult();
            EscalationTicket ticket = new EscalationTicket(request.scanId(), request.metadata().fileId(),
                    request.metadata().fileName(), threats.getOverallSeverity(), threats.getRiskScore(),
                    threats.getThreats().size(), request.piiFindings().size(),
                    pii != null ? pii.getClassification() : null, request.actor().actorId());
            if (!auditTrail.record(ticket)) {
                throw new ResponseActionException(ThreatAction.ESCALATE, "Escalation ticket could not be stored");
            }
            log.warn("[FileSentinel] Escalated '{}' as ticket {}", request.metadata().fileId(), ticket.getId());
            return details.withEscalationTicket(ticket.getId());
        }

        private void recordEvent(SecurityEvent.Type type, String description, Map<String, Object> context) {
            auditTrail.record(new SecurityEvent(type, request.threatResult().getOverallSeverity(),
                    request.actor().actorId(), request.metadata().fileId(), request.scanId(), description, context));
        }

        private NotificationRecord deliver(String recipient, NotificationMethod method, String message,
                Map<String, String> headers) {
            DeliveryStatus status;
            try {
                status = notificationChannel.send(recipient, method, message,
                        headers != null ? headers : Map.of());
            } catch (RuntimeException e) {
                log.error("[FileSentinel] {} notification to '{}' failed: {}", method, recipient, e.getMessage());
                status = DeliveryStatus.FAILED;
            }
            return new NotificationRecord(recipient, method, Instant.now(), status, message);
        }

        private void store(ThreatAction action, String key, byte[] content, Map<String, String> metadata) {
            try {
                blobStore.put(key, content, metadata);
            } catch (RuntimeException e) {
                auditTrail.getMonitor().recordBlobFailure();
                throw new ResponseActionException(action, "Could not write '" + key + "': " + e.getMessage(), e);
            }
        }

        private Map<String, String> baseMetadata() {
            ThreatDetectionResult threats = request.threatResult();
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("fileId", request.metadata().fileId());
            metadata.put("scanId", request.scanId());
            metadata.put("riskScore", String.valueOf(threats.getRiskScore()));
            metadata.put("severity", threats.getOverallSeverity().name());
            metadata.put("scanTimestamp", threats.getScanTimestamp().toString());
            metadata.put("reason", step.reason() != null ? step.reason() : step.ruleId());
            return metadata;
        }

        private String emailText() {
            ThreatDetectionResult threats = request.threatResult();
            return "Security alert for file '" + request.metadata().fileName() + "' (" + request.metadata().fileId()
                    + "): risk score " + threats.getRiskScore() + ", severity " + threats.getOverallSeverity()
                    + ", " + threats.getThreats().size() + " threats, " + request.piiFindings().size()
                    + " PII findings. Recommendation: " + threats.getRecommendation() + ".";
        }

        private String webhookBody() {
            ThreatDetectionResult threats = request.threatResult();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("event", "filesentinel.security-alert");
            body.put("scanId", request.scanId());
            body.put("fileId", request.metadata().fileId());
            body.put("fileName", request.metadata().fileName());
            body.put("riskScore", threats.getRiskScore());
            body.put("severity", threats.getOverallSeverity().name());
            body.put("recommendation", threats.getRecommendation().name());
            body.put("threats", threats.getThreats().stream()
                    .map(t -> Map.of("signature", t.signature().getId(), "type", t.type().name(),
                            "severity", t.severity().name()))
                    .toList());
            body.put("piiFindings", request.piiFindings().stream()
                    .map(f -> Map.of("type", f.type().name(), "maskedValue", f.maskedValue()))
                    .toList());
            body.put("timestamp", Instant.now().toString());
            try {
                return objectMapper.writeValueAsString(body);
            } catch (JsonProcessingException e) {
                throw new ResponseActionException(ThreatAction.NOTIFY, "Could not render webhook payload", e);
            }
        }
    }

    static String safeName(String fileName) {
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        String cleaned = base.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isEmpty() ? "file" : cleaned;
    }
}
