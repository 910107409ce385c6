package com.filesentinel.module.pii;

import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.detection.ScanErrorCode;
import com.filesentinel.core.detection.ScanException;
import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.intel.ThreatIntelligence;
import com.filesentinel.core.intel.ThreatIntelligenceService;
import com.filesentinel.core.model.ComplianceFlag;
import com.filesentinel.core.model.DataClassification;
import com.filesentinel.core.model.DataHandling;
import com.filesentinel.core.model.FileMetadata;
import com.filesentinel.core.model.PiiDetectionResult;
import com.filesentinel.core.model.PiiFinding;
import com.filesentinel.core.model.PiiPattern;
import com.filesentinel.core.model.PiiType;
import com.filesentinel.core.plugin.PiiDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.CharacterCodingException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;

/**
 * Regex based PII detector.
 *
 * <p>
 * Each pattern from the current threat intelligence runs over the text sample.
 * Candidates go through a type-specific validator and the pattern's own false
 * positive list, and are masked before they become findings. Raw values are
 * never stored or logged.
 * </p>
 */
@Component
public class PiiPatternMatcher implements PiiDetector {

    private static final Logger log = LoggerFactory.getLogger(PiiPatternMatcher.class);
    private static final String ID = "pii-detection";
    private static final int CONTEXT_CHARS = 20;

    private static final Map<PiiType, Integer> CONFIDENCE = new EnumMap<>(Map.of(
            PiiType.SSN, 95,
            PiiType.CREDIT_CARD, 95,
            PiiType.EMAIL, 90,
            PiiType.PHONE_NUMBER, 85,
            PiiType.IP_ADDRESS, 70));
    private static final int DEFAULT_CONFIDENCE = 80;

    private final ThreatIntelligenceService intelligenceService;
    private final FileSentinelProperties properties;
    private final PiiClassifier classifier;

    public PiiPatternMatcher(ThreatIntelligenceService intelligenceService, FileSentinelProperties properties,
            PiiClassifier classifier) {
        this.intelligenceService = intelligenceService;
        this.properties = properties;
        this.classifier = classifier;
    }

    @Override
    public PiiDetectionResult scan(byte[] content, FileMetadata metadata) throws ScanException {
        if (!properties.isPiiDetectionEnabled()) {
            throw new ScanException(ScanErrorCode.CONFIGURATION_DISABLED, "PII detection is disabled");
        }
        if (content.length > properties.getMaxScanSizeBytes()) {
            throw new ScanException(ScanErrorCode.SIZE_EXCEEDED, "File '" + metadata.fileName() + "' is "
                    + content.length + " bytes, limit is " + properties.getMaxScanSizeBytes());
        }
        ScanTarget target;
        try {
            target = ScanTarget.of(content, metadata, properties.getTextSampleBytes());
        } catch (CharacterCodingException e) {
            throw new ScanException(ScanErrorCode.DECODE_FAILURE,
                    "Could not decode text sample of '" + metadata.fileName() + "'", e);
        }
        return scan(target, UUID.randomUUID().toString(), intelligenceService.current());
    }

    @Override
    public PiiDetectionResult scan(ScanTarget target, String scanId, ThreatIntelligence intelligence) {
        List<PiiFinding> findings = detect(target, intelligence.getPiiPatterns());
        DataClassification classification = classifier.classify(findings);
        DataHandling handling = classifier.recommendHandling(classification, findings);
        List<ComplianceFlag> flags = classifier.complianceFlags(findings);

        if (!findings.isEmpty()) {
            log.info("[FileSentinel] [{}] {} finding(s) in '{}' {} -> {} / {}", ID, findings.size(),
                    target.getFileName(), countByType(findings), classification, handling);
        } else {
            log.debug("[FileSentinel] [{}] No PII in '{}'", ID, target.getFileName());
        }

        return new PiiDetectionResult(scanId, target.getMetadata().fileId(), target.getFileName(), findings,
                classification, handling, flags, Instant.now());
    }

    List<PiiFinding> detect(ScanTarget target, List<PiiPattern> patterns) {
        String text = target.getText();
        CharSequence matchable = target.getMatchableText();
        List<PiiFinding> findings = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        try {
            for (PiiPattern pattern : patterns) {
                collect(pattern, pattern.compiled().matcher(matchable), target, text, seen, findings);
            }
        } catch (CancellationException e) {
            log.debug("[FileSentinel] [{}] Matching in '{}' interrupted after {} findings", ID,
                    target.getFileName(), findings.size());
        }
        return findings;
    }

    private static void collect(PiiPattern pattern, Matcher matcher, ScanTarget target, String text,
            Set<String> seen, List<PiiFinding> findings) {
        while (matcher.find()) {
            int start;
            int end;
            if (pattern.hasValueGroup()) {
                start = matcher.start(PiiPattern.valueGroup());
                end = matcher.end(PiiPattern.valueGroup());
                if (start < 0)
                    continue;
            } else {
                start = matcher.start();
                end = matcher.end();
            }
            if (end <= start)
                continue;

            String candidate = text.substring(start, end);
            if (pattern.getFalsePositives().contains(candidate))
                continue;
            if (!PiiValidators.isValid(pattern.getType(), candidate))
                continue;

            String masked = PiiMasking.mask(pattern.getType(), candidate);
            if (!seen.add(pattern.getType() + "@" + start + "@" + masked))
                continue;

            findings.add(new PiiFinding(pattern.getId() + ":" + start, pattern.getType(), masked,
                    confidenceFor(pattern.getType()), target.textLocation(start, end - start),
                    pattern.getSeverity(), pattern.getId(), maskedContext(text, start, end, masked)));
        }
    }

    static int confidenceFor(PiiType type) {
        return CONFIDENCE.getOrDefault(type, DEFAULT_CONFIDENCE);
    }

    private static String maskedContext(String text, int start, int end, String masked) {
        int from = Math.max(0, start - CONTEXT_CHARS);
        int to = Math.min(text.length(), end + CONTEXT_CHARS);
        boolean cutAtStart = from > 0 && !Character.isWhitespace(text.charAt(from - 1));
        boolean cutAtEnd = to < text.length() && !Character.isWhitespace(text.charAt(to));
        String context = PiiMasking.maskContext(text.substring(from, start), cutAtStart, false) + masked
                + PiiMasking.maskContext(text.substring(end, to), false, cutAtEnd);
        return context.replaceAll("[\\r\\n\\t]+", " ");
    }

    private static Map<PiiType, Integer> countByType(List<PiiFinding> findings) {
        Map<PiiType, Integer> counts = new TreeMap<>();
        for (PiiFinding finding : findings) {
            counts.merge(finding.type(), 1, Integer::sum);
        }
        return counts;
    }
}
