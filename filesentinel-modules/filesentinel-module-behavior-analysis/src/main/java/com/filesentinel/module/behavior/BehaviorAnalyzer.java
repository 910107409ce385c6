package com.filesentinel.module.behavior;

import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.model.DetectedThreat;
import com.filesentinel.core.model.Severity;
import com.filesentinel.core.model.ThreatLocation;
import com.filesentinel.core.model.ThreatSignature;
import com.filesentinel.core.model.ThreatType;
import com.filesentinel.core.plugin.AnalyzerContext;
import com.filesentinel.core.plugin.ThreatAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristics about what the content looks like it would do, rather than what it
 * literally contains. Each trigger adds one fixed-confidence threat for the
 * whole file.
 */
@Component
public class BehaviorAnalyzer implements ThreatAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BehaviorAnalyzer.class);
    private static final String ID = "behavior-analysis";

    static final int CONFIDENCE = 75;
    static final double ENTROPY_THRESHOLD = 7.5;
    static final int ENTROPY_MIN_BYTES = 256;
    static final int URL_LIMIT = 20;

    private static final Pattern URL = Pattern.compile("https?://[^\\s\"'<>]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern INJECTION_API = Pattern.compile(
            "\\b(?:CreateProcess[AW]?|VirtualAlloc(?:Ex)?|WriteProcessMemory|CreateRemoteThread"
                    + "|LoadLibrary[AW]?|SetWindowsHook(?:Ex)?[AW]?)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern RAW_SOCKET = Pattern.compile(
            "(?<![.\\w$])(?:socket|WSASocket[AW]?|bind|listen|accept|recvfrom|connect)\\s*\\(");

    private static final ThreatSignature HIGH_ENTROPY = behavior("behavior_high_entropy", "High Entropy Content",
            ThreatType.OBFUSCATED_CODE, Severity.MEDIUM,
            "Byte entropy above " + ENTROPY_THRESHOLD + " bits, typical of packed or encrypted payloads");
    private static final ThreatSignature EXCESSIVE_URLS = behavior("behavior_excessive_urls",
            "Excessive URL References", ThreatType.PHISHING, Severity.MEDIUM,
            "More than " + URL_LIMIT + " URLs in one file");
    private static final ThreatSignature INJECTION_CALLS = behavior("behavior_process_injection",
            "Process Injection API", ThreatType.TROJAN, Severity.HIGH,
            "References to process creation, memory injection or hooking APIs");
    private static final ThreatSignature SOCKET_CALLS = behavior("behavior_raw_socket", "Raw Socket Calls",
            ThreatType.SUSPICIOUS_PATTERN, Severity.MEDIUM,
            "Low-level socket, listen or accept calls");

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Behavioral Analysis";
    }

    @Override
    public int getOrder() {
        return 300;
    }

    @Override
    public boolean isEnabled(AnalyzerContext context) {
        return context.getProperties().isBehaviorAnalysisEnabled() && ThreatAnalyzer.super.isEnabled(context);
    }

    @Override
    public List<DetectedThreat> analyze(ScanTarget target, AnalyzerContext context) {
        List<DetectedThreat> threats = new ArrayList<>();
        byte[] content = target.getContent();
        String text = target.getText();

        if (content.length >= ENTROPY_MIN_BYTES) {
            double entropy = entropy(content);
            if (entropy > ENTROPY_THRESHOLD) {
                threats.add(wholeFile(target, HIGH_ENTROPY,
                        String.format(Locale.ROOT, "entropy %.2f bits/byte", entropy)));
            }
        }

        int urls = count(URL.matcher(text), URL_LIMIT + 1);
        if (urls > URL_LIMIT) {
            threats.add(wholeFile(target, EXCESSIVE_URLS, "more than " + URL_LIMIT + " URLs"));
        }

        Matcher api = INJECTION_API.matcher(text);
        if (api.find()) {
            threats.add(wholeFile(target, INJECTION_CALLS, "references " + api.group()));
        }

        Matcher socket = RAW_SOCKET.matcher(text);
        if (socket.find()) {
            threats.add(wholeFile(target, SOCKET_CALLS, "calls " + socket.group().replaceAll("\\s*\\($", "")));
        }

        if (!threats.isEmpty()) {
            log.debug("[FileSentinel] [{}] {} behavioral triggers in '{}'", ID, threats.size(),
                    target.getFileName());
        }
        return threats;
    }

    /**
     * Shannon entropy of the byte distribution, in bits per byte (0 to 8).
     */
    static double entropy(byte[] content) {
        if (content.length == 0)
            return 0;
        long[] counts = new long[256];
        for (byte b : content) {
            counts[b & 0xFF]++;
        }
        double entropy = 0;
        for (long count : counts) {
            if (count == 0)
                continue;
            double p = (double) count / content.length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    private static int count(Matcher matcher, int stopAt) {
        int n = 0;
        while (n < stopAt && matcher.find()) {
            n++;
        }
        return n;
    }

    private DetectedThreat wholeFile(ScanTarget target, ThreatSignature signature, String context) {
        return new DetectedThreat(threatId(signature.getId(), 0), signature,
                ThreatLocation.wholeFile(target.size()), CONFIDENCE, context, null, false);
    }

    private static ThreatSignature behavior(String id, String name, ThreatType type, Severity severity,
            String description) {
        return ThreatSignature.builder(id)
                .name(name)
                .type(type)
                .pattern("behavioral_analysis")
                .description(description)
                .severity(severity)
                .confidence(CONFIDENCE)
                .source("behavioral_analysis")
                .build();
    }
}
