package com.filesentinel.core.model;

/**
 * Categories of malicious content a signature or heuristic can report.
 */
public enum ThreatType {
    MALWARE,
    VIRUS,
    TROJAN,
    RANSOMWARE,
    SPYWARE,
    BACKDOOR,
    OBFUSCATED_CODE,
    EMBEDDED_EXECUTABLE,
    SUSPICIOUS_SCRIPT,
    SUSPICIOUS_PATTERN,
    PHISHING,
    UNKNOWN;

    /**
     * Types that always force a block + escalation regardless of score.
     */
    public boolean isHostile() {
        return this == RANSOMWARE || this == MALWARE || this == BACKDOOR;
    }

    public String mitigation() {
        return switch (this) {
            case MALWARE -> "Block file and quarantine immediately";
            case VIRUS -> "Delete file and scan the uploading system";
            case TROJAN -> "Block file and investigate the source";
            case RANSOMWARE -> "Block immediately and alert the security team";
            case SPYWARE -> "Block file and check for data exfiltration";
            case BACKDOOR -> "Block file and audit system access";
            case OBFUSCATED_CODE -> "Analyze obfuscated content and block if malicious";
            case EMBEDDED_EXECUTABLE -> "Extract and analyze embedded content";
            case SUSPICIOUS_SCRIPT -> "Review script content and block if malicious";
            case SUSPICIOUS_PATTERN -> "Manual review recommended";
            case PHISHING -> "Block file and warn recipients";
            case UNKNOWN -> "Manual investigation required";
        };
    }
}
