package com.filesentinel.core.intel;

import com.filesentinel.core.model.HashAlgorithm;
import com.filesentinel.core.model.MalwareHash;
import com.filesentinel.core.model.PiiPattern;
import com.filesentinel.core.model.PiiType;
import com.filesentinel.core.model.Severity;
import com.filesentinel.core.model.ThreatSignature;
import com.filesentinel.core.model.ThreatType;

import java.time.Instant;
import java.util.List;

/**
 * The reference data FileSentinel ships with. Deployments add to it through
 * their {@link ThreatIntelligenceRepository}.
 *
 * <p>
 * Signatures are anchored on word boundaries or call syntax so ordinary prose
 * ("evaluation", "bitcoin price") stays clean. Keyword-anchored PII patterns
 * put the identifier in the {@code value} group.
 * </p>
 */
public final class BuiltInThreatIntelligence {

    static final String VERSION_PREFIX = "1.0.";

    private static final Instant RELEASED = Instant.parse("2024-06-01T00:00:00Z");
    private static final String SOURCE = "filesentinel-builtin";

    private BuiltInThreatIntelligence() {
    }

    public static List<ThreatSignature> signatures() {
        return List.of(
                signature("mal_001", "JavaScript Obfuscation", ThreatType.OBFUSCATED_CODE,
                        "\\beval\\s*\\(|\\bnew\\s+Function\\s*\\(|\\[\\s*[\"']constructor[\"']\\s*\\]",
                        "Dynamic code evaluation commonly used to hide payloads",
                        Severity.HIGH, 85),
                signature("mal_002", "Base64 Decode Call", ThreatType.OBFUSCATED_CODE,
                        "\\batob\\s*\\(\\s*[\"'][A-Za-z0-9+/=]{20,}[\"']\\s*\\)",
                        "Inline base64 literal decoded at runtime",
                        Severity.MEDIUM, 75),
                signature("mal_003", "Suspicious Script Tag", ThreatType.SUSPICIOUS_SCRIPT,
                        "(?is)<script[^>]{0,512}>[^<]{0,4096}?(document\\.write|eval\\s*\\(|innerHTML\\s*=|outerHTML\\s*=)"
                                + ".{0,4096}?</script>",
                        "Script block rewriting the page or evaluating code",
                        Severity.HIGH, 90),
                signature("mal_004", "PowerShell Encoded Command", ThreatType.SUSPICIOUS_SCRIPT,
                        "(?i)\\bpowershell(?:\\.exe)?\\b[^\\r\\n]*?\\s-e(?:nc|ncodedcommand)?\\s+[A-Za-z0-9+/=]{20,}",
                        "PowerShell invoked with an encoded command line",
                        Severity.HIGH, 88),
                signature("mal_005", "Long Base64 Blob", ThreatType.OBFUSCATED_CODE,
                        "[A-Za-z0-9+/]{100,}={0,2}",
                        "Unusually long base64 run, possibly an embedded payload",
                        Severity.MEDIUM, 70),
                signature("mal_006", "Ransom Note", ThreatType.RANSOMWARE,
                        "(?i)\\byour\\s+(?:files|documents)\\s+(?:have\\s+been|are|were)\\s+encrypted\\b"
                                + "|\\bpay\\s+(?:the\\s+)?ransom\\b|\\bransom\\s+note\\b",
                        "Ransom demand wording",
                        Severity.CRITICAL, 80),
                signature("mal_007", "Keylogger", ThreatType.SPYWARE,
                        "(?i)\\b(?:keylogger|getasynckeystate|setwindowshook(?:ex)?[aw]?)\\b",
                        "Keystroke capture APIs or tooling",
                        Severity.HIGH, 85),
                signature("mal_008", "Network Backdoor", ThreatType.BACKDOOR,
                        "(?i)\\breverse[\\s_-]?shell\\b|\\bbind[\\s_-]?shell\\b"
                                + "|\\bnc(?:\\.exe)?\\s+-\\w*l\\w*\\s+(?:-p\\s+)?\\d{2,5}\\b"
                                + "|\\bnetcat\\b[^\\r\\n]*\\blisten\\b",
                        "Remote shell or listener setup",
                        Severity.CRITICAL, 92),
                signature("mal_009", "Cryptominer", ThreatType.SUSPICIOUS_PATTERN,
                        "(?i)\\b(?:coinhive|cryptonight)\\b|stratum\\+tcp://",
                        "Browser or pool-based cryptocurrency mining",
                        Severity.MEDIUM, 80));
    }

    public static List<MalwareHash> malwareHashes() {
        String family = "EICAR-Test-File";
        String description = "EICAR anti-malware test file";
        return List.of(
                new MalwareHash("275a021bbfb6489e54d471899f7db9d1663fc695ec2fe2a2c4538aabf651fd0f",
                        HashAlgorithm.SHA256, family, ThreatType.MALWARE, Severity.CRITICAL, "eicar.org",
                        description),
                new MalwareHash("3395856ce81f2b7382dee72602f798b642f14140",
                        HashAlgorithm.SHA1, family, ThreatType.MALWARE, Severity.CRITICAL, "eicar.org",
                        description),
                new MalwareHash("44d88612fea8a8f36de82e1278abb02f",
                        HashAlgorithm.MD5, family, ThreatType.MALWARE, Severity.CRITICAL, "eicar.org",
                        description));
    }

    public static List<PiiPattern> piiPatterns() {
        return List.of(
                new PiiPattern("ssn_us", PiiType.SSN,
                        "\\b(?!000|666|9\\d{2})\\d{3}-(?!00)\\d{2}-(?!0000)\\d{4}\\b",
                        "US Social Security Number", Severity.CRITICAL, "US",
                        List.of("123-45-6789"), List.of("000-00-0000", "123-00-0000")),
                new PiiPattern("credit_card", PiiType.CREDIT_CARD,
                        "\\b(?:4\\d{12}(?:\\d{3})?|5[1-5]\\d{14}|3[47]\\d{13}|3(?:0[0-5]|[68]\\d)\\d{11}"
                                + "|6(?:011|5\\d{2})\\d{12})\\b",
                        "Credit card number (Visa, MasterCard, Amex, Diners, Discover)", Severity.CRITICAL, null,
                        List.of("4111111111111111", "5555555555554444"),
                        List.of("0000000000000000", "1111111111111111")),
                new PiiPattern("credit_card_grouped", PiiType.CREDIT_CARD,
                        "\\b(?:4\\d{3}|5[1-5]\\d{2}|6011|65\\d{2})([- ])\\d{4}\\1\\d{4}\\1\\d{4}\\b",
                        "Credit card number written in groups of four", Severity.CRITICAL, null,
                        List.of("4111-1111-1111-1111", "5555 5555 5555 4444"), List.of()),
                new PiiPattern("phone_us", PiiType.PHONE_NUMBER,
                        "(?<!\\d)(?:\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}(?!\\d)",
                        "US phone number", Severity.MEDIUM, "US",
                        List.of("(415) 555-2671", "+1-415-555-2671"), List.of("000-000-0000", "123-456-7890")),
                new PiiPattern("email", PiiType.EMAIL,
                        "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b",
                        "Email address", Severity.MEDIUM, null,
                        List.of("jane.doe@acme.io"), List.of("test@test.com", "example@example.com")),
                new PiiPattern("ip_address", PiiType.IP_ADDRESS,
                        "\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b",
                        "IPv4 address", Severity.LOW, null,
                        List.of("203.0.113.42"), List.of("0.0.0.0", "127.0.0.1")),
                new PiiPattern("drivers_license_us", PiiType.DRIVERS_LICENSE,
                        "(?i)\\b(?:driver'?s?\\s+licen[cs]e|DL)\\s*(?:no\\.?|number|#)?\\s*[:#]?\\s*"
                                + "(?<value>[A-Z]{1,2}\\d{6,8})\\b",
                        "US driver's license number next to its label", Severity.HIGH, "US",
                        List.of("Driver's license: CA1234567"), List.of()),
                new PiiPattern("passport", PiiType.PASSPORT,
                        "(?i)\\bpassport\\s*(?:no\\.?|number|#)?\\s*[:#]?\\s*(?<value>[A-Z]{1,2}\\d{6,9})\\b",
                        "Passport number next to its label", Severity.HIGH, null,
                        List.of("Passport No: X12345678"), List.of()),
                new PiiPattern("date_of_birth", PiiType.DATE_OF_BIRTH,
                        "(?i)\\b(?:dob|date\\s+of\\s+birth|birth\\s*date)\\s*[:-]?\\s*"
                                + "(?<value>(?:0[1-9]|1[0-2])[/-](?:0[1-9]|[12]\\d|3[01])[/-](?:19|20)\\d{2})\\b",
                        "Date of birth (MM/DD/YYYY) next to its label", Severity.HIGH, "US",
                        List.of("DOB: 01/15/1990"), List.of()),
                new PiiPattern("bank_account", PiiType.BANK_ACCOUNT,
                        "(?i)\\b(?:bank\\s+)?(?:account|acct)\\s*(?:no\\.?|number|num|#)?\\s*[:#]?\\s*"
                                + "(?<value>\\d{8,17})\\b",
                        "Bank account number next to its label", Severity.CRITICAL, null,
                        List.of("Account number: 000123456789"), List.of("00000000", "11111111")),
                new PiiPattern("tax_id", PiiType.TAX_ID,
                        "(?i)\\b(?:ein|tin|tax\\s*id)\\s*(?:no\\.?|number|#)?\\s*[:#]?\\s*(?<value>\\d{2}-\\d{7})\\b",
                        "Employer or taxpayer identification number", Severity.CRITICAL, "US",
                        List.of("EIN: 12-3456789"), List.of("00-0000000")),
                new PiiPattern("medical_record", PiiType.MEDICAL_RECORD,
                        "(?i)\\b(?:mrn|medical\\s+record\\s*(?:no\\.?|number|#)?)\\s*[:#]?\\s*(?<value>(?=[A-Z]*\\d)[A-Z0-9]{6,12})\\b",
                        "Medical record number next to its label", Severity.HIGH, null,
                        List.of("MRN: 00482913"), List.of()));
    }

    private static ThreatSignature signature(String id, String name, ThreatType type, String pattern,
            String description, Severity severity, int confidence) {
        return ThreatSignature.builder(id)
                .name(name)
                .type(type)
                .pattern(pattern)
                .description(description)
                .severity(severity)
                .confidence(confidence)
                .source(SOURCE)
                .lastUpdated(RELEASED)
                .build();
    }
}
