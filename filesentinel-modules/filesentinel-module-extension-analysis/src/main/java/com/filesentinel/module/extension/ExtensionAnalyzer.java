package com.filesentinel.module.extension;

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
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks only at the file name: executable-class extensions and disguises such as
 * {@code invoice.pdf.exe}.
 */
@Component
public class ExtensionAnalyzer implements ThreatAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ExtensionAnalyzer.class);
    private static final String ID = "extension-analysis";

    // Windows executables, scripts and installer formats
    static final Set<String> SUSPICIOUS_EXTENSIONS = Set.of(
            "exe", "scr", "bat", "cmd", "com", "pif", "vbs", "js", "jar",
            "ps1", "psm1", "psd1", "dll", "sys", "drv", "ocx", "cpl",
            "msi", "msp", "mst", "scf", "lnk", "inf", "reg");

    // Compound extensions that are legitimately written as two parts
    static final Set<String> BENIGN_COMPOUNDS = Set.of(
            "tar.gz", "tar.bz2", "tar.xz", "tar.zst", "tar.lz");

    private static final Pattern DOUBLE_EXTENSION = Pattern.compile("\\.([a-z0-9]{2,4})\\.([a-z0-9]{2,4})$",
            Pattern.CASE_INSENSITIVE);

    private static final ThreatSignature DOUBLE_EXTENSION_SIGNATURE = ThreatSignature.builder("double_extension")
            .name("Double File Extension")
            .type(ThreatType.SUSPICIOUS_PATTERN)
            .pattern(DOUBLE_EXTENSION.pattern())
            .description("File has a double extension (potential disguise)")
            .severity(Severity.MEDIUM)
            .confidence(70)
            .source("extension_analysis")
            .build();

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "File Extension Analysis";
    }

    @Override
    public int getOrder() {
        return 400;
    }

    @Override
    public List<DetectedThreat> analyze(ScanTarget target, AnalyzerContext context) {
        String fileName = target.getFileName();
        List<DetectedThreat> threats = new ArrayList<>();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1)
            return threats;

        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (SUSPICIOUS_EXTENSIONS.contains(extension)) {
            ThreatSignature signature = ThreatSignature.builder("ext_" + extension)
                    .name("Executable Extension ." + extension)
                    .type(ThreatType.SUSPICIOUS_PATTERN)
                    .pattern("\\." + extension + "$")
                    .description("File has suspicious extension: ." + extension)
                    .severity(Severity.HIGH)
                    .confidence(80)
                    .source("extension_analysis")
                    .build();
            threats.add(new DetectedThreat(threatId(signature.getId(), dot), signature,
                    ThreatLocation.fileName(dot, fileName.length() - dot), 80,
                    "File extension ." + extension + " is commonly used for malware",
                    "Block execution and scan for embedded threats", false));
        }

        Matcher matcher = DOUBLE_EXTENSION.matcher(fileName);
        if (matcher.find()) {
            String compound = (matcher.group(1) + "." + matcher.group(2)).toLowerCase(Locale.ROOT);
            if (!BENIGN_COMPOUNDS.contains(compound)) {
                int start = matcher.start();
                threats.add(new DetectedThreat(threatId(DOUBLE_EXTENSION_SIGNATURE.getId(), start),
                        DOUBLE_EXTENSION_SIGNATURE, ThreatLocation.fileName(start, fileName.length() - start), 70,
                        "Double extension ." + compound + " can disguise the real file type",
                        "Additional scanning recommended", false));
            }
        }

        if (!threats.isEmpty()) {
            log.debug("[FileSentinel] [{}] Suspicious file name '{}'", ID, fileName);
        }
        return threats;
    }
}
