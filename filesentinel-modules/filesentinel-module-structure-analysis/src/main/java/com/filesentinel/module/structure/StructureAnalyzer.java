package com.filesentinel.module.structure;

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
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Finds other files hidden inside an upload by their magic bytes. A magic
 * number in the first {@value #HEADER_TOLERANCE} bytes is the file's own header
 * and is ignored.
 */
@Component
public class StructureAnalyzer implements ThreatAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(StructureAnalyzer.class);
    private static final String ID = "structure-analysis";

    static final int HEADER_TOLERANCE = 100;
    static final int MAX_REPORTS_PER_KIND = 16;

    private static final int PE_POINTER_OFFSET = 0x3C;
    private static final byte[] PE_HEADER = { 'P', 'E', 0, 0 };

    private static final List<EmbeddedKind> KINDS = List.of(
            new EmbeddedKind("ZIP", "Embedded ZIP Archive", new byte[] { 0x50, 0x4B, 0x03, 0x04 }, Severity.MEDIUM),
            new EmbeddedKind("PE", "Embedded PE Executable", new byte[] { 0x4D, 0x5A }, Severity.HIGH),
            new EmbeddedKind("ELF", "Embedded ELF Executable", new byte[] { 0x7F, 0x45, 0x4C, 0x46 },
                    Severity.HIGH),
            new EmbeddedKind("JPEG", "Embedded JPEG", new byte[] { (byte) 0xFF, (byte) 0xD8, (byte) 0xFF },
                    Severity.MEDIUM),
            new EmbeddedKind("PNG", "Embedded PNG", new byte[] { (byte) 0x89, 0x50, 0x4E, 0x47 },
                    Severity.MEDIUM));

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "File Structure Analysis";
    }

    @Override
    public int getOrder() {
        return 500;
    }

    @Override
    public List<DetectedThreat> analyze(ScanTarget target, AnalyzerContext context) {
        byte[] content = target.getContent();
        List<DetectedThreat> threats = new ArrayList<>();

        for (EmbeddedKind kind : KINDS) {
            int reported = 0;
            int from = HEADER_TOLERANCE + 1;
            int position;
            while (reported < MAX_REPORTS_PER_KIND && (position = indexOf(content, kind.magic, from)) >= 0) {
                from = position + 1;
                // "MZ" alone is too common; require the DOS stub to point at a PE header
                if ("PE".equals(kind.type) && !hasPeHeader(content, position))
                    continue;
                threats.add(new DetectedThreat(threatId(kind.signature.getId(), position), kind.signature,
                        ThreatLocation.binary(position, kind.magic.length), 85,
                        "Embedded " + kind.type + " file found at offset " + position,
                        "Extract and analyze embedded content", false));
                reported++;
            }
            if (reported == MAX_REPORTS_PER_KIND) {
                log.debug("[FileSentinel] [{}] Stopped reporting embedded {} after {} hits in '{}'", ID,
                        kind.type, MAX_REPORTS_PER_KIND, target.getFileName());
            }
        }
        return threats;
    }

    static int indexOf(byte[] haystack, byte[] needle, int from) {
        outer:
        for (int i = Math.max(0, from); i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j])
                    continue outer;
            }
            return i;
        }
        return -1;
    }

    static boolean hasPeHeader(byte[] content, int mzOffset) {
        int pointerAt = mzOffset + PE_POINTER_OFFSET;
        if (pointerAt + 4 > content.length)
            return false;
        int peOffset = (content[pointerAt] & 0xFF)
                | (content[pointerAt + 1] & 0xFF) << 8
                | (content[pointerAt + 2] & 0xFF) << 16
                | (content[pointerAt + 3] & 0xFF) << 24;
        long headerAt = (long) mzOffset + peOffset;
        if (peOffset < 0 || headerAt + PE_HEADER.length > content.length)
            return false;
        for (int i = 0; i < PE_HEADER.length; i++) {
            if (content[(int) headerAt + i] != PE_HEADER[i])
                return false;
        }
        return true;
    }

    private static final class EmbeddedKind {
        final String type;
        final byte[] magic;
        final ThreatSignature signature;

        EmbeddedKind(String type, String name, byte[] magic, Severity severity) {
            this.type = type;
            this.magic = magic;
            this.signature = ThreatSignature.builder("embedded_" + type.toLowerCase(Locale.ROOT))
                    .name(name)
                    .type(ThreatType.EMBEDDED_EXECUTABLE)
                    .pattern(HexFormat.ofDelimiter(" ").formatHex(magic))
                    .description("Embedded " + type + " file detected")
                    .severity(severity)
                    .confidence(85)
                    .source("structure_analysis")
                    .build();
        }
    }
}
