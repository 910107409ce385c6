package com.filesentinel.module.structure;

import com.filesentinel.core.model.DetectedThreat;
import com.filesentinel.core.model.Severity;
import com.filesentinel.core.model.ThreatLocation;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.filesentinel.core.support.TestFixtures.context;
import static com.filesentinel.core.support.TestFixtures.target;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructureAnalyzerTest {

    private static final byte[] ZIP = { 0x50, 0x4B, 0x03, 0x04 };

    private final StructureAnalyzer analyzer = new StructureAnalyzer();

    private static byte[] padded(int size) {
        byte[] content = new byte[size];
        Arrays.fill(content, (byte) ' ');
        return content;
    }

    private static void put(byte[] content, int at, byte[] bytes) {
        System.arraycopy(bytes, 0, content, at, bytes.length);
    }

    @Test
    void archiveHiddenInsideDocumentIsReported() {
        byte[] content = padded(400);
        put(content, 250, ZIP);

        List<DetectedThreat> threats = analyzer.analyze(target("report.pdf", content), context());

        assertEquals(1, threats.size());
        assertEquals("embedded_zip", threats.get(0).signature().getId());
        assertEquals(ThreatLocation.Section.BINARY, threats.get(0).location().section());
        assertEquals(250, threats.get(0).location().offset());
        assertEquals(Severity.MEDIUM, threats.get(0).severity());
    }

    @Test
    void leadingHeaderIsTheFileItself() {
        byte[] content = padded(400);
        put(content, 0, ZIP);
        put(content, StructureAnalyzer.HEADER_TOLERANCE, ZIP);

        assertTrue(analyzer.analyze(target("archive.zip", content), context()).isEmpty());
    }

    @Test
    void peNeedsAValidHeaderPointer() {
        byte[] content = padded(1024);
        int mz = 300;
        put(content, mz, new byte[] { 'M', 'Z' });
        // e_lfanew = 0x80
        put(content, mz + 0x3C, new byte[] { (byte) 0x80, 0, 0, 0 });
        put(content, mz + 0x80, new byte[] { 'P', 'E', 0, 0 });

        List<DetectedThreat> threats = analyzer.analyze(target("doc.bin", content), context());

        assertEquals(List.of("embedded_pe"), threats.stream().map(t -> t.signature().getId()).toList());
        assertEquals(Severity.HIGH, threats.get(0).severity());
        assertTrue(StructureAnalyzer.hasPeHeader(content, mz));
    }

    @Test
    void bareMzIsIgnored() {
        byte[] content = padded(600);
        put(content, 300, new byte[] { 'M', 'Z' });

        assertFalse(StructureAnalyzer.hasPeHeader(content, 300));
        assertTrue(analyzer.analyze(target("notes.txt", content), context()).isEmpty());
    }

    @Test
    void reportsPerKindAreCapped() {
        byte[] content = padded(2000);
        for (int at = 200; at < 1900; at += 50) {
            put(content, at, ZIP);
        }

        List<DetectedThreat> threats = analyzer.analyze(target("many.bin", content), context());

        assertEquals(StructureAnalyzer.MAX_REPORTS_PER_KIND, threats.size());
    }

    @Test
    void indexOfFindsNeedle() {
        byte[] haystack = { 1, 2, 3, 1, 2, 3 };

        assertEquals(0, StructureAnalyzer.indexOf(haystack, new byte[] { 1, 2 }, 0));
        assertEquals(3, StructureAnalyzer.indexOf(haystack, new byte[] { 1, 2 }, 1));
        assertEquals(-1, StructureAnalyzer.indexOf(haystack, new byte[] { 3, 4 }, 0));
    }
}
