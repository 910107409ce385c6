package com.filesentinel.module.signature;

import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.intel.ThreatIntelligence;
import com.filesentinel.core.model.DetectedThreat;
import com.filesentinel.core.model.Severity;
import com.filesentinel.core.model.ThreatSignature;
import com.filesentinel.core.model.ThreatType;
import com.filesentinel.core.plugin.AnalyzerContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.filesentinel.core.support.TestFixtures.context;
import static com.filesentinel.core.support.TestFixtures.properties;
import static com.filesentinel.core.support.TestFixtures.textTarget;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignatureMatcherTest {

    private final SignatureMatcher matcher = new SignatureMatcher();

    private static List<String> ids(List<DetectedThreat> threats) {
        return threats.stream().map(t -> t.signature().getId()).toList();
    }

    @Test
    void obfuscatedJavaScriptHitsBuiltInSignatures() {
        String script = "var a = 1;\neval(atob(\"ZG9jdW1lbnQuY29va2llc3RlYWxlcg==\"));";

        List<DetectedThreat> threats = matcher.analyze(textTarget("loader.js", script), context());

        assertEquals(List.of("mal_001", "mal_002"), ids(threats));
        DetectedThreat eval = threats.get(0);
        assertEquals(2, eval.location().line());
        assertEquals(1, eval.location().column());
        assertEquals(85, eval.confidence());
        assertTrue(eval.context().contains("eval("));
    }

    @Test
    void keyloggerApiIsSpyware() {
        List<DetectedThreat> threats = matcher.analyze(
                textTarget("hook.c", "HHOOK h = SetWindowsHookExA(WH_KEYBOARD_LL, proc, 0, 0);"), context());

        assertEquals(List.of("mal_007"), ids(threats));
        assertEquals(ThreatType.SPYWARE, threats.get(0).type());
    }

    @Test
    void ransomNoteIsCritical() {
        List<DetectedThreat> threats = matcher.analyze(
                textTarget("README.txt", "All your files have been encrypted. Pay the ransom in BTC."), context());

        assertEquals(List.of("mal_006", "mal_006"), ids(threats));
        assertEquals(Severity.CRITICAL, threats.get(0).severity());
    }

    @Test
    void everyOccurrenceIsReported() {
        List<DetectedThreat> threats = matcher.analyze(textTarget("a.js", "eval(x); eval(y);"), context());

        assertEquals(2, threats.size());
        assertEquals(0, threats.get(0).location().offset());
        assertEquals(9, threats.get(1).location().offset());
    }

    @Test
    void invalidPatternIsSkipped() {
        ThreatSignature broken = ThreatSignature.builder("bad_001").name("Broken").type(ThreatType.UNKNOWN)
                .pattern("([unclosed").severity(Severity.LOW).confidence(10).build();
        ThreatSignature good = ThreatSignature.builder("good_001").name("Good").type(ThreatType.PHISHING)
                .pattern("verify your account").severity(Severity.MEDIUM).confidence(60).build();
        AnalyzerContext context = new AnalyzerContext(properties(),
                new ThreatIntelligence("custom", List.of(broken, good), List.of(), List.of()));

        List<DetectedThreat> threats = matcher.analyze(
                textTarget("mail.html", "Please verify your account today"), context);

        assertEquals(List.of("good_001"), ids(threats));
        assertTrue(context.getIntelligence().getSignaturePattern(broken).isEmpty());
    }

    @Test
    void scriptRewritingThePageIsSuspicious() {
        String page = "<html><script type=\"text/javascript\">\nvar x = 1; document.write('<b>hi</b>');\n</script>";

        List<DetectedThreat> threats = matcher.analyze(textTarget("page.html", page), context());

        assertEquals(List.of("mal_003"), ids(threats));
        assertEquals(ThreatType.SUSPICIOUS_SCRIPT, threats.get(0).type());
    }

    @Test
    void repeatedScriptTagsMatchInLinearTime() {
        ScanTarget target = textTarget("tags.html", "<script>".repeat(40000));

        List<DetectedThreat> threats = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> matcher.analyze(target, context()));

        assertTrue(threats.isEmpty());
    }

    @Test
    void backtrackingPatternStopsWhenWorkerIsInterrupted() throws InterruptedException {
        ThreatSignature nested = ThreatSignature.builder("slow_001").name("Nested").type(ThreatType.UNKNOWN)
                .pattern("(a+)+b").severity(Severity.LOW).confidence(10).build();
        AnalyzerContext context = new AnalyzerContext(properties(),
                new ThreatIntelligence("custom", List.of(nested), List.of(), List.of()));
        ScanTarget target = textTarget("a.txt", "a".repeat(64));
        AtomicReference<List<DetectedThreat>> result = new AtomicReference<>();

        Thread worker = new Thread(() -> result.set(matcher.analyze(target, context)), "slow-regex");
        worker.setDaemon(true);
        worker.start();
        Thread.sleep(200);
        worker.interrupt();
        worker.join(5000);

        assertFalse(worker.isAlive());
        assertTrue(result.get().isEmpty());
    }

    @Test
    void patternsAreCompiledOncePerSnapshot() {
        ThreatIntelligence intelligence = context().getIntelligence();
        ThreatSignature eval = intelligence.getSignatures().get(0);

        assertSame(intelligence.getSignaturePattern(eval).orElseThrow(),
                intelligence.getSignaturePattern(eval).orElseThrow());
    }

    @Test
    void plainTextIsClean() {
        ScanTarget target = textTarget("letter.txt", "Dear team,\nthe evaluation went well.\nRegards");

        assertTrue(matcher.analyze(target, context()).isEmpty());
    }
}
