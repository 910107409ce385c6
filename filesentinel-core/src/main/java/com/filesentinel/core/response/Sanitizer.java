package com.filesentinel.core.response;

import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.model.DetectedThreat;
import com.filesentinel.core.model.PiiFinding;
import com.filesentinel.core.model.ThreatLocation;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds a redacted copy of a text upload. Only spans located in the decoded
 * text are rewritten; file-level and binary findings are left alone.
 *
 * <p>
 * Spans are picked in start order and a span overlapping an already picked one
 * is skipped, then replacements are applied back to front so earlier offsets
 * stay valid.
 * </p>
 */
public class Sanitizer {

    public record Result(byte[] content, List<String> modifications) {
    }

    private record Span(int start, int end, String replacement, String description) {
    }

    private final RedactionTokens tokens;

    public Sanitizer() {
        this(RedactionTokens.defaults());
    }

    public Sanitizer(RedactionTokens tokens) {
        this.tokens = tokens;
    }

    public Result sanitize(byte[] content, List<DetectedThreat> threats, List<PiiFinding> findings)
            throws CharacterCodingException {
        String text = ScanTarget.decode(content, content.length);

        List<Span> candidates = new ArrayList<>();
        for (DetectedThreat threat : threats) {
            ThreatLocation loc = threat.location();
            if (loc.section() == ThreatLocation.Section.TEXT) {
                candidates.add(new Span(loc.offset(), loc.end(), tokens.forThreat(),
                        "Removed " + threat.signature().getName() + " at offset " + loc.offset()));
            }
        }
        for (PiiFinding finding : findings) {
            ThreatLocation loc = finding.location();
            if (loc.section() == ThreatLocation.Section.TEXT) {
                candidates.add(new Span(loc.offset(), loc.end(), tokens.forPii(finding.type()),
                        "Redacted " + finding.type() + " at offset " + loc.offset()));
            }
        }
        candidates.sort(Comparator.comparingInt(Span::start)
                .thenComparing(Comparator.comparingInt(Span::end).reversed()));

        List<Span> picked = new ArrayList<>();
        int coveredUntil = 0;
        for (Span span : candidates) {
            if (span.end() > text.length() || span.start() < coveredUntil)
                continue;
            picked.add(span);
            coveredUntil = span.end();
        }

        StringBuilder out = new StringBuilder(text);
        for (int i = picked.size() - 1; i >= 0; i--) {
            Span span = picked.get(i);
            out.replace(span.start(), span.end(), span.replacement());
        }

        List<String> modifications = picked.stream().map(Span::description).toList();
        return new Result(out.toString().getBytes(StandardCharsets.UTF_8), modifications);
    }
}
