package com.filesentinel.module.signature;

import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.intel.ThreatIntelligence;
import com.filesentinel.core.model.DetectedThreat;
import com.filesentinel.core.model.ThreatSignature;
import com.filesentinel.core.plugin.AnalyzerContext;
import com.filesentinel.core.plugin.ThreatAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs every threat signature regex over the text sample.
 *
 * <p>
 * One threat per match. Different signatures may report overlapping spans; only
 * the same signature at the same offset is reported once.
 * </p>
 */
@Component
public class SignatureMatcher implements ThreatAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SignatureMatcher.class);
    private static final String ID = "signature-matching";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Signature Matching";
    }

    @Override
    public int getOrder() {
        return 200;
    }

    @Override
    public List<DetectedThreat> analyze(ScanTarget target, AnalyzerContext context) {
        ThreatIntelligence intelligence = context.getIntelligence();
        CharSequence text = target.getMatchableText();
        List<DetectedThreat> threats = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        try {
            for (ThreatSignature signature : intelligence.getSignatures()) {
                Optional<Pattern> pattern = intelligence.getSignaturePattern(signature);
                if (pattern.isEmpty())
                    continue;

                Matcher matcher = pattern.get().matcher(text);
                while (matcher.find()) {
                    int start = matcher.start();
                    int length = matcher.end() - start;
                    if (length == 0)
                        continue;
                    if (!seen.add(signature.getId() + "@" + start))
                        continue;
                    threats.add(DetectedThreat.of(threatId(signature.getId(), start), signature,
                            target.textLocation(start, length), target.snippet(start, length)));
                }
            }
        } catch (CancellationException e) {
            log.debug("[FileSentinel] [{}] Matching in '{}' interrupted after {} hits", ID, target.getFileName(),
                    threats.size());
            return threats;
        }

        if (!threats.isEmpty()) {
            log.debug("[FileSentinel] [{}] {} signature hits in '{}'", ID, threats.size(), target.getFileName());
        }
        return threats;
    }
}
