package com.filesentinel.module.hash;

import com.filesentinel.core.detection.Digests;
import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.model.DetectedThreat;
import com.filesentinel.core.model.HashAlgorithm;
import com.filesentinel.core.model.MalwareHash;
import com.filesentinel.core.model.ThreatLocation;
import com.filesentinel.core.model.ThreatSignature;
import com.filesentinel.core.plugin.AnalyzerContext;
import com.filesentinel.core.plugin.ThreatAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compares the upload's digests with known-malware hashes.
 * A hit is the only definitive verdict the engine knows: it pins the risk score
 * to 100 regardless of anything else.
 */
@Component
public class HashMatcher implements ThreatAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(HashMatcher.class);
    private static final String ID = "hash-matching";

    // SHA-256 first so the strongest digest leads the threat list
    private static final List<HashAlgorithm> ALGORITHMS = List.of(
            HashAlgorithm.SHA256, HashAlgorithm.SHA1, HashAlgorithm.MD5);

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Known Malware Hash Matching";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    public List<DetectedThreat> analyze(ScanTarget target, AnalyzerContext context) {
        List<DetectedThreat> threats = new ArrayList<>();
        for (HashAlgorithm algorithm : ALGORITHMS) {
            String digest = Digests.hex(algorithm, target.getContent());
            MalwareHash known = context.getIntelligence().findHash(algorithm, digest);
            if (known == null)
                continue;

            log.warn("[FileSentinel] [{}] '{}' matches known {} hash of {} ({})", ID,
                    target.getFileName(), algorithm, known.malwareFamily(), known.source());

            ThreatSignature signature = ThreatSignature.builder("hash_" + algorithm.name().toLowerCase(Locale.ROOT))
                    .name(known.malwareFamily() != null ? known.malwareFamily() : "Known malware")
                    .type(known.threatType())
                    .pattern(known.hash())
                    .description(known.description() != null ? known.description()
                            : "File matches a known malware " + algorithm + " hash")
                    .severity(known.severity())
                    .confidence(100)
                    .source(known.source())
                    .build();
            threats.add(new DetectedThreat(threatId(signature.getId(), 0), signature,
                    ThreatLocation.wholeFile(target.size()), 100,
                    algorithm + " " + digest, null, true));
        }
        return threats;
    }
}
