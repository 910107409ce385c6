package com.filesentinel.core.intel;

import com.filesentinel.core.model.HashAlgorithm;
import com.filesentinel.core.model.MalwareHash;
import com.filesentinel.core.model.PiiPattern;
import com.filesentinel.core.model.ThreatSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable snapshot of the reference data one scan runs against. A scan keeps
 * the snapshot it started with even if a refresh lands halfway through.
 */
public final class ThreatIntelligence {

    private static final Logger log = LoggerFactory.getLogger(ThreatIntelligence.class);

    private final String version;
    private final List<ThreatSignature> signatures;
    private final List<MalwareHash> malwareHashes;
    private final List<PiiPattern> piiPatterns;
    private final Map<HashAlgorithm, Map<String, MalwareHash>> hashIndex;
    // Signature id to compiled regex; signatures without a usable regex are absent
    private final Map<String, Pattern> signaturePatterns;
    private final Instant loadedAt;

    public ThreatIntelligence(String version, List<ThreatSignature> signatures,
            List<MalwareHash> malwareHashes, List<PiiPattern> piiPatterns) {
        this.version = version;
        this.signatures = List.copyOf(signatures);
        this.malwareHashes = List.copyOf(malwareHashes);
        this.piiPatterns = List.copyOf(piiPatterns);
        this.loadedAt = Instant.now();

        Map<HashAlgorithm, Map<String, MalwareHash>> index = new EnumMap<>(HashAlgorithm.class);
        for (MalwareHash hash : this.malwareHashes) {
            index.computeIfAbsent(hash.algorithm(), a -> new HashMap<>()).put(hash.hash(), hash);
        }
        this.hashIndex = index;

        Map<String, Pattern> compiled = new HashMap<>();
        for (ThreatSignature signature : this.signatures) {
            if (signature.getPattern() == null)
                continue;
            try {
                compiled.put(signature.getId(), Pattern.compile(signature.getPattern()));
            } catch (PatternSyntaxException e) {
                log.error("[FileSentinel] Signature '{}' in intelligence {} has an invalid pattern, skipping it: {}",
                        signature.getId(), version, e.getDescription());
            }
        }
        this.signaturePatterns = compiled;
    }

    public String getVersion() {
        return version;
    }

    public List<ThreatSignature> getSignatures() {
        return signatures;
    }

    /**
     * The signature's regex, compiled once when this snapshot was built. Empty
     * when the signature has no pattern or the pattern does not compile.
     */
    public Optional<Pattern> getSignaturePattern(ThreatSignature signature) {
        return Optional.ofNullable(signaturePatterns.get(signature.getId()));
    }

    public List<MalwareHash> getMalwareHashes() {
        return malwareHashes;
    }

    public List<PiiPattern> getPiiPatterns() {
        return piiPatterns;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    /**
     * Exact lookup of a hex digest. Only hashes of the same algorithm can match.
     */
    public MalwareHash findHash(HashAlgorithm algorithm, String hexDigest) {
        Map<String, MalwareHash> byHash = hashIndex.get(algorithm);
        if (byHash == null)
            return null;
        return byHash.get(hexDigest.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "ThreatIntelligence{version='" + version + "', signatures=" + signatures.size()
                + ", hashes=" + malwareHashes.size() + ", piiPatterns=" + piiPatterns.size() + '}';
    }
}
