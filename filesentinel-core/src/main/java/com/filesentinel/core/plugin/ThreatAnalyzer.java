package com.filesentinel.core.plugin;

import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.model.DetectedThreat;

import java.util.List;

/**
 * The plugin interface every FileSentinel threat analyzer implements.
 * Each analyzer looks at an upload from one angle (hashes, signatures,
 * structure...) and reports what it found.
 *
 * <p>
 * Analyzers are discovered automatically via Spring's component scanning.
 * Simply annotate your implementation with {@code @Component}.
 * </p>
 *
 * <p>
 * <b>Threading:</b> {@link #analyze} runs on the shared scan executor in
 * parallel with the other analyzers and may be interrupted when the scan
 * deadline passes. Implementations must be stateless between calls.
 * </p>
 */
public interface ThreatAnalyzer {

    /**
     * Unique identifier for this analyzer. Used in configuration keys:
     * {@code filesentinel.analyzers.{id}.enabled}, and as the prefix of the
     * threat ids it produces.
     */
    String getId();

    /**
     * Human-readable name for logging.
     */
    String getName();

    /**
     * Merge order. Lower values come first in the scan result.
     * Built-in analyzers use: 100 (hash), 200 (signature), 300 (behavior),
     * 400 (extension), 500 (structure).
     */
    default int getOrder() {
        return 500;
    }

    /**
     * Inspect one upload.
     *
     * @param target  Raw bytes, metadata and the decoded text sample
     * @param context Settings and the threat intelligence snapshot for this scan
     * @return Threats found, in the order they were found. Never null.
     */
    List<DetectedThreat> analyze(ScanTarget target, AnalyzerContext context);

    /**
     * Whether this analyzer is enabled. Checked against configuration.
     */
    default boolean isEnabled(AnalyzerContext context) {
        return context.getProperties().isAnalyzerEnabled(getId());
    }

    /**
     * Deterministic threat id: analyzer id, signature id and offset.
     */
    default String threatId(String signatureId, int offset) {
        return getId() + ":" + signatureId + ":" + offset;
    }
}
