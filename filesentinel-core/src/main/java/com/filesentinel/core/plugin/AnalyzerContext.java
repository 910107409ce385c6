package com.filesentinel.core.plugin;

import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.intel.ThreatIntelligence;

import java.util.Map;

/**
 * Shared context passed to each ThreatAnalyzer during one scan.
 * Provides access to configuration and the threat intelligence snapshot.
 */
public class AnalyzerContext {

    private final FileSentinelProperties properties;
    private final ThreatIntelligence intelligence;

    public AnalyzerContext(FileSentinelProperties properties, ThreatIntelligence intelligence) {
        this.properties = properties;
        this.intelligence = intelligence;
    }

    /** Access to configuration properties. */
    public FileSentinelProperties getProperties() {
        return properties;
    }

    /** Signatures, hashes and PII patterns this scan runs against. */
    public ThreatIntelligence getIntelligence() {
        return intelligence;
    }

    /** Custom settings under {@code filesentinel.analyzers.{id}.config}. */
    public Map<String, Object> getAnalyzerConfig(String analyzerId) {
        return properties.getAnalyzerConfig(analyzerId);
    }
}
