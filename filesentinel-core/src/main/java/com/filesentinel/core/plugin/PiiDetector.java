package com.filesentinel.core.plugin;

import com.filesentinel.core.detection.ScanException;
import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.intel.ThreatIntelligence;
import com.filesentinel.core.model.FileMetadata;
import com.filesentinel.core.model.PiiDetectionResult;

/**
 * Finds, masks and classifies personal data in an upload.
 */
public interface PiiDetector {

    /**
     * Standalone scan against the current threat intelligence.
     */
    PiiDetectionResult scan(byte[] content, FileMetadata metadata) throws ScanException;

    /**
     * Scan an already decoded target. Used by the orchestrator so the threat and
     * PII scans share one text sample, one scan id and one snapshot.
     */
    PiiDetectionResult scan(ScanTarget target, String scanId, ThreatIntelligence intelligence);
}
