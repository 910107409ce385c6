package com.filesentinel.core.response;

import com.filesentinel.core.model.ActorContext;
import com.filesentinel.core.model.FileMetadata;
import com.filesentinel.core.model.PiiDetectionResult;
import com.filesentinel.core.model.PiiFinding;
import com.filesentinel.core.model.ThreatDetectionResult;

import java.util.List;

/**
 * The upload and scan outcome a response plan is executed against.
 *
 * @param piiResult null when PII detection did not run
 */
public record ResponseRequest(String scanId, byte[] content, FileMetadata metadata,
        ThreatDetectionResult threatResult, PiiDetectionResult piiResult, ActorContext actor) {

    public List<PiiFinding> piiFindings() {
        return piiResult != null ? piiResult.getFindings() : List.of();
    }
}
