package com.filesentinel.core.model;

/**
 * Which detection result an executed action answers to.
 */
public enum ResponseOrigin {
    THREAT_DETECTION,
    PII_DETECTION,
    /** Actions the policy adds on its own, e.g. the audit log entry. */
    POLICY
}
