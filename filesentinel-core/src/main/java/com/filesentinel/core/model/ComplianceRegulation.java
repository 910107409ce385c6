package com.filesentinel.core.model;

public enum ComplianceRegulation {
    GDPR,
    CCPA,
    HIPAA,
    PCI_DSS,
    SOX,
    GLBA,
    FERPA,
    COPPA
}
