package com.filesentinel.core.model;

/**
 * Kinds of personally identifiable information the matcher knows about.
 */
public enum PiiType {
    SSN,
    CREDIT_CARD,
    PHONE_NUMBER,
    EMAIL,
    IP_ADDRESS,
    DRIVERS_LICENSE,
    PASSPORT,
    DATE_OF_BIRTH,
    BANK_ACCOUNT,
    TAX_ID,
    MEDICAL_RECORD,
    BIOMETRIC,
    GOVERNMENT_ID,
    CUSTOM;

    /** Financial identifiers whose critical findings force a reject regardless of classification. */
    public boolean isFinancialIdentity() {
        return this == SSN || this == CREDIT_CARD || this == BANK_ACCOUNT;
    }
}
