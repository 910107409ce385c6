package com.filesentinel.core.detection;

/**
 * Why a scan could not produce a result.
 */
public enum ScanErrorCode {

    /** Malware detection is switched off. */
    CONFIGURATION_DISABLED(false),

    /** The upload is larger than the configured scan limit. */
    SIZE_EXCEEDED(false),

    /** The analyzers did not finish before the scan deadline. */
    TIMEOUT(true),

    /** The text sample could not be decoded. */
    DECODE_FAILURE(false),

    /** The scanning thread was interrupted while waiting for analyzers. */
    INTERRUPTED(true),

    /** The scan executor refused the work because it is saturated or shut down. */
    EXECUTOR_REJECTED(true);

    private final boolean retryable;

    ScanErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether the caller may try the same scan again. FileSentinel itself never
     * retries.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
