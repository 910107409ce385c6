package com.filesentinel.core.detection;

/**
 * A scan that did not produce a result. Never partial: either every enabled
 * analyzer contributed or the scan fails with one of these.
 */
public class ScanException extends Exception {

    private final ScanErrorCode code;

    public ScanException(ScanErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ScanException(ScanErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ScanErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
