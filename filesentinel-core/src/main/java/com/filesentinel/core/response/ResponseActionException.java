package com.filesentinel.core.response;

import com.filesentinel.core.model.ThreatAction;

/**
 * A response action that could not be carried out. Recorded as a FAILED
 * response; the remaining actions still run.
 */
public class ResponseActionException extends RuntimeException {

    private final ThreatAction action;

    public ResponseActionException(ThreatAction action, String message) {
        super(message);
        this.action = action;
    }

    public ResponseActionException(ThreatAction action, String message, Throwable cause) {
        super(message, cause);
        this.action = action;
    }

    public ThreatAction getAction() {
        return action;
    }
}
