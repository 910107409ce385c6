package com.filesentinel.core.model;

/**
 * Automated response actions. Dispatch goes through {@link #accept(Visitor)} so
 * every handler has to cover every action; adding a constant breaks the build
 * until each visitor handles it.
 */
public enum ThreatAction {
    LOG,
    NOTIFY,
    SANITIZE,
    QUARANTINE,
    DELETE,
    BLOCK,
    ESCALATE;

    public <R> R accept(Visitor<R> visitor) {
        return switch (this) {
            case LOG -> visitor.visitLog();
            case NOTIFY -> visitor.visitNotify();
            case SANITIZE -> visitor.visitSanitize();
            case QUARANTINE -> visitor.visitQuarantine();
            case DELETE -> visitor.visitDelete();
            case BLOCK -> visitor.visitBlock();
            case ESCALATE -> visitor.visitEscalate();
        };
    }

    public interface Visitor<R> {
        R visitLog();

        R visitNotify();

        R visitSanitize();

        R visitQuarantine();

        R visitDelete();

        R visitBlock();

        R visitEscalate();
    }
}
