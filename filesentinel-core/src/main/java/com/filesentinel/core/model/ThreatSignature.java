package com.filesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A named detection pattern loaded from the threat intelligence database.
 * Immutable once loaded.
 */
public final class ThreatSignature {

    private final String id;
    private final String name;
    private final ThreatType type;
    private final String pattern;
    private final String description;
    private final Severity severity;
    private final int confidence;
    private final String source;
    private final Instant lastUpdated;

    private ThreatSignature(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.name = builder.name != null ? builder.name : builder.id;
        this.type = builder.type != null ? builder.type : ThreatType.UNKNOWN;
        this.pattern = builder.pattern;
        this.description = builder.description;
        this.severity = builder.severity != null ? builder.severity : Severity.MEDIUM;
        if (builder.confidence < 0 || builder.confidence > 100) {
            throw new IllegalArgumentException("confidence must be within 0-100: " + builder.confidence);
        }
        this.confidence = builder.confidence;
        this.source = builder.source != null ? builder.source : "internal";
        this.lastUpdated = builder.lastUpdated != null ? builder.lastUpdated : Instant.EPOCH;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ThreatType getType() {
        return type;
    }

    /** Regex source for textual signatures, or a descriptive marker for synthetic ones. */
    public String getPattern() {
        return pattern;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getConfidence() {
        return confidence;
    }

    public String getSource() {
        return source;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThreatSignature other))
            return false;
        return id.equals(other.id) && Objects.equals(pattern, other.pattern)
                && severity == other.severity && confidence == other.confidence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, pattern, severity, confidence);
    }

    @Override
    public String toString() {
        return "ThreatSignature{id='" + id + "', type=" + type + ", severity=" + severity
                + ", confidence=" + confidence + '}';
    }

    public static class Builder {
        private final String id;
        private String name;
        private ThreatType type;
        private String pattern;
        private String description;
        private Severity severity;
        private int confidence = 50;
        private String source;
        private Instant lastUpdated;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(ThreatType type) {
            this.type = type;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(int confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder lastUpdated(Instant lastUpdated) {
            this.lastUpdated = lastUpdated;
            return this;
        }

        public ThreatSignature build() {
            return new ThreatSignature(this);
        }
    }
}
