package com.filesentinel.core.model;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reference definition of one PII detector. Immutable.
 *
 * <p>
 * A pattern may declare a named group {@code value}; when it does, only that
 * group is treated as the PII (useful for keyword-anchored patterns such as
 * "account no. 12345678").
 * </p>
 */
public final class PiiPattern {

    private static final String VALUE_GROUP = "value";

    private final String id;
    private final PiiType type;
    private final String regex;
    private final String description;
    private final Severity severity;
    private final String locale;
    private final List<String> examples;
    private final List<String> falsePositives;
    private final Pattern compiled;
    private final boolean hasValueGroup;

    public PiiPattern(String id, PiiType type, String regex, String description, Severity severity,
            String locale, List<String> examples, List<String> falsePositives) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.regex = Objects.requireNonNull(regex, "regex");
        this.description = description;
        this.severity = severity != null ? severity : Severity.MEDIUM;
        this.locale = locale;
        this.examples = examples != null ? List.copyOf(examples) : List.of();
        this.falsePositives = falsePositives != null ? List.copyOf(falsePositives) : List.of();
        this.compiled = Pattern.compile(regex);
        this.hasValueGroup = regex.contains("(?<" + VALUE_GROUP + ">");
    }

    public String getId() {
        return id;
    }

    public PiiType getType() {
        return type;
    }

    public String getRegex() {
        return regex;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getLocale() {
        return locale;
    }

    public List<String> getExamples() {
        return examples;
    }

    public List<String> getFalsePositives() {
        return falsePositives;
    }

    public Pattern compiled() {
        return compiled;
    }

    public boolean hasValueGroup() {
        return hasValueGroup;
    }

    public static String valueGroup() {
        return VALUE_GROUP;
    }

    @Override
    public String toString() {
        return "PiiPattern{id='" + id + "', type=" + type + ", severity=" + severity + '}';
    }
}
