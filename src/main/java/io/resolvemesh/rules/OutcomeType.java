package io.resolvemesh.rules;

import java.util.Locale;

public enum OutcomeType {
    BINARY,
    NUMERIC;

    public static OutcomeType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BINARY;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if ("numeric".equals(v) || "number".equals(v) || "scalar".equals(v)) {
            return NUMERIC;
        }
        if ("binary".equals(v) || "yes_no".equals(v) || "boolean".equals(v)) {
            return BINARY;
        }
        throw new IllegalArgumentException("Unsupported outcome type: " + raw);
    }
}
