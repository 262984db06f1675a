package io.resolvemesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;

public enum Decision {
    TRUE("true"),
    FALSE("false"),
    INVALID("invalid");

    private final String wireValue;

    Decision(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<Decision> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (Decision d : values()) {
            if (d.wireValue.equals(v)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    /**
     * Accepts JSON booleans and the three enumerated strings; anything else is absent.
     */
    public static Optional<Decision> fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isBoolean()) {
            return Optional.of(node.booleanValue() ? TRUE : FALSE);
        }
        if (node.isTextual()) {
            return parse(node.textValue());
        }
        return Optional.empty();
    }
}
