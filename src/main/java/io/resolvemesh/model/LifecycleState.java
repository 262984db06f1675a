package io.resolvemesh.model;

import java.util.Locale;

public enum LifecycleState {
    SCHEDULED,
    RESOLVING,
    WAITING_RETRY,
    FINALIZED;

    public boolean isTerminal() {
        return this == FINALIZED;
    }

    public static LifecycleState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("lifecycle state cannot be empty");
        }
        String v = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return LifecycleState.valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported lifecycle state: " + raw, e);
        }
    }
}
