package io.resolvemesh.model;

public record ClockReading(
        long correctedNowMs,
        long offsetMs,
        long syncedAtMs,
        long ageMs,
        String proof,
        boolean stale
) {
    public boolean synced() {
        return syncedAtMs > 0L;
    }
}
