package io.resolvemesh.clock;

/**
 * Authoritative time in epoch millis plus an opaque attestation of where it came from.
 */
public record TimeSample(long epochMs, String proof) {
}
