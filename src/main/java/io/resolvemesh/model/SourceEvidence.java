package io.resolvemesh.model;

public record SourceEvidence(String source, String sha256, long fetchedAtMs) {
}
