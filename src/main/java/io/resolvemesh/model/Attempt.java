package io.resolvemesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Result of one resolution run. A failed attempt carries {@code failure} and {@code failureClass}
 * and never an output.
 */
public record Attempt(
        String requestId,
        int attemptNumber,
        long attemptEpoch,
        long startedAtMs,
        long finishedAtMs,
        DecisionSource codeSource,
        String templateId,
        String code,
        String stdout,
        String stderr,
        JsonNode output,
        List<SourceEvidence> sourceEvidence,
        String failure,
        FailureClass failureClass
) {
    public Attempt {
        sourceEvidence = sourceEvidence == null ? List.of() : List.copyOf(sourceEvidence);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
