package io.resolvemesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Raw audit record of one attempt, persisted whether or not the attempt was accepted.
 */
public record Transcript(
        String requestId,
        int attemptNumber,
        long attemptEpoch,
        long startedAtMs,
        long finishedAtMs,
        DecisionSource codeSource,
        String templateId,
        String prompt,
        String code,
        List<String> analysisWarnings,
        Integer exitCode,
        boolean timedOut,
        String stdout,
        String stderr,
        JsonNode returnValue,
        List<SourceExchange> exchanges,
        String failure,
        FailureClass failureClass
) {
    public Transcript {
        analysisWarnings = analysisWarnings == null ? List.of() : List.copyOf(analysisWarnings);
        exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
    }
}
