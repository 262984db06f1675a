package io.resolvemesh.execution;

import com.fasterxml.jackson.databind.JsonNode;
import io.resolvemesh.model.SourceExchange;

import java.util.List;

public record SandboxResult(
        int exitCode,
        String stdout,
        String stderr,
        JsonNode returnValue,
        List<SourceExchange> exchanges,
        boolean timedOut,
        long durationMs
) {
    public SandboxResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
    }

    public static SandboxResult timeout(String stdout, String stderr, long durationMs) {
        return new SandboxResult(-1, stdout, stderr, null, List.of(), true, durationMs);
    }
}
