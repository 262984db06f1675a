package io.resolvemesh.execution;

import com.fasterxml.jackson.databind.JsonNode;
import io.resolvemesh.util.Jsons;

import java.util.Optional;

/**
 * Structured return value when the sandbox reports one, otherwise the last JSON object line of stdout.
 */
public final class OutputExtractor {
    private OutputExtractor() {
    }

    public static Optional<JsonNode> extract(SandboxResult result) {
        if (result.returnValue() != null && result.returnValue().isObject()) {
            return Optional.of(result.returnValue());
        }
        String[] lines = result.stdout().split("\\r?\\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            Optional<JsonNode> parsed = Jsons.tryParseObject(lines[i]);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }
}
