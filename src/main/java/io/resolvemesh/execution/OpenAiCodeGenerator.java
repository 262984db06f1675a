package io.resolvemesh.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.resolvemesh.exception.CodeGenerationException;
import io.resolvemesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Chat-completions client for any OpenAI-compatible endpoint (hosted or a local model server).
 */
public final class OpenAiCodeGenerator implements CodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCodeGenerator.class);
    static final String SYSTEM_PROMPT = "You are an expert Python developer. Respond with a complete, runnable Python "
            + "script that strictly follows the user's instructions. Return raw code only, with no markdown or commentary. "
            + "The script must define resolve_oracle() returning a dict with the keys 'decision', 'reason' and 'sources', "
            + "and finish with an if __name__ == \"__main__\" block that prints that dict as a single JSON line.";

    private final HttpClient client;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final Duration timeout;

    public OpenAiCodeGenerator(URI baseUrl, String apiKey, String model, double temperature, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUrl, apiKey, model, temperature, timeout);
    }

    OpenAiCodeGenerator(HttpClient client, URI baseUrl, String apiKey, String model, double temperature, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        String base = Objects.requireNonNull(baseUrl, "baseUrl").toString();
        this.endpoint = URI.create(base.endsWith("/") ? base + "chat/completions" : base + "/chat/completions");
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = Objects.requireNonNull(model, "model");
        this.temperature = temperature;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public GeneratedCode generate(String prompt) {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("model", model);
        body.put("temperature", temperature);
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", prompt);

        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toJson(body), StandardCharsets.UTF_8));
        if (!apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CodeGenerationException("generation service unavailable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CodeGenerationException("interrupted while waiting for generation service", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new CodeGenerationException("generation service returned HTTP " + response.statusCode());
        }
        String content;
        try {
            JsonNode root = Jsons.mapper().readTree(response.body());
            content = root.path("choices").path(0).path("message").path("content").asText("");
        } catch (IOException e) {
            throw new CodeGenerationException("unparseable generation response", e);
        }
        String code = extractCode(content);
        if (code.isBlank()) {
            throw new CodeGenerationException("generation service returned no code");
        }
        log.debug("Generated {} chars of code with model {}", code.length(), model);
        return new GeneratedCode(code, model);
    }

    /**
     * Strips a surrounding markdown fence (with optional language tag) if the model added one.
     */
    static String extractCode(String response) {
        if (response == null) {
            return "";
        }
        String code = response.strip();
        int fenceStart = code.indexOf("```");
        if (fenceStart >= 0) {
            int fenceEnd = code.indexOf("```", fenceStart + 3);
            if (fenceEnd > fenceStart) {
                String fenced = code.substring(fenceStart + 3, fenceEnd);
                int firstNewline = fenced.indexOf('\n');
                if (firstNewline >= 0 && !fenced.substring(0, firstNewline).isBlank()
                        && fenced.substring(0, firstNewline).strip().matches("[A-Za-z0-9_+-]+")) {
                    fenced = fenced.substring(firstNewline + 1);
                }
                return fenced.strip();
            }
            return code.substring(fenceStart + 3).replaceFirst("^[A-Za-z0-9_+-]*\\n", "").strip();
        }
        return code;
    }
}
