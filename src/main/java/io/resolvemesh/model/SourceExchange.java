package io.resolvemesh.model;

/**
 * Raw request/response pair between resolution code and an external source.
 */
public record SourceExchange(
        String method,
        String url,
        int status,
        String requestBody,
        String responseBody,
        long fetchedAtMs
) {
}
