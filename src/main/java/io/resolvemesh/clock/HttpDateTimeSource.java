package io.resolvemesh.clock;

import io.resolvemesh.exception.ClockSyncException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Reads the RFC 1123 {@code Date} header of an HTTPS authority. Second resolution; the TLS session
 * to the named host is the attestation.
 */
public final class HttpDateTimeSource implements TimeSource {
    private final HttpClient client;
    private final URI authority;
    private final Duration timeout;

    public HttpDateTimeSource(URI authority, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), authority, timeout);
    }

    HttpDateTimeSource(HttpClient client, URI authority, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.authority = Objects.requireNonNull(authority, "authority");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public TimeSample fetchTime() {
        HttpRequest request = HttpRequest.newBuilder(authority)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .timeout(timeout)
                .build();
        HttpResponse<Void> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new ClockSyncException("time authority unreachable: " + authority, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClockSyncException("interrupted while contacting time authority", e);
        }
        String date = response.headers().firstValue("date")
                .orElseThrow(() -> new ClockSyncException("no Date header from " + authority));
        return parse(date, authority.toString());
    }

    static TimeSample parse(String dateHeader, String origin) {
        try {
            long epochMs = ZonedDateTime.parse(dateHeader.trim(), DateTimeFormatter.RFC_1123_DATE_TIME)
                    .toInstant()
                    .toEpochMilli();
            return new TimeSample(epochMs, "http-date " + origin + " " + dateHeader.trim());
        } catch (DateTimeParseException e) {
            throw new ClockSyncException("unparseable Date header: " + dateHeader, e);
        }
    }
}
