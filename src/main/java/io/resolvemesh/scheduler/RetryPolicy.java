package io.resolvemesh.scheduler;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with bounded jitter. Delays never decrease with the failure count and never
 * exceed {@code maxBackoffMs}.
 */
public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    private static final long MAX_JITTER_MS = 250L;

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseBackoffMs = Math.max(1L, baseBackoffMs);
        maxBackoffMs = Math.max(baseBackoffMs, maxBackoffMs);
    }

    public long backoffMs(int failures) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < failures; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        // Jitter stays below one base step so consecutive delays cannot shrink.
        long jitter = ThreadLocalRandom.current().nextLong(0L, Math.min(MAX_JITTER_MS, baseBackoffMs) + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }

    public boolean exhausted(int attempts) {
        return attempts >= maxAttempts;
    }
}
