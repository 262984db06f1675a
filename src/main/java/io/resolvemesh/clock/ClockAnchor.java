package io.resolvemesh.clock;

import io.resolvemesh.exception.ClockSyncException;
import io.resolvemesh.model.ClockReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Drift-corrected time. The offset is measured against the midpoint of the local request window and
 * survives failed syncs until it ages past the staleness threshold; a stale or never-synced anchor
 * reports {@code stale=true} and callers must fail closed.
 */
public final class ClockAnchor {
    private static final Logger log = LoggerFactory.getLogger(ClockAnchor.class);

    private final TimeSource source;
    private final Clock localClock;
    private volatile long staleAfterMs;
    private volatile Anchor anchor;

    public ClockAnchor(TimeSource source, Clock localClock, long staleAfterMs) {
        this.source = Objects.requireNonNull(source, "source");
        this.localClock = Objects.requireNonNull(localClock, "localClock");
        this.staleAfterMs = Math.max(1L, staleAfterMs);
    }

    public ClockReading sync() {
        long t0 = localClock.millis();
        TimeSample sample;
        try {
            sample = source.fetchTime();
        } catch (ClockSyncException e) {
            log.warn("Clock sync failed, keeping previous offset: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Clock sync failed, keeping previous offset: {}", e.toString());
            throw new ClockSyncException("time source unreachable: " + e.getMessage(), e);
        }
        if (sample == null) {
            throw new ClockSyncException("time source returned no sample");
        }
        long t1 = localClock.millis();
        long midpoint = t0 + (t1 - t0) / 2L;
        long offset = sample.epochMs() - midpoint;
        anchor = new Anchor(offset, t1, sample.epochMs(), sample.proof());
        log.debug("Clock anchor synced offsetMs={} roundTripMs={}", offset, t1 - t0);
        return now();
    }

    public ClockReading now() {
        long local = localClock.millis();
        Anchor current = anchor;
        if (current == null) {
            return new ClockReading(local, 0L, 0L, Long.MAX_VALUE, null, true);
        }
        long age = Math.max(0L, local - current.syncedAtLocalMs());
        return new ClockReading(
                local + current.offsetMs(),
                current.offsetMs(),
                current.syncedAtLocalMs(),
                age,
                current.proof(),
                age > staleAfterMs
        );
    }

    public long lastAuthoritativeMs() {
        Anchor current = anchor;
        return current == null ? 0L : current.authoritativeMs();
    }

    public long staleAfterMs() {
        return staleAfterMs;
    }

    public void updateStaleAfterMs(long staleAfterMs) {
        this.staleAfterMs = Math.max(1L, staleAfterMs);
    }

    private record Anchor(long offsetMs, long syncedAtLocalMs, long authoritativeMs, String proof) {
    }
}
