package io.resolvemesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.resolvemesh.model.Decision;
import io.resolvemesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record EngineSettings(
        long clockSyncIntervalMs,
        long clockStaleAfterMs,
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long executorTimeoutMs,
        int workerPoolSize,
        long watcherPollIntervalMs,
        long tickIntervalMs,
        long graceSeconds,
        long resolutionWindowSeconds,
        int settlementTxRetries,
        long settlementTxRetryBackoffMs,
        long settlementConfirmTimeoutMs,
        long settlementPollIntervalMs,
        int settlementMaxConfirmWaits,
        long storeResyncIntervalMs,
        Decision defaultOutcome,
        List<String> allowedHosts,
        String signer
) {
    public EngineSettings {
        allowedHosts = allowedHosts == null ? List.of() : List.copyOf(allowedHosts);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                ResolveMeshConfig.DEFAULT_CLOCK_SYNC_INTERVAL_MS,
                ResolveMeshConfig.DEFAULT_CLOCK_STALE_AFTER_MS,
                ResolveMeshConfig.DEFAULT_MAX_ATTEMPTS,
                ResolveMeshConfig.DEFAULT_BASE_BACKOFF_MS,
                ResolveMeshConfig.DEFAULT_MAX_BACKOFF_MS,
                ResolveMeshConfig.DEFAULT_EXECUTOR_TIMEOUT_MS,
                ResolveMeshConfig.DEFAULT_WORKER_POOL_SIZE,
                ResolveMeshConfig.DEFAULT_WATCHER_POLL_INTERVAL_MS,
                ResolveMeshConfig.DEFAULT_TICK_INTERVAL_MS,
                ResolveMeshConfig.DEFAULT_GRACE_SECONDS,
                ResolveMeshConfig.DEFAULT_RESOLUTION_WINDOW_SECONDS,
                ResolveMeshConfig.DEFAULT_SETTLEMENT_TX_RETRIES,
                ResolveMeshConfig.DEFAULT_SETTLEMENT_TX_RETRY_BACKOFF_MS,
                ResolveMeshConfig.DEFAULT_SETTLEMENT_CONFIRM_TIMEOUT_MS,
                ResolveMeshConfig.DEFAULT_SETTLEMENT_POLL_INTERVAL_MS,
                ResolveMeshConfig.DEFAULT_SETTLEMENT_MAX_CONFIRM_WAITS,
                ResolveMeshConfig.DEFAULT_STORE_RESYNC_INTERVAL_MS,
                Decision.parse(ResolveMeshConfig.DEFAULT_OUTCOME).orElse(Decision.INVALID),
                List.of(),
                ResolveMeshConfig.DEFAULT_SIGNER
        );
    }

    public static SettingsFile readFile(Path file) {
        if (file == null || !Files.exists(file)) {
            return null;
        }
        try {
            return Jsons.mapper().readValue(Files.readString(file), SettingsFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    public static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long syncInterval = sanitizeLong(file.clockSyncIntervalMs(), defaults.clockSyncIntervalMs(), 1_000L);
        long staleAfter = sanitizeLong(file.clockStaleAfterMs(), defaults.clockStaleAfterMs(), syncInterval);
        int maxAttempts = sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1);
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        long executorTimeout = sanitizeLong(file.executorTimeoutMs(), defaults.executorTimeoutMs(), 1_000L);
        int workerPoolSize = sanitizeInt(file.workerPoolSize(), defaults.workerPoolSize(), 1);
        long watcherPoll = sanitizeLong(file.watcherPollIntervalMs(), defaults.watcherPollIntervalMs(), 100L);
        long tickInterval = sanitizeLong(file.tickIntervalMs(), defaults.tickIntervalMs(), 10L);
        long grace = sanitizeLong(file.graceSeconds(), defaults.graceSeconds(), 0L);
        long window = sanitizeLong(file.resolutionWindowSeconds(), defaults.resolutionWindowSeconds(), 1L);
        int txRetries = sanitizeInt(file.settlementTxRetries(), defaults.settlementTxRetries(), 1);
        long txRetryBackoff = sanitizeLong(file.settlementTxRetryBackoffMs(), defaults.settlementTxRetryBackoffMs(), 0L);
        long confirmTimeout = sanitizeLong(file.settlementConfirmTimeoutMs(), defaults.settlementConfirmTimeoutMs(), 1L);
        long pollInterval = sanitizeLong(file.settlementPollIntervalMs(), defaults.settlementPollIntervalMs(), 0L);
        int confirmWaits = sanitizeInt(file.settlementMaxConfirmWaits(), defaults.settlementMaxConfirmWaits(), 1);
        long resync = sanitizeLong(file.storeResyncIntervalMs(), defaults.storeResyncIntervalMs(), 100L);
        Decision defaultOutcome = sanitizeDefaultOutcome(file.defaultOutcome(), defaults.defaultOutcome());
        List<String> hosts = file.allowedHosts() == null ? defaults.allowedHosts() : sanitizeHosts(file.allowedHosts());
        String signer = file.signer() == null || file.signer().isBlank() ? defaults.signer() : file.signer().trim();
        return new EngineSettings(
                syncInterval,
                staleAfter,
                maxAttempts,
                baseBackoff,
                maxBackoff,
                executorTimeout,
                workerPoolSize,
                watcherPoll,
                tickInterval,
                grace,
                window,
                txRetries,
                txRetryBackoff,
                confirmTimeout,
                pollInterval,
                confirmWaits,
                resync,
                defaultOutcome,
                hosts,
                signer
        );
    }

    public EngineSettings withSettlementPolling(long txRetryBackoffMs, long confirmTimeoutMs, long pollIntervalMs) {
        return new EngineSettings(clockSyncIntervalMs, clockStaleAfterMs, maxAttempts, baseBackoffMs, maxBackoffMs,
                executorTimeoutMs, workerPoolSize, watcherPollIntervalMs, tickIntervalMs, graceSeconds,
                resolutionWindowSeconds, settlementTxRetries, txRetryBackoffMs, confirmTimeoutMs,
                pollIntervalMs, settlementMaxConfirmWaits, storeResyncIntervalMs, defaultOutcome, allowedHosts, signer);
    }

    public EngineSettings withMaxConfirmWaits(int maxConfirmWaits) {
        return new EngineSettings(clockSyncIntervalMs, clockStaleAfterMs, maxAttempts, baseBackoffMs, maxBackoffMs,
                executorTimeoutMs, workerPoolSize, watcherPollIntervalMs, tickIntervalMs, graceSeconds,
                resolutionWindowSeconds, settlementTxRetries, settlementTxRetryBackoffMs, settlementConfirmTimeoutMs,
                settlementPollIntervalMs, Math.max(1, maxConfirmWaits), storeResyncIntervalMs, defaultOutcome,
                allowedHosts, signer);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static Decision sanitizeDefaultOutcome(String raw, Decision fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        Decision parsed = Decision.parse(raw).orElse(fallback);
        // TRUE is never a safe fallback for an unresolved request.
        return parsed == Decision.TRUE ? fallback : parsed;
    }

    private static List<String> sanitizeHosts(List<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        for (String host : raw) {
            if (host != null && !host.isBlank()) {
                out.add(host.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(out);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SettingsFile(
            Long clockSyncIntervalMs,
            Long clockStaleAfterMs,
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long executorTimeoutMs,
            Integer workerPoolSize,
            Long watcherPollIntervalMs,
            Long tickIntervalMs,
            Long graceSeconds,
            Long resolutionWindowSeconds,
            Integer settlementTxRetries,
            Long settlementTxRetryBackoffMs,
            Long settlementConfirmTimeoutMs,
            Long settlementPollIntervalMs,
            Integer settlementMaxConfirmWaits,
            Long storeResyncIntervalMs,
            String defaultOutcome,
            List<String> allowedHosts,
            String signer
    ) {
    }
}
