package io.resolvemesh.runtime;

import io.resolvemesh.clock.ClockAnchor;
import io.resolvemesh.config.EngineSettings;
import io.resolvemesh.config.ResolveMeshConfig;
import io.resolvemesh.exception.ClockSyncException;
import io.resolvemesh.execution.ResolutionExecutor;
import io.resolvemesh.execution.TemplateRegistry;
import io.resolvemesh.model.ClockReading;
import io.resolvemesh.model.EvidenceBundle;
import io.resolvemesh.model.LifecycleState;
import io.resolvemesh.model.Outcome;
import io.resolvemesh.model.ResolutionRequest;
import io.resolvemesh.model.SettlementRecord;
import io.resolvemesh.model.Transcript;
import io.resolvemesh.observability.AuditLogger;
import io.resolvemesh.observability.PrometheusFormatter;
import io.resolvemesh.rules.AncillaryRules;
import io.resolvemesh.scheduler.EngineEvent;
import io.resolvemesh.scheduler.ResolutionScheduler;
import io.resolvemesh.settlement.NonceAllocator;
import io.resolvemesh.settlement.SettlementSubmitter;
import io.resolvemesh.storage.Database;
import io.resolvemesh.storage.EvidenceStore;
import io.resolvemesh.storage.FileEvidenceStore;
import io.resolvemesh.storage.LifecycleStore;
import io.resolvemesh.storage.TranscriptStore;
import io.resolvemesh.verify.ResultVerifier;
import io.resolvemesh.watch.RequestWatcher;
import io.resolvemesh.watch.WatchEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

public final class ResolutionEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);
    private static final long SETTINGS_CHECK_INTERVAL_MS = 1_000L;

    private final ResolveMeshConfig config;
    private final EngineCollaborators collaborators;
    private final Clock clock;
    private final Database database;
    private final LifecycleStore store;
    private final EvidenceStore evidence;
    private final TranscriptStore transcripts;
    private final AuditLogger auditLogger;
    private final List<ExecutorService> ownedExecutors = new ArrayList<>();

    private volatile EngineSettings settings;
    private volatile long settingsFileMtimeMs;
    private volatile long lastSettingsCheckMs;
    private ClockAnchor clockAnchor;
    private RequestWatcher watcher;
    private ResolutionScheduler scheduler;
    private List<ScheduledExecutorService> loops;

    public ResolutionEngine(ResolveMeshConfig config, EngineCollaborators collaborators) {
        this.config = Objects.requireNonNull(config, "config");
        this.collaborators = collaborators;
        this.clock = collaborators == null ? Clock.systemUTC() : collaborators.clock();
        this.database = new Database(config);
        this.store = new LifecycleStore(database);
        this.evidence = new FileEvidenceStore(config.evidenceRoot());
        this.transcripts = new TranscriptStore(config.transcriptRoot());
        String auditSigningSecret = loadOrCreateAuditSigningSecret(config.securityRoot().resolve("audit-signing.key"));
        this.auditLogger = new AuditLogger(config.auditFile(), auditSigningSecret);
        this.settings = EngineSettings.defaults();
        this.settingsFileMtimeMs = Long.MIN_VALUE;
        this.lastSettingsCheckMs = 0L;
    }

    /**
     * Opens the data root for operator tooling: lifecycle queries, overrides, force-retry, stats and audit.
     * Resolution, watching and settlement stay with the process that owns the collaborators.
     */
    public static ResolutionEngine detached(ResolveMeshConfig config) {
        return new ResolutionEngine(config, null);
    }

    public void init() {
        database.init();
        loadSettings(true);
        if (collaborators == null) {
            return;
        }
        EngineSettings current = settings;
        clockAnchor = new ClockAnchor(collaborators.timeSource(), clock, current.clockStaleAfterMs());
        TemplateRegistry templates = collaborators.templates() != null
                ? collaborators.templates()
                : TemplateRegistry.loadFrom(config.templatesRoot());
        ResolutionExecutor executor = new ResolutionExecutor(
                templates,
                collaborators.codeGenerator(),
                collaborators.sandbox(),
                transcripts,
                this::settings,
                clock
        );
        SettlementSubmitter submitter = new SettlementSubmitter(
                collaborators.chain(),
                collaborators.authorization(),
                new NonceAllocator(collaborators.chain(), current.signer()),
                store,
                this::settings,
                clock
        );
        watcher = new RequestWatcher(collaborators.chain(), store, this::settings);
        scheduler = new ResolutionScheduler(
                store,
                evidence,
                executor,
                new ResultVerifier(),
                submitter,
                clockAnchor,
                clock,
                this::settings,
                collaborators.workers() != null ? collaborators.workers() : ownedPool("resolvemesh-worker"),
                collaborators.settlementWorkers() != null
                        ? collaborators.settlementWorkers()
                        : ownedPool("resolvemesh-settlement"),
                auditLogger
        );
        int reclaimed = store.reclaimInterrupted(clock.millis());
        if (reclaimed > 0) {
            log.info("Reclaimed {} request(s) interrupted mid-resolution", reclaimed);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "runtime.recover",
                    "system",
                    "runtime/scheduler",
                    "ok",
                    null,
                    null,
                    Map.of("reclaimed", reclaimed)
            ));
        }
        scheduler.requestResync();
    }

    /**
     * Starts the tick, watcher, clock-sync and settings loops. Call after {@link #init()}.
     */
    public synchronized void start() {
        requireAttached();
        if (loops != null) {
            return;
        }
        try {
            syncClock();
        } catch (ClockSyncException e) {
            log.warn("Initial clock sync failed; dispatch stays blocked until the anchor is fresh: {}", e.getMessage());
        }
        // Chain and time-source RPCs get their own threads so a slow call never holds up the tick.
        ScheduledExecutorService tickLoop = loopThread("resolvemesh-tick");
        ScheduledExecutorService watcherLoop = loopThread("resolvemesh-watcher");
        ScheduledExecutorService clockLoop = loopThread("resolvemesh-clock");
        loops = List.of(tickLoop, watcherLoop, clockLoop);
        scheduleLoop(tickLoop, "tick", () -> settings.tickIntervalMs(), this::tick);
        scheduleLoop(tickLoop, "settings", () -> SETTINGS_CHECK_INTERVAL_MS,
                () -> maybeReloadSettings(SETTINGS_CHECK_INTERVAL_MS));
        scheduleLoop(watcherLoop, "watcher", () -> settings.watcherPollIntervalMs(), this::pollWatcher);
        scheduleLoop(clockLoop, "clock-sync", () -> settings.clockSyncIntervalMs(), this::syncClock);
        log.info("ResolveMesh engine started root={} signer={}", config.rootDir(), settings.signer());
    }

    private static ScheduledExecutorService loopThread(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    // Re-arms after each run so interval changes from a settings reload apply to the next cycle.
    private void scheduleLoop(ScheduledExecutorService exec, String name, LongSupplier intervalMs, Runnable body) {
        if (exec.isShutdown()) {
            return;
        }
        try {
            exec.schedule(() -> {
                try {
                    body.run();
                } catch (RuntimeException e) {
                    log.error("Engine loop '{}' failed", name, e);
                }
                scheduleLoop(exec, name, intervalMs, body);
            }, Math.max(1L, intervalMs.getAsLong()), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Engine loop '{}' not re-armed: executor shut down", name);
        }
    }

    @Override
    public synchronized void close() {
        if (loops != null) {
            for (ScheduledExecutorService loop : loops) {
                loop.shutdownNow();
            }
            loops = null;
        }
        for (ExecutorService pool : ownedExecutors) {
            pool.shutdownNow();
        }
        for (ExecutorService pool : ownedExecutors) {
            try {
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Executor pool did not terminate within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        ownedExecutors.clear();
    }

    public ResolutionScheduler.TickReport tick() {
        requireAttached();
        return scheduler.tick();
    }

    public ClockReading syncClock() {
        requireAttached();
        ClockReading reading = clockAnchor.sync();
        store.recordClockSync(reading.offsetMs(), reading.syncedAtMs(), clockAnchor.lastAuthoritativeMs(),
                reading.proof(), clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "clock.sync",
                "system",
                "runtime/clock",
                "ok",
                null,
                null,
                Map.of("offset_ms", reading.offsetMs(), "authoritative_ms", clockAnchor.lastAuthoritativeMs())
        ));
        return reading;
    }

    public List<WatchEvent> pollWatcher() {
        requireAttached();
        List<WatchEvent> events = watcher.scan(clock.millis());
        for (WatchEvent event : events) {
            scheduler.post(new EngineEvent.Observed(event));
        }
        return events;
    }

    public Optional<RequestStatus> status(String requestId) {
        return store.get(requestId).map(request -> new RequestStatus(
                request,
                store.settlements(requestId),
                store.transitions(requestId),
                evidence.revisions(requestId)
        ));
    }

    public List<ResolutionRequest> requests(String stateRaw, int limit) {
        LifecycleState state = stateRaw == null || stateRaw.isBlank() ? null : LifecycleState.fromString(stateRaw);
        return store.list(state, Math.max(1, limit));
    }

    public EvidenceBundle evidence(String requestId) {
        return evidence.get(requestId);
    }

    public Optional<EvidenceBundle> evidenceRevision(String requestId, int revision) {
        return evidence.findRevision(requestId, revision);
    }

    public List<Transcript> transcripts(String requestId) {
        return transcripts.list(requestId);
    }

    public LifecycleStore.TransitionResult forceRetry(String requestId, String reason, String actor) {
        LifecycleStore.TransitionResult out = store.forceRetry(requestId, reason, clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "operator.force_retry",
                actorOrDefault(actor),
                "request/" + requestId,
                out.outcome().name().toLowerCase(Locale.ROOT),
                requestId,
                out.request() == null ? null : out.request().attemptEpoch(),
                Map.of("reason", reason == null ? "" : reason, "message", out.message() == null ? "" : out.message())
        ));
        if (out.applied()) {
            wake(requestId);
        }
        return out;
    }

    /**
     * Records an operator outcome. It is verified against the request's rules when the request is next
     * dispatched; a preliminary check here rejects outcomes that could never pass.
     */
    public LifecycleStore.TransitionResult supplyOutcome(String requestId, Outcome outcome, String reason, String actor) {
        Objects.requireNonNull(outcome, "outcome");
        Optional<ResolutionRequest> current = store.get(requestId);
        LifecycleStore.TransitionResult out;
        if (current.isEmpty()) {
            out = LifecycleStore.TransitionResult.rejected(null, "unknown request: " + requestId);
        } else {
            ResultVerifier.Verdict verdict = new ResultVerifier()
                    .verifyOperator(outcome, AncillaryRules.parse(current.get().ancillaryData()));
            out = verdict.accepted()
                    ? store.recordOverride(requestId, outcome, reason, clock.millis())
                    : LifecycleStore.TransitionResult.rejected(current.get(), "operator outcome rejected: " + verdict.reason());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("outcome", outcome.describe());
        details.put("reason", reason == null ? "" : reason);
        details.put("message", out.message() == null ? "" : out.message());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "operator.override",
                actorOrDefault(actor),
                "request/" + requestId,
                out.outcome().name().toLowerCase(Locale.ROOT),
                requestId,
                out.request() == null ? null : out.request().attemptEpoch(),
                details
        ));
        if (out.applied()) {
            wake(requestId);
        }
        return out;
    }

    public EngineStats stats() {
        EngineSettings current = settings;
        long offsetMs;
        long ageMs;
        boolean stale;
        if (clockAnchor != null) {
            ClockReading reading = clockAnchor.now();
            offsetMs = reading.offsetMs();
            ageMs = reading.synced() ? reading.ageMs() : -1L;
            stale = reading.stale();
        } else {
            Optional<LifecycleStore.ClockSyncRow> last = store.lastClockSync();
            offsetMs = last.map(LifecycleStore.ClockSyncRow::offsetMs).orElse(0L);
            ageMs = last.map(row -> Math.max(0L, clock.millis() - row.recordedAtMs())).orElse(-1L);
            stale = ageMs < 0L || ageMs > current.clockStaleAfterMs();
        }
        return new EngineStats(
                store.countByState(),
                store.countByFinalization(),
                store.countNeedingOperator(),
                scheduler == null ? 0 : scheduler.inFlightCount(),
                scheduler == null ? 0 : scheduler.runningExecutions(),
                current.workerPoolSize(),
                scheduler == null ? 0 : scheduler.queuedCount(),
                offsetMs,
                ageMs,
                stale,
                scheduler == null ? Map.of() : scheduler.counters()
        );
    }

    public String metricsText() {
        String text = PrometheusFormatter.format(stats());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "runtime.metrics",
                "cli",
                "runtime/metrics",
                "ok",
                null,
                null,
                Map.of("bytes", text.length())
        ));
        return text;
    }

    public AuditLogger.IntegrityReport verifyAuditIntegrity(int limit) {
        AuditLogger.IntegrityReport report = auditLogger.verifyIntegrity(limit);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "audit.verify",
                "cli",
                "audit/log",
                report.ok() ? "ok" : "broken",
                null,
                null,
                Map.of("checked_rows", report.checkedRows(), "broken_line", report.brokenLine())
        ));
        return report;
    }

    public EngineSettings currentSettings() {
        return settings;
    }

    public SettingsReloadOutcome reloadSettings() {
        return loadSettings(true);
    }

    public SettingsReloadOutcome maybeReloadSettings(long minIntervalMs) {
        long nowMs = clock.millis();
        long interval = Math.max(SETTINGS_CHECK_INTERVAL_MS, minIntervalMs);
        if ((nowMs - lastSettingsCheckMs) < interval) {
            return new SettingsReloadOutcome(false, settingsFileMtimeMs >= 0L, config.settingsFile().toString(),
                    settings, "skip_interval", nowMs);
        }
        lastSettingsCheckMs = nowMs;
        return loadSettings(false);
    }

    public ResolveMeshConfig config() {
        return config;
    }

    public LifecycleStore store() {
        return store;
    }

    public EvidenceStore evidenceStore() {
        return evidence;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    private EngineSettings settings() {
        return settings;
    }

    private SettingsReloadOutcome loadSettings(boolean force) {
        Path file = config.settingsFile();
        long checkedAtMs = clock.millis();
        long mtime = resolveFileMtimeMs(file);
        if (!force && mtime == settingsFileMtimeMs) {
            return new SettingsReloadOutcome(false, mtime >= 0L, file.toString(), settings, "unchanged", checkedAtMs);
        }
        EngineSettings previous = settings;
        EngineSettings resolved = mtime < 0L
                ? EngineSettings.defaults()
                : EngineSettings.fromFile(EngineSettings.readFile(file), EngineSettings.defaults());
        applySettings(resolved);
        settingsFileMtimeMs = mtime;
        boolean changed = !resolved.equals(previous);
        if (changed || mtime >= 0L) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "runtime.settings.load",
                    "system",
                    "runtime/settings",
                    mtime < 0L ? "ok_default" : (changed ? "reloaded" : "ok"),
                    null,
                    null,
                    Map.of("config", file.toString(), "changed", changed, "config_mtime_ms", mtime)
            ));
        }
        if (changed) {
            log.info("Engine settings {} from {}", mtime < 0L ? "reset to defaults" : "reloaded", file);
        }
        String reason = mtime < 0L ? "defaults" : (changed ? "reloaded" : "unchanged_content");
        return new SettingsReloadOutcome(changed, mtime >= 0L, file.toString(), resolved, reason, checkedAtMs);
    }

    private void applySettings(EngineSettings resolved) {
        EngineSettings previous = settings;
        settings = resolved;
        if (clockAnchor != null) {
            clockAnchor.updateStaleAfterMs(resolved.clockStaleAfterMs());
        }
        if (scheduler != null && !resolved.signer().equals(previous.signer())) {
            log.warn("Signer changed from {} to {}; restart to rebind the nonce allocator", previous.signer(), resolved.signer());
        }
    }

    private long resolveFileMtimeMs(Path path) {
        if (!Files.exists(path)) {
            return -1L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings mtime: " + path, e);
        }
    }

    private String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    private ExecutorService ownedPool(String prefix) {
        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, prefix + "-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ownedExecutors.add(pool);
        return pool;
    }

    private void wake(String requestId) {
        if (scheduler != null) {
            scheduler.post(new EngineEvent.Wake(requestId));
        }
    }

    private void requireAttached() {
        if (scheduler == null) {
            throw new IllegalStateException(collaborators == null
                    ? "engine is detached; resolution runs in the daemon process"
                    : "engine not initialized; call init() first");
        }
    }

    private static String actorOrDefault(String actor) {
        return actor == null || actor.isBlank() ? "operator" : actor.trim();
    }

    public record RequestStatus(
            ResolutionRequest request,
            List<SettlementRecord> settlements,
            List<LifecycleStore.TransitionRow> transitions,
            List<Integer> evidenceRevisions
    ) {
    }

    public record SettingsReloadOutcome(
            boolean reloaded,
            boolean fileExists,
            String path,
            EngineSettings settings,
            String reason,
            long checkedAtMs
    ) {
    }
}
