package io.resolvemesh.scheduler;

import io.resolvemesh.clock.ClockAnchor;
import io.resolvemesh.config.EngineSettings;
import io.resolvemesh.exception.IllegalTransitionException;
import io.resolvemesh.execution.ResolutionExecutor;
import io.resolvemesh.model.Attempt;
import io.resolvemesh.model.ClockReading;
import io.resolvemesh.model.ConfirmationState;
import io.resolvemesh.model.DecisionSource;
import io.resolvemesh.model.EvidenceBundle;
import io.resolvemesh.model.EvidenceKind;
import io.resolvemesh.model.FailureClass;
import io.resolvemesh.model.LifecycleState;
import io.resolvemesh.model.Outcome;
import io.resolvemesh.model.ResolutionRequest;
import io.resolvemesh.model.SettlementRecord;
import io.resolvemesh.observability.AuditLogger;
import io.resolvemesh.rules.AncillaryRules;
import io.resolvemesh.settlement.OutcomePricing;
import io.resolvemesh.settlement.SettlementOutcome;
import io.resolvemesh.settlement.SettlementSubmitter;
import io.resolvemesh.storage.EvidenceStore;
import io.resolvemesh.storage.LifecycleStore;
import io.resolvemesh.util.Hashing;
import io.resolvemesh.verify.ResultVerifier;
import io.resolvemesh.watch.WatchEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Single coordinator for all active requests. Each {@link #tick()} drains task results, then pops
 * requests whose next-eligible time has passed on the anchored clock and either defaults them,
 * dispatches an execution, applies an operator outcome, or resumes settlement.
 *
 * <p>Work runs on the supplied executors and reports back through {@link #post(EngineEvent)}; only the
 * coordinator mutates lifecycle state in response. A stale clock anchor blocks every dispatch and
 * every deadline decision until the anchor is refreshed.
 */
public final class ResolutionScheduler {
    private static final Logger log = LoggerFactory.getLogger(ResolutionScheduler.class);
    private static final String ACTOR = "scheduler";

    private final LifecycleStore store;
    private final EvidenceStore evidence;
    private final ResolutionExecutor executor;
    private final ResultVerifier verifier;
    private final SettlementSubmitter submitter;
    private final ClockAnchor clockAnchor;
    private final Clock localClock;
    private final Supplier<EngineSettings> settings;
    private final Executor workers;
    private final Executor settlementWorkers;
    private final AuditLogger audit;

    private final Queue<EngineEvent> mailbox = new ConcurrentLinkedQueue<>();
    private final EligibilityQueue queue = new EligibilityQueue();
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger runningExecutions = new AtomicInteger();
    private final AtomicLong dispatchedTotal = new AtomicLong();
    private final AtomicLong rejectedTotal = new AtomicLong();
    private final AtomicLong settledTotal = new AtomicLong();
    private final AtomicLong defaultedTotal = new AtomicLong();
    private final AtomicLong externalTotal = new AtomicLong();
    private final AtomicLong discardedTotal = new AtomicLong();
    private final AtomicLong staleClockTicks = new AtomicLong();
    private long lastResyncLocalMs = Long.MIN_VALUE;

    public ResolutionScheduler(
            LifecycleStore store,
            EvidenceStore evidence,
            ResolutionExecutor executor,
            ResultVerifier verifier,
            SettlementSubmitter submitter,
            ClockAnchor clockAnchor,
            Clock localClock,
            Supplier<EngineSettings> settings,
            Executor workers,
            Executor settlementWorkers,
            AuditLogger audit
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.evidence = Objects.requireNonNull(evidence, "evidence");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.submitter = Objects.requireNonNull(submitter, "submitter");
        this.clockAnchor = Objects.requireNonNull(clockAnchor, "clockAnchor");
        this.localClock = Objects.requireNonNull(localClock, "localClock");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.settlementWorkers = Objects.requireNonNull(settlementWorkers, "settlementWorkers");
        this.audit = Objects.requireNonNull(audit, "audit");
    }

    public void post(EngineEvent event) {
        mailbox.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * Rebuilds the eligibility queue from the store on the next tick.
     */
    public synchronized void requestResync() {
        lastResyncLocalMs = Long.MIN_VALUE;
    }

    public synchronized TickReport tick() {
        int processed = drainMailbox();
        long localNow = localClock.millis();
        if (lastResyncLocalMs == Long.MIN_VALUE
                || localNow - lastResyncLocalMs >= settings.get().storeResyncIntervalMs()) {
            resync();
            lastResyncLocalMs = localNow;
        }

        ClockReading clock = clockAnchor.now();
        if (clock.stale()) {
            staleClockTicks.incrementAndGet();
            log.debug("Clock anchor stale (age {}ms); holding all dispatch and deadline decisions", clock.ageMs());
            return new TickReport(0, 0, 0, true, processed);
        }

        long now = clock.correctedNowMs();
        int dispatched = 0;
        int defaulted = 0;
        List<String> deferred = new ArrayList<>();
        for (String requestId : queue.pollDue(now)) {
            try {
                Evaluation evaluation = evaluate(requestId, clock, deferred);
                if (evaluation == Evaluation.DISPATCHED) {
                    dispatched++;
                } else if (evaluation == Evaluation.DEFAULTED) {
                    defaulted++;
                }
            } catch (IllegalTransitionException e) {
                log.error("Illegal transition for {}: {}", requestId, e.getMessage(), e);
                audit("lifecycle.illegal_transition", requestId, null, "error", Map.of("message", e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Failed to evaluate {}; it will be picked up again on resync", requestId, e);
            }
        }
        for (String requestId : deferred) {
            queue.schedule(requestId, now);
        }
        processed += drainMailbox();
        return new TickReport(dispatched, defaulted, deferred.size(), false, processed);
    }

    private int drainMailbox() {
        int processed = 0;
        EngineEvent event;
        while ((event = mailbox.poll()) != null) {
            processed++;
            try {
                handle(event);
            } catch (IllegalTransitionException e) {
                log.error("Illegal transition for {}: {}", event.requestId(), e.getMessage(), e);
                audit("lifecycle.illegal_transition", event.requestId(), null, "error", Map.of("message", e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Failed to apply {} for {}", event.getClass().getSimpleName(), event.requestId(), e);
            }
        }
        return processed;
    }

    private void handle(EngineEvent event) {
        if (event instanceof EngineEvent.ExecutionFinished) {
            onExecutionFinished((EngineEvent.ExecutionFinished) event);
        } else if (event instanceof EngineEvent.SettlementFinished) {
            onSettlementFinished((EngineEvent.SettlementFinished) event);
        } else if (event instanceof EngineEvent.TaskCrashed) {
            onTaskCrashed((EngineEvent.TaskCrashed) event);
        } else if (event instanceof EngineEvent.Observed) {
            onObserved(((EngineEvent.Observed) event).event());
        } else if (event instanceof EngineEvent.Wake) {
            store.get(event.requestId()).filter(r -> !r.state().isTerminal() && !inFlight.containsKey(r.requestId()))
                    .ifPresent(r -> queue.schedule(r.requestId(), Long.MIN_VALUE));
        }
    }

    private void resync() {
        int scheduled = 0;
        for (ResolutionRequest request : store.listActive()) {
            if (!inFlight.containsKey(request.requestId())) {
                Long previous = queue.dueAt(request.requestId());
                long due = dueAt(request);
                queue.schedule(request.requestId(), due);
                if (previous == null || previous != due) {
                    scheduled++;
                }
            }
        }
        if (scheduled > 0) {
            log.debug("Resync queued or moved {} requests", scheduled);
        }
    }

    private Evaluation evaluate(String requestId, ClockReading clock, List<String> deferred) {
        ResolutionRequest request = store.get(requestId).orElse(null);
        if (request == null || request.state().isTerminal() || inFlight.containsKey(requestId)) {
            return Evaluation.SKIPPED;
        }
        long now = clock.correctedNowMs();
        EngineSettings current = settings.get();
        Optional<SettlementRecord> live = store.liveSettlement(requestId);

        if (request.state() == LifecycleState.RESOLVING) {
            // Only this coordinator starts attempts, so a RESOLVING row without a task here is orphaned.
            log.warn("Request {} is RESOLVING with no task in flight (epoch {}); reclaiming", requestId,
                    request.attemptEpoch());
            scheduleRetry(request, "attempt orphaned without a running task", FailureClass.TRANSIENT_INFRASTRUCTURE,
                    false, false);
            return Evaluation.SKIPPED;
        }
        if (now >= request.deadlineAtMs() && live.isEmpty()) {
            defaultRequest(request, clock);
            return Evaluation.DEFAULTED;
        }
        if (now < request.earliestResolveAtMs()) {
            queue.schedule(requestId, request.earliestResolveAtMs());
            return Evaluation.SKIPPED;
        }
        if (live.isPresent() || request.isAccepted()) {
            return dispatch(request, Kind.SETTLEMENT_RESUME, clock) ? Evaluation.DISPATCHED : Evaluation.SKIPPED;
        }
        if (request.nextEligibleAtMs() != null && now < request.nextEligibleAtMs()) {
            queue.schedule(requestId, Math.min(request.nextEligibleAtMs(), request.deadlineAtMs()));
            return Evaluation.SKIPPED;
        }
        if (request.hasOverride()) {
            return dispatch(request, Kind.OPERATOR, clock) ? Evaluation.DISPATCHED : Evaluation.SKIPPED;
        }
        if (request.needsOperator()) {
            log.debug("Request {} waits for operator attention until deadline", requestId);
            queue.schedule(requestId, request.deadlineAtMs());
            return Evaluation.SKIPPED;
        }
        AncillaryRules rules = AncillaryRules.parse(request.ancillaryData());
        if (!rules.wellFormed()) {
            // No generated answer could pass verification; hold for the deadline default.
            log.warn("Request {} has malformed ancillary rules ({}); not dispatching", requestId,
                    String.join("; ", rules.problems()));
            queue.schedule(requestId, request.deadlineAtMs());
            return Evaluation.SKIPPED;
        }
        RetryPolicy policy = policy(current);
        if (policy.exhausted(request.attemptCount())) {
            log.debug("Request {} exhausted {} attempts; parked until deadline", requestId, request.attemptCount());
            queue.schedule(requestId, request.deadlineAtMs());
            return Evaluation.SKIPPED;
        }
        if (runningExecutions.get() >= current.workerPoolSize()) {
            deferred.add(requestId);
            return Evaluation.SKIPPED;
        }
        return dispatch(request, Kind.EXECUTION, clock) ? Evaluation.DISPATCHED : Evaluation.SKIPPED;
    }

    private boolean dispatch(ResolutionRequest request, Kind kind, ClockReading clock) {
        String requestId = request.requestId();
        long now = clock.correctedNowMs();
        LifecycleStore.AttemptGrant grant = store.tryBeginAttempt(requestId, kind == Kind.EXECUTION, now);
        if (!grant.started()) {
            log.debug("Attempt for {} not started; state is {}", requestId,
                    grant.request() == null ? "unknown" : grant.request().state());
            return false;
        }
        long epoch = grant.attemptEpoch();
        ResolutionRequest granted = grant.request();
        inFlight.put(requestId, new InFlight(epoch, kind, clock));
        audit("resolution.dispatch", requestId, epoch, "ok", Map.of(
                "kind", kind.name(),
                "attempt", grant.attemptNumber(),
                "clock_offset_ms", clock.offsetMs()
        ));
        switch (kind) {
            case EXECUTION -> {
                runningExecutions.incrementAndGet();
                dispatchedTotal.incrementAndGet();
                log.info("Dispatching attempt {} for {} (epoch {})", grant.attemptNumber(), requestId, epoch);
                submitTask(workers, requestId, epoch, true, () -> {
                    Attempt attempt = executor.execute(granted, grant.attemptNumber(), epoch);
                    post(new EngineEvent.ExecutionFinished(requestId, epoch, attempt));
                });
            }
            case OPERATOR -> applyOperatorOutcome(granted, epoch, clock);
            case SETTLEMENT_RESUME -> resumeSettlement(granted, epoch);
        }
        return true;
    }

    private void submitTask(Executor pool, String requestId, long epoch, boolean execution, Runnable body) {
        Runnable task = () -> {
            try {
                body.run();
            } catch (RuntimeException e) {
                log.error("Task for {} (epoch {}) crashed", requestId, epoch, e);
                post(new EngineEvent.TaskCrashed(requestId, epoch, execution, e.toString()));
            } catch (Error e) {
                log.error("Task for {} (epoch {}) died", requestId, epoch, e);
                post(new EngineEvent.TaskCrashed(requestId, epoch, execution, e.toString()));
                throw e;
            }
        };
        try {
            pool.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected task for {}: {}", requestId, e.getMessage());
            post(new EngineEvent.TaskCrashed(requestId, epoch, execution, "worker pool rejected task"));
        }
    }

    private void onExecutionFinished(EngineEvent.ExecutionFinished finished) {
        String requestId = finished.requestId();
        InFlight flight = inFlight.get(requestId);
        if (flight != null && flight.epoch() == finished.attemptEpoch() && flight.kind() == Kind.EXECUTION) {
            inFlight.remove(requestId);
        }
        runningExecutions.decrementAndGet();

        ResolutionRequest current = currentFor(requestId, finished.attemptEpoch());
        if (current == null) {
            return;
        }
        Attempt attempt = finished.attempt();
        if (!attempt.succeeded()) {
            log.info("Attempt {} for {} failed ({}): {}", attempt.attemptNumber(), requestId, attempt.failureClass(),
                    attempt.failure());
            scheduleRetry(current, attempt.failure(), attempt.failureClass(), false, false);
            return;
        }
        ResultVerifier.Verdict verdict;
        try {
            AncillaryRules rules = AncillaryRules.parse(current.ancillaryData());
            verdict = verifier.verify(attempt, rules, settings.get().allowedHosts());
        } catch (RuntimeException e) {
            log.error("Verification of attempt {} for {} failed", attempt.attemptNumber(), requestId, e);
            verdict = ResultVerifier.Verdict.rejected("verification failed: " + e);
        }
        if (!verdict.accepted()) {
            rejectedTotal.incrementAndGet();
            log.info("Attempt {} for {} rejected: {}", attempt.attemptNumber(), requestId, verdict.reason());
            audit("resolution.rejected", requestId, finished.attemptEpoch(), "rejected", Map.of("reason", verdict.reason()));
            scheduleRetry(current, "rejected: " + verdict.reason(), FailureClass.SEMANTIC_REJECTION, false, false);
            return;
        }
        try {
            acceptAttempt(current, finished.attemptEpoch(), attempt, verdict, flight);
        } catch (IllegalTransitionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Recording accepted attempt {} for {} failed", attempt.attemptNumber(), requestId, e);
            inFlight.remove(requestId);
            ResolutionRequest latest = currentFor(requestId, finished.attemptEpoch());
            if (latest != null) {
                scheduleRetry(latest, "recording accepted result failed: " + e, FailureClass.TRANSIENT_INFRASTRUCTURE,
                        false, false);
            }
        }
    }

    private void acceptAttempt(ResolutionRequest current, long epoch, Attempt attempt, ResultVerifier.Verdict verdict,
                               InFlight flight) {
        String requestId = current.requestId();
        ClockReading gating = flight == null ? clockAnchor.now() : flight.gatingClock();
        EvidenceBundle draft = new EvidenceBundle(
                requestId,
                0,
                EvidenceKind.ACCEPTED,
                attempt.codeSource(),
                attempt.attemptNumber(),
                attempt.code(),
                attempt.code() == null ? null : Hashing.sha256Hex(attempt.code()),
                attempt.stdout(),
                attempt.stderr(),
                verdict.outcome(),
                OutcomePricing.price(verdict.outcome()).toString(),
                attempt.sourceEvidence(),
                gating,
                attempt.output() == null ? null : attempt.output().path("reason").asText(null),
                clockAnchor.now().correctedNowMs(),
                null,
                null
        );
        accept(current, epoch, verdict.outcome(), draft);
    }

    private void applyOperatorOutcome(ResolutionRequest request, long epoch, ClockReading clock) {
        AncillaryRules rules = AncillaryRules.parse(request.ancillaryData());
        ResultVerifier.Verdict verdict = verifier.verifyOperator(request.overrideOutcome(), rules);
        if (!verdict.accepted()) {
            inFlight.remove(request.requestId());
            audit("operator.outcome", request.requestId(), epoch, "rejected", Map.of("reason", verdict.reason()));
            scheduleRetry(request, "operator outcome rejected: " + verdict.reason(), FailureClass.SEMANTIC_REJECTION,
                    false, true);
            return;
        }
        EvidenceBundle draft = new EvidenceBundle(
                request.requestId(),
                0,
                EvidenceKind.ACCEPTED,
                DecisionSource.OPERATOR,
                request.attemptCount(),
                null,
                null,
                null,
                null,
                verdict.outcome(),
                OutcomePricing.price(verdict.outcome()).toString(),
                List.of(),
                clock,
                request.overrideReason(),
                clock.correctedNowMs(),
                null,
                null
        );
        accept(request, epoch, verdict.outcome(), draft);
    }

    private void accept(ResolutionRequest request, long epoch, Outcome outcome, EvidenceBundle draft) {
        String requestId = request.requestId();
        long now = clockAnchor.now().correctedNowMs();
        EvidenceBundle stored = evidence.put(requestId, draft);
        LifecycleStore.TransitionResult marked = store.markAccepted(requestId, epoch, stored.revision(), now);
        if (!marked.applied()) {
            inFlight.remove(requestId);
            discard(requestId, epoch, "accepted result superseded");
            return;
        }
        log.info("Accepted {} for {} (revision {}, source {})", outcome.describe(), requestId, stored.revision(),
                stored.decisionSource());
        audit("resolution.accepted", requestId, epoch, "ok", Map.of(
                "outcome", outcome.describe(),
                "revision", stored.revision(),
                "evidence_hash", stored.evidenceHash(),
                "source", String.valueOf(stored.decisionSource())
        ));
        dispatchSettlement(marked.request(), epoch, outcome, stored);
    }

    private void resumeSettlement(ResolutionRequest request, long epoch) {
        String requestId = request.requestId();
        Optional<SettlementRecord> live = store.liveSettlement(requestId);
        Integer revision = live.map(SettlementRecord::evidenceRevision).orElse(request.acceptedRevision());
        Optional<EvidenceBundle> bundle = revision == null ? Optional.empty() : evidence.findRevision(requestId, revision);
        if (bundle.isEmpty() || bundle.get().outcome() == null) {
            inFlight.remove(requestId);
            log.warn("Accepted evidence for {} missing; resolving again", requestId);
            scheduleRetry(request, "accepted evidence missing", FailureClass.TRANSIENT_INFRASTRUCTURE, true, false);
            return;
        }
        log.info("Resuming settlement for {} from evidence revision {}", requestId, revision);
        dispatchSettlement(request, epoch, bundle.get().outcome(), bundle.get());
    }

    private void dispatchSettlement(ResolutionRequest request, long epoch, Outcome outcome, EvidenceBundle bundle) {
        String requestId = request.requestId();
        inFlight.compute(requestId, (id, previous) -> new InFlight(epoch, Kind.SETTLEMENT_RESUME,
                previous == null ? bundle.clockProof() : previous.gatingClock()));
        submitTask(settlementWorkers, requestId, epoch, false, () -> {
            SettlementOutcome result = submitter.submit(request, outcome, bundle.evidenceHash(), bundle.revision());
            post(new EngineEvent.SettlementFinished(requestId, epoch, bundle.revision(), result));
        });
    }

    private void onSettlementFinished(EngineEvent.SettlementFinished finished) {
        String requestId = finished.requestId();
        inFlight.remove(requestId);
        SettlementOutcome result = finished.outcome();
        long now = clockAnchor.now().correctedNowMs();
        switch (result.kind()) {
            case CONFIRMED -> {
                SettlementRecord record = result.record();
                evidence.stampSettlement(requestId, record.evidenceRevision(), record.txHash());
                LifecycleStore.TransitionResult done = store.finalizeSettled(requestId, finished.attemptEpoch(), now);
                if (done.applied()) {
                    settledTotal.incrementAndGet();
                    queue.remove(requestId);
                    log.info("Request {} settled tx={}", requestId, record.txHash());
                    audit("settlement.confirmed", requestId, finished.attemptEpoch(), "ok", Map.of(
                            "tx_hash", record.txHash(),
                            "price", record.submittedPrice(),
                            "nonce", record.nonce()
                    ));
                } else {
                    log.warn("Settlement for {} confirmed but lifecycle moved on ({}); will reconcile", requestId,
                            done.request() == null ? "missing" : done.request().state());
                    rescheduleIfActive(requestId);
                }
            }
            case ALREADY_SETTLED -> {
                ResolutionRequest current = store.get(requestId).orElse(null);
                if (current != null && !current.state().isTerminal()) {
                    finalizeExternal(current, "settled on-chain by another resolver");
                }
            }
            case TRANSIENT_FAILURE -> {
                ResolutionRequest current = currentFor(requestId, finished.attemptEpoch());
                if (current != null) {
                    log.warn("Settlement for {} failed transiently: {}", requestId, result.error());
                    scheduleRetry(current, result.error(), FailureClass.TRANSIENT_INFRASTRUCTURE, false, false);
                }
            }
            case PERMANENT_FAILURE -> {
                ResolutionRequest current = currentFor(requestId, finished.attemptEpoch());
                if (current != null) {
                    log.error("Settlement for {} failed permanently{}: {}", requestId,
                            result.unauthorized() ? " (signer not authorized)" : "", result.error());
                    audit("settlement.failed", requestId, finished.attemptEpoch(), "failed", Map.of(
                            "error", result.error(),
                            "unauthorized", result.unauthorized()
                    ));
                    scheduleRetry(current, result.error(), FailureClass.AUTHORIZATION_PERMANENT, true, result.unauthorized());
                }
            }
        }
    }

    private void onTaskCrashed(EngineEvent.TaskCrashed crashed) {
        String requestId = crashed.requestId();
        InFlight flight = inFlight.get(requestId);
        if (flight != null && flight.epoch() == crashed.attemptEpoch()) {
            inFlight.remove(requestId);
        }
        if (crashed.execution()) {
            runningExecutions.decrementAndGet();
        }
        ResolutionRequest current = currentFor(requestId, crashed.attemptEpoch());
        if (current != null) {
            scheduleRetry(current, "task crashed: " + crashed.error(), FailureClass.TRANSIENT_INFRASTRUCTURE, false, false);
        }
    }

    private void onObserved(WatchEvent event) {
        String requestId = event.requestId();
        ResolutionRequest current = store.get(requestId).orElse(null);
        if (current == null || current.state().isTerminal()) {
            return;
        }
        switch (event.kind()) {
            case NEW, CHANGED -> {
                if (!inFlight.containsKey(requestId)) {
                    queue.schedule(requestId, dueAt(current));
                }
            }
            case GONE -> {
                Optional<SettlementRecord> live = store.liveSettlement(requestId);
                if (live.isPresent() && live.get().confirmationState() == ConfirmationState.PENDING) {
                    log.info("Request {} left the outstanding set while our tx {} is pending", requestId, live.get().txHash());
                    return;
                }
                if (live.isPresent()) {
                    // Our own confirmed settlement; finish through the settlement path.
                    if (!inFlight.containsKey(requestId)) {
                        queue.schedule(requestId, Long.MIN_VALUE);
                    }
                    return;
                }
                finalizeExternal(current, "settled on-chain by another resolver");
            }
        }
    }

    private void finalizeExternal(ResolutionRequest current, String reason) {
        String requestId = current.requestId();
        ClockReading clock = clockAnchor.now();
        LifecycleStore.TransitionResult done = store.finalizeExternal(requestId, reason, clock.correctedNowMs());
        if (!done.applied()) {
            log.debug("External finalization of {} skipped: {}", requestId, done.message());
            return;
        }
        externalTotal.incrementAndGet();
        queue.remove(requestId);
        log.info("Request {} finalized externally: {}", requestId, reason);
        Integer revision = recordTerminalEvidence(requestId, new EvidenceBundle(
                requestId,
                0,
                EvidenceKind.EXTERNAL,
                DecisionSource.EXTERNAL,
                current.attemptCount(),
                null,
                null,
                null,
                null,
                null,
                null,
                List.of(),
                clock,
                reason,
                clock.correctedNowMs(),
                null,
                null
        ));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("evidence_revision", revision == null ? -1 : revision);
        details.put("in_flight", inFlight.containsKey(requestId));
        audit("lifecycle.external", requestId, done.request().attemptEpoch(), "ok", details);
    }

    private void defaultRequest(ResolutionRequest request, ClockReading clock) {
        String requestId = request.requestId();
        Outcome outcome = Outcome.binary(settings.get().defaultOutcome());
        String reason = "deadline passed"
                + (request.lastError() == null ? " before any accepted attempt" : "; last error: " + request.lastError());
        LifecycleStore.TransitionResult done = store.finalizeDefaulted(requestId, reason, clock.correctedNowMs());
        if (!done.applied()) {
            log.debug("Default of {} skipped: {}", requestId, done.message());
            return;
        }
        defaultedTotal.incrementAndGet();
        log.info("Request {} defaulted to {} after {} attempts", requestId, outcome.describe(), request.attemptCount());
        Integer revision = recordTerminalEvidence(requestId, new EvidenceBundle(
                requestId,
                0,
                EvidenceKind.DEFAULTED,
                DecisionSource.DEFAULT,
                request.attemptCount(),
                null,
                null,
                null,
                null,
                outcome,
                OutcomePricing.price(outcome).toString(),
                List.of(),
                clock,
                reason,
                clock.correctedNowMs(),
                null,
                null
        ));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("outcome", outcome.describe());
        details.put("attempts", request.attemptCount());
        details.put("evidence_revision", revision == null ? -1 : revision);
        audit("lifecycle.defaulted", requestId, done.request().attemptEpoch(), "ok", details);
    }

    /**
     * Written only after the terminal transition applied, so a superseded finalization leaves no bundle.
     */
    private Integer recordTerminalEvidence(String requestId, EvidenceBundle bundle) {
        try {
            return evidence.put(requestId, bundle).revision();
        } catch (RuntimeException e) {
            log.error("Evidence for finalized {} ({}) could not be written", requestId, bundle.kind(), e);
            audit("evidence.write_failed", requestId, null, "error", Map.of(
                    "kind", String.valueOf(bundle.kind()),
                    "error", String.valueOf(e.getMessage())
            ));
            return null;
        }
    }

    private void scheduleRetry(ResolutionRequest current, String error, FailureClass failureClass,
                               boolean clearAccepted, boolean needsOperator) {
        String requestId = current.requestId();
        long now = clockAnchor.now().correctedNowMs();
        long next = now + policy(settings.get()).backoffMs(Math.max(1, current.attemptCount()));
        LifecycleStore.TransitionResult done = store.completeWithRetry(requestId, current.attemptEpoch(),
                new LifecycleStore.RetryUpdate(error, failureClass, next, needsOperator, clearAccepted, now));
        if (!done.applied()) {
            discard(requestId, current.attemptEpoch(), "retry superseded");
            return;
        }
        queue.schedule(requestId, Math.min(next, current.deadlineAtMs()));
        audit("resolution.retry", requestId, current.attemptEpoch(), "retry", Map.of(
                "error", error == null ? "" : error,
                "failure_class", failureClass == null ? "" : failureClass.name(),
                "next_eligible_at_ms", next,
                "needs_operator", needsOperator
        ));
    }

    /**
     * Current record when the completing task still owns the request; otherwise discards and returns null.
     */
    private ResolutionRequest currentFor(String requestId, long attemptEpoch) {
        ResolutionRequest current = store.get(requestId).orElse(null);
        if (current == null || current.state().isTerminal() || current.attemptEpoch() != attemptEpoch) {
            discard(requestId, attemptEpoch, current == null ? "request unknown"
                    : current.state().isTerminal() ? "request already " + current.finalization()
                    : "attempt epoch superseded");
            return null;
        }
        return current;
    }

    private void discard(String requestId, long attemptEpoch, String reason) {
        discardedTotal.incrementAndGet();
        log.info("Discarding result for {} epoch {}: {}", requestId, attemptEpoch, reason);
        audit("resolution.discarded", requestId, attemptEpoch, "discarded", Map.of("reason", reason));
        rescheduleIfActive(requestId);
    }

    private void rescheduleIfActive(String requestId) {
        if (inFlight.containsKey(requestId)) {
            return;
        }
        store.get(requestId).filter(r -> !r.state().isTerminal())
                .ifPresent(r -> queue.schedule(requestId, dueAt(r)));
    }

    private static long dueAt(ResolutionRequest request) {
        long due = request.earliestResolveAtMs();
        if (request.nextEligibleAtMs() != null) {
            due = Math.max(due, request.nextEligibleAtMs());
        }
        return Math.min(due, request.deadlineAtMs());
    }

    private static RetryPolicy policy(EngineSettings settings) {
        return new RetryPolicy(settings.maxAttempts(), settings.baseBackoffMs(), settings.maxBackoffMs());
    }

    private void audit(String action, String requestId, Long epoch, String result, Map<String, Object> details) {
        audit.log(AuditLogger.AuditEvent.of(action, ACTOR, "request/" + requestId, result, requestId, epoch, details));
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public int runningExecutions() {
        return runningExecutions.get();
    }

    public synchronized int queuedCount() {
        return queue.size();
    }

    public Map<String, Long> counters() {
        Map<String, Long> out = new LinkedHashMap<>();
        out.put("dispatched", dispatchedTotal.get());
        out.put("rejected", rejectedTotal.get());
        out.put("settled", settledTotal.get());
        out.put("defaulted", defaultedTotal.get());
        out.put("external", externalTotal.get());
        out.put("discarded", discardedTotal.get());
        out.put("stale_clock_ticks", staleClockTicks.get());
        return out;
    }

    private enum Kind {
        EXECUTION,
        OPERATOR,
        SETTLEMENT_RESUME
    }

    private enum Evaluation {
        DISPATCHED,
        DEFAULTED,
        SKIPPED
    }

    private record InFlight(long epoch, Kind kind, ClockReading gatingClock) {
    }

    public record TickReport(int dispatched, int defaulted, int deferred, boolean clockStale, int eventsProcessed) {
    }
}
