package io.resolvemesh.watch;

import io.resolvemesh.chain.OracleChain;
import io.resolvemesh.config.EngineSettings;
import io.resolvemesh.exception.TransientChainException;
import io.resolvemesh.model.ConfirmationState;
import io.resolvemesh.model.RequestView;
import io.resolvemesh.model.ResolutionRequest;
import io.resolvemesh.rules.AncillaryRules;
import io.resolvemesh.storage.LifecycleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Mirrors the on-chain outstanding set into the lifecycle store. Re-observing an unchanged request is a
 * no-op. A tracked request that leaves the outstanding set is reported gone only after the chain
 * confirms it settled and no settlement of ours is still pending.
 */
public final class RequestWatcher {
    private static final Logger log = LoggerFactory.getLogger(RequestWatcher.class);

    private final OracleChain chain;
    private final LifecycleStore store;
    private final Supplier<EngineSettings> settings;

    public RequestWatcher(OracleChain chain, LifecycleStore store, Supplier<EngineSettings> settings) {
        this.chain = Objects.requireNonNull(chain, "chain");
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Finite, restartable view of the currently outstanding requests. Each call queries the chain anew.
     */
    public Stream<RequestView> poll() {
        return Stream.of(chain).flatMap(c -> c.listOutstanding().stream());
    }

    public List<WatchEvent> scan(long nowMs) {
        EngineSettings current = settings.get();
        List<WatchEvent> events = new ArrayList<>();
        Set<String> outstanding = new HashSet<>();
        poll().forEach(view -> {
            String requestId = view.requestId();
            outstanding.add(requestId);
            AncillaryRules rules = AncillaryRules.parse(view.ancillaryData());
            long earliest = rules.earliestResolveAtMs(view.requestTimestamp(), current.graceSeconds());
            long deadline = rules.deadlineAtMs(earliest, current.resolutionWindowSeconds());
            LifecycleStore.ObserveResult result = store.observe(view, earliest, deadline, nowMs);
            if (result.kind() == LifecycleStore.ObserveKind.NEW) {
                log.info("Observed new request {} identifier={} earliest={} deadline={}",
                        requestId, view.identifier(), earliest, deadline);
                events.add(new WatchEvent(WatchEvent.Kind.NEW, requestId));
            } else if (result.kind() == LifecycleStore.ObserveKind.CHANGED) {
                log.info("Request {} timing or requester changed", requestId);
                events.add(new WatchEvent(WatchEvent.Kind.CHANGED, requestId));
            }
        });

        for (ResolutionRequest tracked : store.listActive()) {
            if (outstanding.contains(tracked.requestId())) {
                continue;
            }
            if (hasPendingSettlement(tracked.requestId())) {
                continue;
            }
            if (confirmedSettled(tracked.requestId())) {
                events.add(new WatchEvent(WatchEvent.Kind.GONE, tracked.requestId()));
            }
        }
        return events;
    }

    private boolean hasPendingSettlement(String requestId) {
        return store.liveSettlement(requestId)
                .map(s -> s.confirmationState() == ConfirmationState.PENDING)
                .orElse(false);
    }

    private boolean confirmedSettled(String requestId) {
        try {
            return chain.isSettled(requestId);
        } catch (TransientChainException e) {
            log.warn("Settlement check for vanished request {} failed, will retry: {}", requestId, e.getMessage());
            return false;
        }
    }
}
