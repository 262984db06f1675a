package io.resolvemesh.scheduler;

import io.resolvemesh.model.Attempt;
import io.resolvemesh.settlement.SettlementOutcome;
import io.resolvemesh.watch.WatchEvent;

/**
 * Messages posted to the coordinator. Worker tasks report through these instead of touching
 * scheduler state.
 */
public interface EngineEvent {
    String requestId();

    record ExecutionFinished(String requestId, long attemptEpoch, Attempt attempt) implements EngineEvent {
    }

    record SettlementFinished(String requestId, long attemptEpoch, int evidenceRevision, SettlementOutcome outcome)
            implements EngineEvent {
    }

    record TaskCrashed(String requestId, long attemptEpoch, boolean execution, String error) implements EngineEvent {
    }

    record Observed(WatchEvent event) implements EngineEvent {
        @Override
        public String requestId() {
            return event.requestId();
        }
    }

    /**
     * Re-evaluate a request now, typically after an operator action.
     */
    record Wake(String requestId) implements EngineEvent {
    }
}
