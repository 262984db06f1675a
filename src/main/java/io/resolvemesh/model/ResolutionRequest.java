package io.resolvemesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;

public record ResolutionRequest(
        String requestId,
        String identifier,
        long requestTimestamp,
        String ancillaryData,
        String requester,
        long earliestResolveAtMs,
        long deadlineAtMs,
        LifecycleState state,
        Finalization finalization,
        int attemptCount,
        long attemptEpoch,
        String lastError,
        FailureClass lastErrorClass,
        Long lastAttemptAtMs,
        Long nextEligibleAtMs,
        boolean needsOperator,
        Integer acceptedRevision,
        Decision overrideDecision,
        BigDecimal overrideValue,
        String overrideReason,
        long createdAtMs,
        long updatedAtMs
) {
    public boolean hasOverride() {
        return overrideDecision != null;
    }

    public Outcome overrideOutcome() {
        if (overrideDecision == null) {
            return null;
        }
        return new Outcome(overrideDecision, overrideValue);
    }

    @JsonIgnore
    public boolean isAccepted() {
        return acceptedRevision != null;
    }
}
