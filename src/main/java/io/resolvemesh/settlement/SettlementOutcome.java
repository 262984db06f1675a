package io.resolvemesh.settlement;

import io.resolvemesh.model.SettlementRecord;

public record SettlementOutcome(Kind kind, SettlementRecord record, String error, boolean unauthorized) {
    public enum Kind {
        CONFIRMED,
        ALREADY_SETTLED,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    public static SettlementOutcome confirmed(SettlementRecord record) {
        return new SettlementOutcome(Kind.CONFIRMED, record, null, false);
    }

    public static SettlementOutcome alreadySettled(SettlementRecord record) {
        return new SettlementOutcome(Kind.ALREADY_SETTLED, record, null, false);
    }

    public static SettlementOutcome transientFailure(SettlementRecord record, String error) {
        return new SettlementOutcome(Kind.TRANSIENT_FAILURE, record, error, false);
    }

    public static SettlementOutcome permanentFailure(SettlementRecord record, String error, boolean unauthorized) {
        return new SettlementOutcome(Kind.PERMANENT_FAILURE, record, error, unauthorized);
    }
}
