package io.resolvemesh.model;

public record SettlementRecord(
        long id,
        String requestId,
        String txHash,
        String submittedPrice,
        long nonce,
        String evidenceHash,
        int evidenceRevision,
        ConfirmationState confirmationState,
        String error,
        int confirmationWaits,
        long submittedAtMs,
        long updatedAtMs
) {
}
