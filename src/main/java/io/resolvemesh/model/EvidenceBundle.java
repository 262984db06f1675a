package io.resolvemesh.model;

import java.util.List;

public record EvidenceBundle(
        String requestId,
        int revision,
        EvidenceKind kind,
        DecisionSource decisionSource,
        int attemptNumber,
        String code,
        String codeSha256,
        String stdout,
        String stderr,
        Outcome outcome,
        String price,
        List<SourceEvidence> sources,
        ClockReading clockProof,
        String reason,
        long createdAtMs,
        String evidenceHash,
        String settlementTxHash
) {
    public EvidenceBundle {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public EvidenceBundle withRevision(int newRevision) {
        return new EvidenceBundle(requestId, newRevision, kind, decisionSource, attemptNumber, code, codeSha256, stdout,
                stderr, outcome, price, sources, clockProof, reason, createdAtMs, evidenceHash, settlementTxHash);
    }

    public EvidenceBundle withEvidenceHash(String hash) {
        return new EvidenceBundle(requestId, revision, kind, decisionSource, attemptNumber, code, codeSha256, stdout,
                stderr, outcome, price, sources, clockProof, reason, createdAtMs, hash, settlementTxHash);
    }

    public EvidenceBundle withSettlementTxHash(String txHash) {
        return new EvidenceBundle(requestId, revision, kind, decisionSource, attemptNumber, code, codeSha256, stdout,
                stderr, outcome, price, sources, clockProof, reason, createdAtMs, evidenceHash, txHash);
    }
}
