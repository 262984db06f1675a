package io.resolvemesh.storage;

import io.resolvemesh.exception.EvidenceNotFoundException;
import io.resolvemesh.model.EvidenceBundle;

import java.util.List;
import java.util.Optional;

/**
 * Keyed, write-once evidence persistence. Each {@link #put} writes a new revision; a revision is
 * never rewritten. The settlement transaction hash is attached to a revision exactly once.
 */
public interface EvidenceStore {
    EvidenceBundle put(String requestId, EvidenceBundle bundle);

    Optional<EvidenceBundle> find(String requestId);

    Optional<EvidenceBundle> findRevision(String requestId, int revision);

    List<Integer> revisions(String requestId);

    EvidenceBundle stampSettlement(String requestId, int revision, String txHash);

    default EvidenceBundle get(String requestId) {
        return find(requestId).orElseThrow(() -> new EvidenceNotFoundException(requestId));
    }
}
