package io.resolvemesh.settlement;

import io.resolvemesh.chain.OracleChain;
import io.resolvemesh.exception.TransientChainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Serializes nonce allocation for the single signing credential. A nonce is reserved before signing,
 * marked used once broadcast, and recycled when the send fails before broadcast.
 */
public final class NonceAllocator {
    private static final Logger log = LoggerFactory.getLogger(NonceAllocator.class);

    private final OracleChain chain;
    private final String signer;
    private final TreeMap<Long, NonceStatus> nonces = new TreeMap<>();
    private long highestUsed = -1L;

    public NonceAllocator(OracleChain chain, String signer) {
        this.chain = Objects.requireNonNull(chain, "chain");
        this.signer = Objects.requireNonNull(signer, "signer");
    }

    public synchronized long reserve() throws TransientChainException {
        for (Map.Entry<Long, NonceStatus> e : nonces.entrySet()) {
            if (e.getValue() == NonceStatus.RECYCLABLE) {
                e.setValue(NonceStatus.RESERVED);
                return e.getKey();
            }
        }
        long base = Math.max(chain.nextNonce(signer), highestUsed + 1L);
        long candidate = base;
        while (nonces.get(candidate) == NonceStatus.RESERVED || nonces.get(candidate) == NonceStatus.USED) {
            candidate++;
        }
        nonces.put(candidate, NonceStatus.RESERVED);
        return candidate;
    }

    public synchronized void markUsed(long nonce) {
        nonces.put(nonce, NonceStatus.USED);
        highestUsed = Math.max(highestUsed, nonce);
        // Used entries below the highest are never handed out again.
        nonces.headMap(highestUsed, false).entrySet().removeIf(e -> e.getValue() == NonceStatus.USED);
    }

    public synchronized void recycle(long nonce) {
        NonceStatus status = nonces.get(nonce);
        if (status == NonceStatus.USED) {
            log.warn("Refusing to recycle broadcast nonce {} for {}", nonce, signer);
            return;
        }
        nonces.put(nonce, NonceStatus.RECYCLABLE);
    }

    /**
     * Puts a broadcast nonce back into the pool once its transaction was dropped. Returns false when
     * the chain has already consumed the nonce.
     */
    public synchronized boolean reclaimIfUnconsumed(long nonce) throws TransientChainException {
        if (chain.nextNonce(signer) > nonce) {
            return false;
        }
        nonces.put(nonce, NonceStatus.RECYCLABLE);
        log.info("Reclaimed dropped nonce {} for {}", nonce, signer);
        return true;
    }

    public synchronized int reservedCount() {
        return (int) nonces.values().stream().filter(s -> s == NonceStatus.RESERVED).count();
    }

    private enum NonceStatus {
        RESERVED,
        USED,
        RECYCLABLE
    }
}
