package io.resolvemesh.settlement;

import io.resolvemesh.chain.OracleChain;
import io.resolvemesh.chain.ResolverAuthorization;
import io.resolvemesh.chain.SettlementTransaction;
import io.resolvemesh.chain.TxReceipt;
import io.resolvemesh.config.EngineSettings;
import io.resolvemesh.exception.SettlementRevertedException;
import io.resolvemesh.exception.TransientChainException;
import io.resolvemesh.model.ConfirmationState;
import io.resolvemesh.model.Outcome;
import io.resolvemesh.model.ResolutionRequest;
import io.resolvemesh.model.SettlementRecord;
import io.resolvemesh.storage.LifecycleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Turns an accepted outcome into one on-chain settlement. Transaction-level retries (send failures,
 * confirmation polling) happen here and never re-run resolution. At most one live settlement exists
 * per request; a repeated call after confirmation returns the existing record.
 */
public final class SettlementSubmitter {
    private static final Logger log = LoggerFactory.getLogger(SettlementSubmitter.class);

    private final OracleChain chain;
    private final ResolverAuthorization authorization;
    private final NonceAllocator nonces;
    private final LifecycleStore store;
    private final Supplier<EngineSettings> settings;
    private final Clock clock;

    public SettlementSubmitter(
            OracleChain chain,
            ResolverAuthorization authorization,
            NonceAllocator nonces,
            LifecycleStore store,
            Supplier<EngineSettings> settings,
            Clock clock
    ) {
        this.chain = Objects.requireNonNull(chain, "chain");
        this.authorization = Objects.requireNonNull(authorization, "authorization");
        this.nonces = Objects.requireNonNull(nonces, "nonces");
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SettlementOutcome submit(ResolutionRequest request, Outcome outcome, String evidenceHash, int evidenceRevision) {
        String requestId = request.requestId();
        Optional<SettlementRecord> live = store.liveSettlement(requestId);
        if (live.isPresent()) {
            SettlementRecord existing = live.get();
            if (existing.confirmationState() == ConfirmationState.CONFIRMED) {
                return SettlementOutcome.confirmed(existing);
            }
            log.info("Resuming confirmation wait for {} tx={}", requestId, existing.txHash());
            return awaitConfirmation(existing);
        }

        try {
            if (chain.isSettled(requestId)) {
                log.info("Request {} already settled on-chain; skipping submission", requestId);
                return SettlementOutcome.alreadySettled(null);
            }
        } catch (TransientChainException e) {
            return SettlementOutcome.transientFailure(null, "pre-submit settlement check failed: " + e.getMessage());
        }

        EngineSettings current = settings.get();
        String signer = current.signer();
        if (!authorization.isAuthorized(signer)) {
            return SettlementOutcome.permanentFailure(null, "signer " + signer + " is not an authorized resolver", true);
        }

        BigInteger price = OutcomePricing.price(outcome);
        int tries = Math.max(1, current.settlementTxRetries());
        String lastError = null;
        SettlementTransaction tx = null;
        SettlementRecord pending = null;
        for (int attempt = 1; attempt <= tries; attempt++) {
            if (attempt > 1 && !pause(current.settlementTxRetryBackoffMs() * (attempt - 1))) {
                lastError = "interrupted before settlement retry";
                break;
            }
            if (tx == null) {
                long nonce;
                try {
                    nonce = nonces.reserve();
                } catch (TransientChainException e) {
                    lastError = "nonce lookup failed: " + e.getMessage();
                    log.warn("Settlement send {}/{} for {} failed: {}", attempt, tries, requestId, lastError);
                    continue;
                }
                tx = new SettlementTransaction(
                        requestId,
                        request.identifier(),
                        request.requestTimestamp(),
                        request.ancillaryData(),
                        price,
                        evidenceHash,
                        signer,
                        nonce
                );
                // The PENDING row exists before the transaction can reach the chain.
                pending = store.insertPendingSettlement(requestId, chain.transactionHash(tx), price.toString(), nonce,
                        evidenceHash, evidenceRevision, clock.millis());
            }
            String broadcastHash;
            try {
                broadcastHash = chain.submitSettlement(tx);
            } catch (TransientChainException e) {
                lastError = e.getMessage();
                log.warn("Settlement send {}/{} for {} failed: {}", attempt, tries, requestId, lastError);
                continue;
            } catch (SettlementRevertedException e) {
                SettlementRecord failed = store.markSettlementFailed(pending.txHash(),
                        "rejected before broadcast: " + e.getMessage(), clock.millis());
                nonces.recycle(tx.nonce());
                return SettlementOutcome.permanentFailure(failed, "settlement rejected: " + e.getMessage(), e.unauthorized());
            }
            if (!pending.txHash().equals(broadcastHash)) {
                log.warn("Chain reported tx {} for {} but {} was recorded", broadcastHash, requestId, pending.txHash());
            }
            nonces.markUsed(tx.nonce());
            log.info("Submitted settlement for {} tx={} nonce={} price={}", requestId, pending.txHash(), tx.nonce(), price);
            return awaitConfirmation(pending);
        }
        if (pending != null) {
            store.markSettlementFailed(pending.txHash(), "send failed: " + lastError, clock.millis());
            nonces.recycle(tx.nonce());
        }
        return SettlementOutcome.transientFailure(null, "settlement send failed after " + tries + " tries: " + lastError);
    }

    private SettlementOutcome awaitConfirmation(SettlementRecord pending) {
        EngineSettings current = settings.get();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(current.settlementConfirmTimeoutMs());
        String lastError = null;
        while (true) {
            Optional<TxReceipt> receipt = Optional.empty();
            try {
                receipt = chain.receipt(pending.txHash());
            } catch (TransientChainException e) {
                lastError = e.getMessage();
                log.debug("Receipt lookup for {} failed: {}", pending.txHash(), lastError);
            }
            if (receipt.isPresent()) {
                return onReceipt(pending, receipt.get());
            }
            if (System.nanoTime() - deadline >= 0L) {
                return onConfirmationTimeout(pending, current, "confirmation timed out after "
                        + current.settlementConfirmTimeoutMs() + "ms" + (lastError == null ? "" : ": " + lastError));
            }
            if (!pause(current.settlementPollIntervalMs())) {
                return SettlementOutcome.transientFailure(pending, "interrupted while awaiting confirmation");
            }
        }
    }

    /**
     * A transaction with no receipt after the configured number of waits is treated as dropped: its
     * record fails, an unconsumed nonce goes back to the pool and the next resume sends again.
     */
    private SettlementOutcome onConfirmationTimeout(SettlementRecord pending, EngineSettings current, String timedOut) {
        SettlementRecord waited = store.recordConfirmationWait(pending.txHash(), clock.millis());
        if (waited.confirmationWaits() < current.settlementMaxConfirmWaits()) {
            return SettlementOutcome.transientFailure(waited, timedOut);
        }
        String reason = "no receipt after " + waited.confirmationWaits() + " confirmation waits";
        try {
            if (chain.isSettled(pending.requestId())) {
                SettlementRecord failed = store.markSettlementFailed(pending.txHash(), reason + "; request settled on-chain",
                        clock.millis());
                return SettlementOutcome.alreadySettled(failed);
            }
            boolean reclaimed = nonces.reclaimIfUnconsumed(pending.nonce());
            SettlementRecord failed = store.markSettlementFailed(pending.txHash(),
                    reason + (reclaimed ? "; nonce reclaimed" : "; nonce consumed"), clock.millis());
            log.warn("Settlement tx {} for {} treated as dropped: {}", pending.txHash(), pending.requestId(), failed.error());
            return SettlementOutcome.transientFailure(failed, "settlement tx dropped: " + failed.error());
        } catch (TransientChainException e) {
            return SettlementOutcome.transientFailure(waited, timedOut + "; drop check failed: " + e.getMessage());
        }
    }

    private SettlementOutcome onReceipt(SettlementRecord pending, TxReceipt receipt) {
        if (receipt.success()) {
            SettlementRecord confirmed = store.markSettlementConfirmed(pending.txHash(), clock.millis());
            log.info("Settlement confirmed for {} tx={} block={}", pending.requestId(), pending.txHash(), receipt.blockNumber());
            return SettlementOutcome.confirmed(confirmed);
        }
        String reason = receipt.revertReason() == null ? "reverted" : receipt.revertReason();
        SettlementRecord failed = store.markSettlementFailed(pending.txHash(), reason, clock.millis());
        try {
            if (chain.isSettled(pending.requestId())) {
                log.info("Settlement tx {} reverted but {} is settled on-chain", pending.txHash(), pending.requestId());
                return SettlementOutcome.alreadySettled(failed);
            }
        } catch (TransientChainException e) {
            log.warn("Post-revert settlement check for {} failed: {}", pending.requestId(), e.getMessage());
        }
        return SettlementOutcome.permanentFailure(failed, "settlement reverted: " + reason, isUnauthorized(reason));
    }

    static boolean isUnauthorized(String reason) {
        if (reason == null) {
            return false;
        }
        String r = reason.toLowerCase(Locale.ROOT);
        return r.contains("unauthori") || r.contains("not trusted") || r.contains("not authorized");
    }

    private static boolean pause(long millis) {
        if (millis <= 0L) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
