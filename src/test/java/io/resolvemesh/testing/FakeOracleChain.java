package io.resolvemesh.testing;

import io.resolvemesh.chain.OracleChain;
import io.resolvemesh.chain.SettlementTransaction;
import io.resolvemesh.chain.TxReceipt;
import io.resolvemesh.exception.SettlementRevertedException;
import io.resolvemesh.exception.TransientChainException;
import io.resolvemesh.model.RequestView;
import io.resolvemesh.util.Hashing;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * In-memory oracle contract. Successful settlements confirm immediately unless confirmation is
 * held, and remove the request from the outstanding set.
 */
public final class FakeOracleChain implements OracleChain {
    private final Map<String, RequestView> outstanding = new LinkedHashMap<>();
    private final Set<String> settled = new HashSet<>();
    private final List<SettlementTransaction> submitted = new ArrayList<>();
    private final Map<String, TxReceipt> receipts = new HashMap<>();
    private final Map<String, SettlementTransaction> pending = new HashMap<>();
    private long nextNonce;
    private long block = 100L;
    private int transientSubmitFailures;
    private boolean listFails;
    private boolean holdConfirmation;
    private String revertReceiptReason;
    private String rejectSubmitReason;
    private volatile CountDownLatch listingGate;
    private Consumer<SettlementTransaction> submitHook;

    public synchronized RequestView publish(RequestView view) {
        outstanding.put(view.requestId(), view);
        return view;
    }

    public synchronized void settleExternally(String requestId) {
        outstanding.remove(requestId);
        settled.add(requestId);
    }

    public synchronized void withdraw(String requestId) {
        outstanding.remove(requestId);
    }

    public synchronized void failNextSubmits(int count) {
        transientSubmitFailures = count;
    }

    public synchronized void failListing(boolean fail) {
        listFails = fail;
    }

    /**
     * Blocks every listing call until the returned latch is counted down.
     */
    public CountDownLatch stallListing() {
        CountDownLatch gate = new CountDownLatch(1);
        listingGate = gate;
        return gate;
    }

    /**
     * Forgets every held transaction without mining it; the sender's nonce stays unconsumed.
     */
    public synchronized void dropHeld() {
        for (SettlementTransaction tx : pending.values()) {
            nextNonce = Math.min(nextNonce, tx.nonce());
        }
        pending.clear();
    }

    /**
     * Runs before each broadcast; an exception from the hook aborts the send.
     */
    public synchronized void beforeSubmit(Consumer<SettlementTransaction> hook) {
        submitHook = hook;
    }

    public synchronized void holdConfirmation(boolean hold) {
        holdConfirmation = hold;
    }

    public synchronized void revertReceipts(String reason) {
        revertReceiptReason = reason;
    }

    public synchronized void rejectSubmits(String reason) {
        rejectSubmitReason = reason;
    }

    public synchronized void setNextNonce(long nonce) {
        nextNonce = nonce;
    }

    /**
     * Mines every held transaction successfully.
     */
    public synchronized void confirmHeld() {
        for (SettlementTransaction tx : pending.values()) {
            confirm(txHash(tx), tx);
        }
        pending.clear();
    }

    public synchronized List<SettlementTransaction> submitted() {
        return List.copyOf(submitted);
    }

    @Override
    public List<RequestView> listOutstanding() {
        CountDownLatch gate = listingGate;
        if (gate != null) {
            try {
                if (!gate.await(30, TimeUnit.SECONDS)) {
                    throw new TransientChainException("listing stalled");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientChainException("listing interrupted");
            }
        }
        synchronized (this) {
            if (listFails) {
                throw new TransientChainException("rpc timeout listing requests");
            }
            return new ArrayList<>(outstanding.values());
        }
    }

    @Override
    public synchronized boolean isSettled(String requestId) {
        return settled.contains(requestId);
    }

    @Override
    public synchronized long nextNonce(String signer) {
        return nextNonce;
    }

    @Override
    public synchronized String submitSettlement(SettlementTransaction tx) {
        if (submitHook != null) {
            submitHook.accept(tx);
        }
        if (transientSubmitFailures > 0) {
            transientSubmitFailures--;
            throw new TransientChainException("rpc timeout sending transaction");
        }
        if (rejectSubmitReason != null) {
            throw new SettlementRevertedException(rejectSubmitReason, rejectSubmitReason.contains("authorized"));
        }
        submitted.add(tx);
        nextNonce = Math.max(nextNonce, tx.nonce() + 1L);
        String hash = txHash(tx);
        if (revertReceiptReason != null) {
            receipts.put(hash, TxReceipt.reverted(hash, revertReceiptReason, ++block));
        } else if (holdConfirmation) {
            pending.put(hash, tx);
        } else {
            confirm(hash, tx);
        }
        return hash;
    }

    @Override
    public String transactionHash(SettlementTransaction tx) {
        return txHash(tx);
    }

    @Override
    public synchronized Optional<TxReceipt> receipt(String txHash) {
        return Optional.ofNullable(receipts.get(txHash));
    }

    private void confirm(String hash, SettlementTransaction tx) {
        receipts.put(hash, TxReceipt.success(hash, ++block));
        settled.add(tx.requestId());
        outstanding.remove(tx.requestId());
    }

    private static String txHash(SettlementTransaction tx) {
        return "0x" + Hashing.sha256Hex(tx.requestId() + "|" + tx.nonce() + "|" + tx.price());
    }
}
