package io.resolvemesh.chain;

import io.resolvemesh.exception.SettlementRevertedException;
import io.resolvemesh.exception.TransientChainException;
import io.resolvemesh.model.RequestView;

import java.util.List;
import java.util.Optional;

/**
 * On-chain request source and settlement sink. Eventually consistent: a request may read as
 * settled slightly before or after its settlement receipt is observable.
 */
public interface OracleChain {
    List<RequestView> listOutstanding() throws TransientChainException;

    boolean isSettled(String requestId) throws TransientChainException;

    long nextNonce(String signer) throws TransientChainException;

    /**
     * Hash the signed transaction will carry, known before it is broadcast. Sending the same
     * transaction again yields the same hash.
     */
    String transactionHash(SettlementTransaction tx);

    /**
     * Signs and broadcasts; returns the transaction hash. A revert detected before broadcast
     * (for example during gas estimation) raises {@link SettlementRevertedException}.
     */
    String submitSettlement(SettlementTransaction tx) throws TransientChainException, SettlementRevertedException;

    Optional<TxReceipt> receipt(String txHash) throws TransientChainException;
}
