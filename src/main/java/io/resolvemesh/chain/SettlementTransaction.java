package io.resolvemesh.chain;

import java.math.BigInteger;

public record SettlementTransaction(
        String requestId,
        String identifier,
        long requestTimestamp,
        String ancillaryData,
        BigInteger price,
        String evidenceHash,
        String signer,
        long nonce
) {
}
