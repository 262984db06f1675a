package io.resolvemesh.chain;

public record TxReceipt(String txHash, boolean success, String revertReason, long blockNumber) {
    public static TxReceipt success(String txHash, long blockNumber) {
        return new TxReceipt(txHash, true, null, blockNumber);
    }

    public static TxReceipt reverted(String txHash, String reason, long blockNumber) {
        return new TxReceipt(txHash, false, reason, blockNumber);
    }
}
