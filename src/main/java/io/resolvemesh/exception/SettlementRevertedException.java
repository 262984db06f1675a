package io.resolvemesh.exception;

/**
 * A settlement transaction that failed definitively. Not retried at the transaction level.
 */
public class SettlementRevertedException extends ResolveMeshException {
    private final boolean unauthorized;

    public SettlementRevertedException(String message, boolean unauthorized) {
        super(message);
        this.unauthorized = unauthorized;
    }

    public boolean unauthorized() {
        return unauthorized;
    }
}
