package io.resolvemesh.exception;

public class TransientChainException extends ResolveMeshException {
    public TransientChainException(String message) {
        super(message);
    }

    public TransientChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
