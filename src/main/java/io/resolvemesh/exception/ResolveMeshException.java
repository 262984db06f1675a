package io.resolvemesh.exception;

public class ResolveMeshException extends RuntimeException {
    public ResolveMeshException(String message) {
        super(message);
    }

    public ResolveMeshException(String message, Throwable cause) {
        super(message, cause);
    }
}
