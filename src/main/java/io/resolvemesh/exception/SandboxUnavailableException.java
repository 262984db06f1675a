package io.resolvemesh.exception;

public class SandboxUnavailableException extends ResolveMeshException {
    public SandboxUnavailableException(String message) {
        super(message);
    }

    public SandboxUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
