package io.resolvemesh.exception;

public class ClockSyncException extends ResolveMeshException {
    public ClockSyncException(String message) {
        super(message);
    }

    public ClockSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
