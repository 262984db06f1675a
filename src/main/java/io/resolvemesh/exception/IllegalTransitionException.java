package io.resolvemesh.exception;

import io.resolvemesh.model.Finalization;
import io.resolvemesh.model.LifecycleState;

public class IllegalTransitionException extends ResolveMeshException {
    private final String requestId;
    private final LifecycleState from;
    private final LifecycleState to;

    public IllegalTransitionException(String requestId, LifecycleState from, LifecycleState to, Finalization finalization) {
        super("Illegal transition for " + requestId + ": " + from + " -> " + to
                + (finalization == null ? "" : "(" + finalization + ")"));
        this.requestId = requestId;
        this.from = from;
        this.to = to;
    }

    public String requestId() {
        return requestId;
    }

    public LifecycleState from() {
        return from;
    }

    public LifecycleState to() {
        return to;
    }
}
