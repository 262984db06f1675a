package io.resolvemesh.exception;

public class EvidenceNotFoundException extends ResolveMeshException {
    public EvidenceNotFoundException(String requestId) {
        super("No evidence bundle for request: " + requestId);
    }
}
