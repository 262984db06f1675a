package io.resolvemesh.model;

public enum FailureClass {
    TRANSIENT_INFRASTRUCTURE,
    SEMANTIC_REJECTION,
    AUTHORIZATION_PERMANENT,
    CONSISTENCY_RACE
}
