package io.resolvemesh.model;

public enum EvidenceKind {
    ACCEPTED,
    DEFAULTED,
    EXTERNAL
}
