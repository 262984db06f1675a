package io.resolvemesh.model;

public enum Finalization {
    SETTLED,
    DEFAULTED,
    EXTERNAL
}
