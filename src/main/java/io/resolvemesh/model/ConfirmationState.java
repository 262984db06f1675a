package io.resolvemesh.model;

public enum ConfirmationState {
    PENDING,
    CONFIRMED,
    FAILED;

    public boolean isLive() {
        return this != FAILED;
    }
}
