package io.resolvemesh.model;

public enum DecisionSource {
    TEMPLATE,
    GENERATED,
    OPERATOR,
    DEFAULT,
    EXTERNAL
}
