package io.resolvemesh.execution;

public record GeneratedCode(String code, String model) {
}
