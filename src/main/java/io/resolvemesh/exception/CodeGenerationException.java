package io.resolvemesh.exception;

public class CodeGenerationException extends ResolveMeshException {
    public CodeGenerationException(String message) {
        super(message);
    }

    public CodeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
