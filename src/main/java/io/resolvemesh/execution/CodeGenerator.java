package io.resolvemesh.execution;

import io.resolvemesh.exception.CodeGenerationException;

/**
 * Untrusted code source: output is data to be analyzed, executed in the sandbox and verified.
 */
public interface CodeGenerator {
    GeneratedCode generate(String prompt) throws CodeGenerationException;
}
